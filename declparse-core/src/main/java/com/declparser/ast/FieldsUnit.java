package com.declparser.ast;

import java.util.List;

/**
 * Unit struct or unit variant such as {@code None}.
 */
public record FieldsUnit() implements Fields {
    @Override
    public List<Field> members() {
        return List.of();
    }
}
