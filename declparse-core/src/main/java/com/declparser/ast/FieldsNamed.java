package com.declparser.ast;

import java.util.List;

/**
 * Named fields of a struct or struct variant such as {@code Point { x: f64, y: f64 }}.
 * Every field has an identifier.
 */
public record FieldsNamed(Delimiter braceToken, Punctuated<Field> named) implements Fields {
    @Override
    public List<Field> members() {
        return named.values();
    }
}
