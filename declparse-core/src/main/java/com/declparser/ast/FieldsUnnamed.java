package com.declparser.ast;

import java.util.List;

/**
 * Unnamed fields of a tuple struct or tuple variant such as {@code Some(T)}.
 * No field has an identifier.
 */
public record FieldsUnnamed(Delimiter parenToken, Punctuated<Field> unnamed) implements Fields {
    @Override
    public List<Field> members() {
        return unnamed.values();
    }
}
