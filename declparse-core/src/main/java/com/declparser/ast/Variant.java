package com.declparser.ast;

import com.declparser.Token;

import java.util.List;

/**
 * An enum variant.
 */
public record Variant(
    List<Attribute> attrs,
    Ident ident,
    Fields fields,
    Discriminant discriminant // Can be null; explicit value as in Foo = 1
) implements Node {
    public Variant {
        attrs = List.copyOf(attrs);
    }

    public record Discriminant(Token eqToken, Expr expr) {}
}
