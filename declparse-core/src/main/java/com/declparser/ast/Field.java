package com.declparser.ast;

import com.declparser.Token;
import com.declparser.TokenType;

import java.util.List;

/**
 * A field of a struct or enum variant. Fields of tuple structs have no name and no colon.
 */
public record Field(
    List<Attribute> attrs,
    Visibility vis,
    Ident ident,      // Can be null for tuple fields
    Token colonToken, // Null exactly when ident is null
    Type ty
) implements Node {
    public Field {
        attrs = List.copyOf(attrs);
    }

    public static Field named(Visibility vis, String name, Type ty) {
        return new Field(List.of(), vis, Ident.of(name), Token.synthetic(TokenType.COLON), ty);
    }

    public static Field unnamed(Visibility vis, Type ty) {
        return new Field(List.of(), vis, null, null, ty);
    }
}
