package com.declparser.ast;

import com.declparser.Token;
import com.declparser.TokenType;

/**
 * Public, i.e. {@code pub}.
 */
public record VisPublic(Token pubToken) implements Visibility {
    public static VisPublic of() {
        return new VisPublic(Token.synthetic(TokenType.PUB));
    }
}
