package com.declparser.ast;

import com.declparser.Token;
import com.declparser.TokenType;

/**
 * Crate-visible, i.e. {@code pub(crate)}.
 */
public record VisCrate(
    Token pubToken,
    Delimiter parenToken,
    Token crateToken
) implements Visibility {
    public static VisCrate of() {
        return new VisCrate(Token.synthetic(TokenType.PUB), Delimiter.parens(), Token.synthetic(TokenType.CRATE));
    }
}
