package com.declparser.ast;

import com.declparser.Token;
import com.declparser.TokenType;

/**
 * Restricted, e.g. {@code pub(self)}, {@code pub(super)} or {@code pub(in some::module)}.
 *
 * <p>{@code inToken} is absent when the parser matched the {@code self} or {@code super}
 * shorthand. It is printed exactly as stored, so a tree built by hand with a multi-segment
 * path and no {@code in} prints as written.</p>
 */
public record VisRestricted(
    Token pubToken,
    Delimiter parenToken,
    Token inToken, // Can be null
    Path path
) implements Visibility {
    public static VisRestricted in(Path path) {
        return new VisRestricted(Token.synthetic(TokenType.PUB), Delimiter.parens(), Token.synthetic(TokenType.IN), path);
    }

    public static VisRestricted shorthand(Path path) {
        return new VisRestricted(Token.synthetic(TokenType.PUB), Delimiter.parens(), null, path);
    }
}
