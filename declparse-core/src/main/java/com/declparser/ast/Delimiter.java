package com.declparser.ast;

import com.declparser.Token;
import com.declparser.TokenType;

/**
 * The opening and closing tokens of a parenthesized, braced or bracketed group.
 */
public record Delimiter(Token open, Token close) {
    public static Delimiter parens() {
        return new Delimiter(Token.synthetic(TokenType.LPAREN), Token.synthetic(TokenType.RPAREN));
    }

    public static Delimiter braces() {
        return new Delimiter(Token.synthetic(TokenType.LBRACE), Token.synthetic(TokenType.RBRACE));
    }

    public static Delimiter brackets() {
        return new Delimiter(Token.synthetic(TokenType.LBRACKET), Token.synthetic(TokenType.RBRACKET));
    }
}
