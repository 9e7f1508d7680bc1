package com.declparser.ast;

import com.declparser.Token;
import com.declparser.TokenType;

public record Ident(String name, Token token) implements Node {
    public static Ident of(String name) {
        TokenType keyword = TokenType.keyword(name);
        return new Ident(name, Token.synthetic(keyword != null ? keyword : TokenType.IDENT, name));
    }

    public static Ident from(Token token) {
        return new Ident(token.lexeme(), token);
    }

    public boolean isRaw() {
        return name.startsWith("r#");
    }
}
