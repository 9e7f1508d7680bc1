package com.declparser.ast;

import com.declparser.Token;

public record Lifetime(Token token) implements Node, GenericArgument {
    public String name() {
        return token.lexeme().substring(1);
    }
}
