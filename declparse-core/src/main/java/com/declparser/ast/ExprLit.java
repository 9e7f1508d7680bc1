package com.declparser.ast;

import com.declparser.Token;
import com.declparser.TokenType;

public record ExprLit(Token literal) implements Expr {
    public static ExprLit integer(long value) {
        return new ExprLit(Token.synthetic(TokenType.INTEGER, Long.toString(value)));
    }
}
