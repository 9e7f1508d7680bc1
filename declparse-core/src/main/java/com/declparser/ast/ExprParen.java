package com.declparser.ast;

public record ExprParen(Delimiter parenToken, Expr expr) implements Expr {
}
