package com.declparser.ast;

public record ExprPath(Path path) implements Expr {
}
