package com.declparser.ast;

import com.declparser.Token;

public record ExprUnary(Token op, Expr expr) implements Expr {
}
