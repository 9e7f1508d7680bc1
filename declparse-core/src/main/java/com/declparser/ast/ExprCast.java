package com.declparser.ast;

import com.declparser.Token;

public record ExprCast(Expr expr, Token asToken, Type ty) implements Expr {
}
