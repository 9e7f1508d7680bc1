package com.declparser.ast;

import com.declparser.Token;

public record ExprBinary(Expr left, Token op, Expr right) implements Expr {
}
