package com.declparser.ast;

/**
 * Constant expressions as they appear in enum discriminants and array lengths.
 */
public sealed interface Expr extends Node permits
    ExprLit,
    ExprPath,
    ExprUnary,
    ExprBinary,
    ExprCast,
    ExprParen {
}
