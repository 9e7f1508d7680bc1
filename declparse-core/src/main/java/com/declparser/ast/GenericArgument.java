package com.declparser.ast;

/**
 * One argument in an angle-bracketed list: a type or a lifetime.
 */
public sealed interface GenericArgument permits Type, Lifetime {
}
