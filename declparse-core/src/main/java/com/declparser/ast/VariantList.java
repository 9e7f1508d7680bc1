package com.declparser.ast;

/**
 * The braced, comma-separated variants of an enum body: {@code { A, B(T), C = 3 }}.
 */
public record VariantList(Delimiter braceToken, Punctuated<Variant> variants) implements Node {
}
