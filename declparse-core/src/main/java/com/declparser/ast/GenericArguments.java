package com.declparser.ast;

import com.declparser.Token;

/**
 * Angle-bracketed arguments of a path segment, e.g. the {@code <K, V>} in {@code HashMap<K, V>}.
 */
public record GenericArguments(
    Token colon2, // Can be null; present for turbofish ::<T>
    Token lt,
    Punctuated<GenericArgument> args,
    Token gt
) implements Node {
}
