package com.declparser.parsing.combinator;

/**
 * Constructor shapes for {@link Combinators#seq} with more than two parts.
 */
public final class Functions {
    private Functions() {
    }

    @FunctionalInterface
    public interface F3<A, B, C, R> {
        R apply(A a, B b, C c);
    }

    @FunctionalInterface
    public interface F4<A, B, C, D, R> {
        R apply(A a, B b, C c, D d);
    }

    @FunctionalInterface
    public interface F5<A, B, C, D, E, R> {
        R apply(A a, B b, C c, D d, E e);
    }
}
