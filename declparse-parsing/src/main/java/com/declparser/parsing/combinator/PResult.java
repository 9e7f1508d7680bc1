package com.declparser.parsing.combinator;

import java.util.function.Function;

/**
 * Outcome of running a {@link Grammar}: a value plus the cursor after it, or the reason it failed.
 */
public sealed interface PResult<T> permits PResult.Success, PResult.Failure {

    /**
     * @param furthest deepest failure recovered from while producing this value (can be null);
     *                 kept so a later error can point at the most specific mismatch
     */
    record Success<T>(T value, Cursor rest, ParseError furthest) implements PResult<T> {}

    record Failure<T>(ParseError error) implements PResult<T> {}

    static <T> PResult<T> success(T value, Cursor rest) {
        return new Success<>(value, rest, null);
    }

    static <T> PResult<T> success(T value, Cursor rest, ParseError furthest) {
        return new Success<>(value, rest, furthest);
    }

    static <T> PResult<T> failure(ParseError error) {
        return new Failure<>(error);
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    default <R> PResult<R> map(Function<? super T, ? extends R> f) {
        if (this instanceof Success<T> s) {
            return new Success<>(f.apply(s.value()), s.rest(), s.furthest());
        }
        return new Failure<>(((Failure<T>) this).error());
    }

    /**
     * The deepest error this result knows about, or null for a clean success.
     */
    default ParseError error() {
        if (this instanceof Success<T> s) {
            return s.furthest();
        }
        return ((Failure<T>) this).error();
    }
}
