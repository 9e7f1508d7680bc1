package com.declparser.parsing.combinator;

import java.util.function.Function;

/**
 * A parse function from a cursor to a result. Grammars never mutate the cursor they
 * are given, so callers backtrack by simply reusing it.
 */
@FunctionalInterface
public interface Grammar<T> {

    PResult<T> parse(Cursor input);

    default <R> Grammar<R> map(Function<? super T, ? extends R> f) {
        return input -> parse(input).map(f);
    }

    /**
     * Names the construct this grammar recognizes; the label is attached to failures
     * that do not already carry a more specific one.
     */
    default Grammar<T> described(String description) {
        return input -> {
            PResult<T> result = parse(input);
            if (result instanceof PResult.Failure<T> f) {
                return PResult.failure(f.error().describedAs(description));
            }
            PResult.Success<T> s = (PResult.Success<T>) result;
            if (s.furthest() == null) {
                return s;
            }
            return PResult.success(s.value(), s.rest(), s.furthest().describedAs(description));
        };
    }
}
