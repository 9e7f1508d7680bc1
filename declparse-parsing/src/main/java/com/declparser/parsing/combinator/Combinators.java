package com.declparser.parsing.combinator;

import com.declparser.Token;
import com.declparser.TokenType;
import com.declparser.ast.Delimiter;
import com.declparser.ast.Punctuated;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Supplier;

/**
 * The parsing primitives every grammar in this library is assembled from.
 *
 * <p>Failure handling follows one rule throughout: a failure never moves the caller's
 * cursor, and whenever a failure is recovered from (an alternation branch, the end of a
 * repetition, an absent optional) it is remembered as the "furthest" error so that a
 * later top-level failure can report the most specific mismatch seen.</p>
 */
public final class Combinators {

    private Combinators() {
    }

    // ========================================================================
    // Literal matchers
    // ========================================================================

    /**
     * Matches exactly one token of the given type.
     */
    public static Grammar<Token> token(TokenType type) {
        String expected = describe(type);
        return input -> {
            if (input.check(type)) {
                return PResult.success(input.peek(), input.advance());
            }
            return PResult.failure(ParseError.at(input, expected));
        };
    }

    /**
     * Matches one token of any of the given types.
     */
    public static Grammar<Token> oneOf(TokenType... types) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < types.length; i++) {
            if (i > 0) {
                sb.append(i == types.length - 1 ? " or " : ", ");
            }
            sb.append(describe(types[i]));
        }
        String expected = sb.toString();
        return input -> {
            for (TokenType type : types) {
                if (input.check(type)) {
                    return PResult.success(input.peek(), input.advance());
                }
            }
            return PResult.failure(ParseError.at(input, expected));
        };
    }

    /**
     * Succeeds without consuming anything.
     */
    public static <T> Grammar<T> epsilon(Supplier<T> value) {
        return input -> PResult.success(value.get(), input);
    }

    // ========================================================================
    // Sequencing
    // ========================================================================

    public static <A, B, R> Grammar<R> seq(Grammar<A> a, Grammar<B> b, BiFunction<A, B, R> build) {
        return input -> sequence(input, a, b).map(v -> build.apply(cast(v[0]), cast(v[1])));
    }

    public static <A, B, C, R> Grammar<R> seq(Grammar<A> a, Grammar<B> b, Grammar<C> c,
                                              Functions.F3<A, B, C, R> build) {
        return input -> sequence(input, a, b, c).map(v -> build.apply(cast(v[0]), cast(v[1]), cast(v[2])));
    }

    public static <A, B, C, D, R> Grammar<R> seq(Grammar<A> a, Grammar<B> b, Grammar<C> c, Grammar<D> d,
                                                 Functions.F4<A, B, C, D, R> build) {
        return input -> sequence(input, a, b, c, d)
            .map(v -> build.apply(cast(v[0]), cast(v[1]), cast(v[2]), cast(v[3])));
    }

    public static <A, B, C, D, E, R> Grammar<R> seq(Grammar<A> a, Grammar<B> b, Grammar<C> c, Grammar<D> d,
                                                    Grammar<E> e, Functions.F5<A, B, C, D, E, R> build) {
        return input -> sequence(input, a, b, c, d, e)
            .map(v -> build.apply(cast(v[0]), cast(v[1]), cast(v[2]), cast(v[3]), cast(v[4])));
    }

    // Runs parts in order. The first failing part ends the sequence; its error is reported
    // unless something recovered earlier in the sequence got strictly further.
    private static PResult<Object[]> sequence(Cursor input, Grammar<?>... parts) {
        Object[] values = new Object[parts.length];
        Cursor cursor = input;
        ParseError furthest = null;
        for (int i = 0; i < parts.length; i++) {
            PResult<?> result = parts[i].parse(cursor);
            if (result instanceof PResult.Failure<?> f) {
                return PResult.failure(ParseError.furthest(f.error(), furthest));
            }
            PResult.Success<?> s = (PResult.Success<?>) result;
            values[i] = s.value();
            cursor = s.rest();
            furthest = ParseError.furthest(furthest, s.furthest());
        }
        return PResult.success(values, cursor, furthest);
    }

    @SuppressWarnings("unchecked")
    private static <T> T cast(Object value) {
        return (T) value;
    }

    // ========================================================================
    // Choice and repetition
    // ========================================================================

    /**
     * Ordered alternation: tries each branch from the same starting cursor and returns the
     * first success. When every branch fails, the failure of the branch that matched the
     * longest prefix is returned (the earliest such branch on ties).
     */
    @SafeVarargs
    public static <T> Grammar<T> alt(Grammar<? extends T>... branches) {
        return input -> {
            ParseError furthest = null;
            for (Grammar<? extends T> branch : branches) {
                Grammar<T> grammar = widen(branch);
                PResult<T> result = grammar.parse(input);
                if (result instanceof PResult.Success<T> s) {
                    return PResult.success(s.value(), s.rest(), ParseError.furthest(furthest, s.furthest()));
                }
                furthest = ParseError.furthest(furthest, result.error());
            }
            return PResult.failure(furthest);
        };
    }

    @SuppressWarnings("unchecked")
    private static <T> Grammar<T> widen(Grammar<? extends T> grammar) {
        return (Grammar<T>) grammar;
    }

    /**
     * Zero or more repetitions. Never fails; stops at the first failure or at an item
     * that consumed nothing.
     */
    public static <T> Grammar<List<T>> many0(Grammar<T> item) {
        return input -> {
            List<T> values = new ArrayList<>();
            Cursor cursor = input;
            ParseError furthest = null;
            while (true) {
                PResult<T> result = item.parse(cursor);
                if (result instanceof PResult.Success<T> s && s.rest().offset() > cursor.offset()) {
                    values.add(s.value());
                    cursor = s.rest();
                    furthest = ParseError.furthest(furthest, s.furthest());
                } else {
                    furthest = ParseError.furthest(furthest, result.error());
                    return PResult.success(List.copyOf(values), cursor, furthest);
                }
            }
        };
    }

    /**
     * Never fails: an absent match yields {@link Optional#empty()} at the original cursor.
     */
    public static <T> Grammar<Optional<T>> optional(Grammar<T> item) {
        return input -> {
            PResult<T> result = item.parse(input);
            if (result instanceof PResult.Success<T> s) {
                return PResult.success(Optional.ofNullable(s.value()), s.rest(), s.furthest());
            }
            return PResult.success(Optional.empty(), input, result.error());
        };
    }

    // ========================================================================
    // Delimited groups
    // ========================================================================

    public static <T> Grammar<Enclosed<T>> parens(Grammar<T> content) {
        return enclosed(TokenType.LPAREN, TokenType.RPAREN, content);
    }

    public static <T> Grammar<Enclosed<T>> braces(Grammar<T> content) {
        return enclosed(TokenType.LBRACE, TokenType.RBRACE, content);
    }

    /**
     * Opening delimiter, content, closing delimiter.
     */
    public static <T> Grammar<Enclosed<T>> enclosed(TokenType open, TokenType close, Grammar<T> content) {
        return seq(token(open), content, token(close),
            (o, value, c) -> new Enclosed<>(new Delimiter(o, c), value));
    }

    /**
     * A delimited list: {@code open [item (sep item)* sep?] close}. Fails where the closing
     * delimiter was expected if the list is not properly closed.
     */
    public static <T> Grammar<Enclosed<Punctuated<T>>> terminated(TokenType open, TokenType close,
                                                                  Grammar<T> item, TokenType sep) {
        String expectedOpen = describe(open);
        String expectedEnd = describe(sep) + " or " + describe(close);
        return input -> {
            if (!input.check(open)) {
                return PResult.failure(ParseError.at(input, expectedOpen));
            }
            Token openToken = input.peek();
            Cursor cursor = input.advance();
            List<Punctuated.Pair<T>> pairs = new ArrayList<>();
            ParseError furthest = null;
            while (!cursor.check(close)) {
                PResult<T> result = item.parse(cursor);
                if (result instanceof PResult.Failure<T> f) {
                    return PResult.failure(ParseError.furthest(f.error(), furthest));
                }
                PResult.Success<T> s = (PResult.Success<T>) result;
                cursor = s.rest();
                furthest = ParseError.furthest(furthest, s.furthest());
                if (cursor.check(sep)) {
                    pairs.add(new Punctuated.Pair<>(s.value(), cursor.peek()));
                    cursor = cursor.advance();
                } else {
                    pairs.add(new Punctuated.Pair<>(s.value(), null));
                    if (!cursor.check(close)) {
                        return PResult.failure(ParseError.furthest(ParseError.at(cursor, expectedEnd), furthest));
                    }
                }
            }
            Token closeToken = cursor.peek();
            Delimiter delimiter = new Delimiter(openToken, closeToken);
            return PResult.success(new Enclosed<>(delimiter, new Punctuated<>(pairs)), cursor.advance(), furthest);
        };
    }

    /**
     * Reports {@code expected} when {@code grammar} fails without getting past the first
     * token, instead of whatever its first alternative was looking for.
     */
    public static <T> Grammar<T> expecting(String expected, Grammar<T> grammar) {
        return input -> {
            PResult<T> result = grammar.parse(input);
            if (result instanceof PResult.Failure<T> f && f.error().offset() <= input.offset()) {
                return PResult.failure(ParseError.at(input, expected).describedAs(f.error().description()));
            }
            return result;
        };
    }

    // ========================================================================
    // Guards
    // ========================================================================

    /**
     * Runs {@code grammar} one level deeper, failing instead of recursing past the
     * cursor's depth limit.
     */
    public static <T> Grammar<T> nested(Grammar<T> grammar) {
        return input -> {
            int depth = input.depth();
            if (depth >= input.maxDepth()) {
                return PResult.failure(ParseError.limit(input,
                    "shallower nesting (recursion limit of " + input.maxDepth() + " exceeded)"));
            }
            PResult<T> result = grammar.parse(input.withDepth(depth + 1));
            if (result instanceof PResult.Success<T> s) {
                return PResult.success(s.value(), s.rest().withDepth(depth), s.furthest());
            }
            return result;
        };
    }

    /**
     * Requires {@code grammar} to consume the whole input. When it stops early, the deepest
     * failure recorded along the way is reported if it got further than the leftover input.
     */
    public static <T> Grammar<T> complete(Grammar<T> grammar) {
        return input -> {
            PResult<T> result = grammar.parse(input);
            if (result instanceof PResult.Success<T> s && !s.rest().isAtEnd()) {
                return PResult.failure(ParseError.furthest(ParseError.at(s.rest(), "end of input"), s.furthest()));
            }
            return result;
        };
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    static String describe(TokenType type) {
        return switch (type) {
            case IDENT -> "identifier";
            case LIFETIME -> "lifetime";
            case INTEGER -> "integer literal";
            case FLOAT -> "float literal";
            case STRING -> "string literal";
            case CHAR -> "character literal";
            case EOF -> "end of input";
            default -> "'" + type.lexeme() + "'";
        };
    }
}
