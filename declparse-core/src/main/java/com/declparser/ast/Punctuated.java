package com.declparser.ast;

import com.declparser.Token;
import com.declparser.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * A separator-joined sequence of values, keeping every separator token so the
 * original text (including a trailing separator) can be reproduced.
 */
public record Punctuated<T>(List<Pair<T>> pairs) {
    public Punctuated {
        pairs = List.copyOf(pairs);
        for (int i = 0; i < pairs.size() - 1; i++) {
            if (pairs.get(i).punct() == null) {
                throw new IllegalArgumentException("only the last value may omit its separator");
            }
        }
    }

    public static <T> Punctuated<T> empty() {
        return new Punctuated<>(List.of());
    }

    /**
     * Joins {@code values} with synthetic commas and no trailing comma.
     */
    @SafeVarargs
    public static <T> Punctuated<T> of(T... values) {
        return of(List.of(values));
    }

    public static <T> Punctuated<T> of(List<T> values) {
        List<Pair<T>> pairs = new ArrayList<>(values.size());
        for (int i = 0; i < values.size(); i++) {
            Token comma = i < values.size() - 1 ? Token.synthetic(TokenType.COMMA) : null;
            pairs.add(new Pair<>(values.get(i), comma));
        }
        return new Punctuated<>(pairs);
    }

    public List<T> values() {
        List<T> values = new ArrayList<>(pairs.size());
        for (Pair<T> pair : pairs) {
            values.add(pair.value());
        }
        return values;
    }

    public int size() {
        return pairs.size();
    }

    public boolean isEmpty() {
        return pairs.isEmpty();
    }

    public T get(int index) {
        return pairs.get(index).value();
    }

    public boolean hasTrailingPunct() {
        return !pairs.isEmpty() && pairs.get(pairs.size() - 1).punct() != null;
    }

    public record Pair<T>(
        T value,
        Token punct // null on the last value when there is no trailing separator
    ) {}
}
