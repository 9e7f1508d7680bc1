package com.declparser.parsing.combinator;

import com.declparser.ast.Delimiter;

/**
 * A value together with the delimiter pair that surrounded it.
 */
public record Enclosed<T>(Delimiter delimiter, T value) {
}
