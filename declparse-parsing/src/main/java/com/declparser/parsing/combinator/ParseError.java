package com.declparser.parsing.combinator;

import com.declparser.Token;

/**
 * Why a grammar did not match: the token where the mismatch happened, what was
 * expected there, and optionally which construct was being recognized.
 */
public record ParseError(
    Token token,
    int offset,         // Cursor offset of token, used to rank failures
    String expected,
    String description  // Can be null
) {
    public static ParseError at(Cursor cursor, String expected) {
        return new ParseError(cursor.peek(), cursor.offset(), expected, null);
    }

    /**
     * An error that outranks every positional one, for limits that must be reported
     * regardless of how far other branches got.
     */
    public static ParseError limit(Cursor cursor, String expected) {
        return new ParseError(cursor.peek(), Integer.MAX_VALUE, expected, null);
    }

    /**
     * Labels the error with the construct being parsed, unless a more specific label is already set.
     */
    public ParseError describedAs(String label) {
        if (description != null || label == null) {
            return this;
        }
        return new ParseError(token, offset, expected, label);
    }

    /**
     * The error that got further into the input; {@code a} wins ties. Either may be null.
     */
    public static ParseError furthest(ParseError a, ParseError b) {
        if (a == null) return b;
        if (b == null) return a;
        return b.offset > a.offset ? b : a;
    }

    public String message() {
        StringBuilder sb = new StringBuilder("Expected ").append(expected);
        if (description != null) {
            sb.append(" (in ").append(description).append(")");
        }
        if (token.isSynthetic()) {
            sb.append(" but found '").append(token.lexeme()).append("'");
        } else {
            sb.append(" at line ").append(token.line()).append(", column ").append(token.column());
            sb.append(" but found ").append(token.lexeme().isEmpty() ? "end of input" : "'" + token.lexeme() + "'");
        }
        return sb.toString();
    }
}
