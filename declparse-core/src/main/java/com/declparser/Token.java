package com.declparser;

public record Token(
    TokenType type,
    String lexeme,
    int position,    // Start offset in the source, -1 for synthetic tokens
    int endPosition,
    int line,
    int column
) {
    public static Token synthetic(TokenType type) {
        if (type.lexeme() == null) {
            throw new IllegalArgumentException(type + " has no fixed spelling; pass the text explicitly");
        }
        return synthetic(type, type.lexeme());
    }

    public static Token synthetic(TokenType type, String lexeme) {
        return new Token(type, lexeme, -1, -1, 0, 0);
    }

    public boolean isSynthetic() {
        return position < 0;
    }

    public boolean is(TokenType other) {
        return type == other;
    }

    /**
     * True when {@code next} starts exactly where this token ends, by offset and by
     * line and column, e.g. the two halves of a split {@code >>}. Tokens of different
     * sources can still line up this way; callers that join text must check the result.
     */
    public boolean isJointWith(Token next) {
        return !isSynthetic() && !next.isSynthetic()
            && endPosition == next.position
            && line == next.line
            && column + (endPosition - position) == next.column;
    }

    // Tokens compare by type and spelling only; where they came from is metadata
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Token other)) return false;
        return type == other.type && lexeme.equals(other.lexeme);
    }

    @Override
    public int hashCode() {
        return 31 * type.hashCode() + lexeme.hashCode();
    }

    @Override
    public String toString() {
        return type + "('" + lexeme + "')@" + line + ":" + column;
    }
}
