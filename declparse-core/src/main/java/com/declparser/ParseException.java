package com.declparser;

/**
 * Thrown when input cannot be parsed. Carries the offending token (if any) and
 * the description of the construct that was being recognized.
 */
public class ParseException extends RuntimeException {
    private final Token token;
    private final int position;
    private final int line;
    private final int column;
    private final String description;

    public ParseException(String message, Token token, String description) {
        super(message);
        this.token = token;
        this.position = token != null ? token.position() : -1;
        this.line = token != null ? token.line() : 0;
        this.column = token != null ? token.column() : 0;
        this.description = description;
    }

    protected ParseException(String message, int position, int line, int column) {
        super(message);
        this.token = null;
        this.position = position;
        this.line = line;
        this.column = column;
        this.description = null;
    }

    public Token getToken() {
        return token;
    }

    public int getPosition() {
        return position;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    // Can be null
    public String getDescription() {
        return description;
    }
}
