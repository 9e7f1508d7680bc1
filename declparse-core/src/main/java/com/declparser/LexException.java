package com.declparser;

public class LexException extends ParseException {
    public LexException(String message, int position, int line, int column) {
        super(message + " at line " + line + ", column " + column, position, line, column);
    }
}
