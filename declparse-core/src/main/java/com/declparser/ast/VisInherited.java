package com.declparser.ast;

/**
 * Inherited, i.e. private. Occupies no tokens.
 */
public record VisInherited() implements Visibility {
}
