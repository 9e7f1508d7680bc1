package com.declparser.parsing;

/**
 * Options for a {@link DeclParser}.
 *
 * @param maxDepth           how deeply types and expressions may nest before parsing fails
 * @param allowTrailingInput accept input left over after the parsed node instead of failing
 */
public record ParserOptions(int maxDepth, boolean allowTrailingInput) {
    public static final int DEFAULT_MAX_DEPTH = 128;

    public ParserOptions {
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive, got " + maxDepth);
        }
    }

    public static ParserOptions defaults() {
        return new ParserOptions(DEFAULT_MAX_DEPTH, false);
    }

    public ParserOptions withMaxDepth(int maxDepth) {
        return new ParserOptions(maxDepth, allowTrailingInput);
    }

    public ParserOptions withAllowTrailingInput(boolean allowTrailingInput) {
        return new ParserOptions(maxDepth, allowTrailingInput);
    }
}
