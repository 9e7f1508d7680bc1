package com.declparser.ast;

import com.declparser.Token;

import java.util.List;

/**
 * An outer attribute such as {@code #[serde(rename = "x")]}. Everything after the
 * path is kept as raw tokens; attribute bodies are not interpreted.
 */
public record Attribute(
    Token pound,
    Delimiter bracketToken,
    Path path,
    List<Token> tokens
) implements Node {
    public Attribute {
        tokens = List.copyOf(tokens);
    }
}
