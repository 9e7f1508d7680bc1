package com.declparser.ast;

public record TypePath(Path path) implements Type {
    public static TypePath of(String... names) {
        return new TypePath(Path.of(names));
    }
}
