package com.declparser.ast;

public record TypeTuple(Delimiter parenToken, Punctuated<Type> elems) implements Type {
}
