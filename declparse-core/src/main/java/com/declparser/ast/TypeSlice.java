package com.declparser.ast;

public record TypeSlice(Delimiter bracketToken, Type elem) implements Type {
}
