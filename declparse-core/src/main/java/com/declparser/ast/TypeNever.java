package com.declparser.ast;

import com.declparser.Token;

public record TypeNever(Token bang) implements Type {
}
