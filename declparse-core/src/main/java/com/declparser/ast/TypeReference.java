package com.declparser.ast;

import com.declparser.Token;

public record TypeReference(
    Token and,
    Lifetime lifetime, // Can be null
    Token mutability,  // Can be null
    Type elem
) implements Type {
}
