package com.declparser.ast;

import com.declparser.Token;

public record TypePtr(
    Token star,
    Token constOrMut,
    Type elem
) implements Type {
}
