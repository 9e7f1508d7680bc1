package com.declparser.ast;

import com.declparser.Token;

public record TypeArray(
    Delimiter bracketToken,
    Type elem,
    Token semiToken,
    Expr len
) implements Type {
}
