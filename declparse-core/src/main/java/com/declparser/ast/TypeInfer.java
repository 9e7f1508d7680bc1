package com.declparser.ast;

import com.declparser.Token;

public record TypeInfer(Token underscore) implements Type {
}
