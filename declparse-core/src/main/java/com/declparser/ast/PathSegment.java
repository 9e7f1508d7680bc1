package com.declparser.ast;

import com.declparser.Token;
import com.declparser.TokenType;

import java.util.ArrayList;
import java.util.List;

public record PathSegment(
    Ident ident,
    GenericArguments arguments // Can be null
) implements Node {

    static Punctuated<PathSegment> joined(List<PathSegment> segments) {
        List<Punctuated.Pair<PathSegment>> pairs = new ArrayList<>(segments.size());
        for (int i = 0; i < segments.size(); i++) {
            Token sep = i < segments.size() - 1 ? Token.synthetic(TokenType.PATH_SEP) : null;
            pairs.add(new Punctuated.Pair<>(segments.get(i), sep));
        }
        return new Punctuated<>(pairs);
    }
}
