package com.declparser.parsing;

import com.declparser.TokenType;
import com.declparser.ast.Field;
import com.declparser.ast.Fields;
import com.declparser.ast.FieldsNamed;
import com.declparser.ast.FieldsUnit;
import com.declparser.ast.FieldsUnnamed;
import com.declparser.parsing.combinator.Combinators;
import com.declparser.parsing.combinator.Cursor;
import com.declparser.parsing.combinator.Grammar;
import com.declparser.parsing.combinator.PResult;

import static com.declparser.parsing.combinator.Combinators.*;

/**
 * Field lists: braced named fields and parenthesized tuple fields, each comma-separated
 * with an optional trailing comma.
 */
public final class FieldsGrammar {
    private static final Grammar<Field> NAMED_FIELD = FieldGrammar::named;
    private static final Grammar<Field> UNNAMED_FIELD = FieldGrammar::unnamed;

    private static final Grammar<FieldsNamed> NAMED =
        terminated(TokenType.LBRACE, TokenType.RBRACE, NAMED_FIELD, TokenType.COMMA)
            .map(e -> new FieldsNamed(e.delimiter(), e.value()))
            .described("named fields");

    private static final Grammar<FieldsUnnamed> UNNAMED =
        terminated(TokenType.LPAREN, TokenType.RPAREN, UNNAMED_FIELD, TokenType.COMMA)
            .map(e -> new FieldsUnnamed(e.delimiter(), e.value()))
            .described("unnamed fields");

    // Named, unnamed, or nothing at all
    private static final Grammar<Fields> ANY = Combinators.<Fields>alt(NAMED, UNNAMED, epsilon(FieldsUnit::new));

    private FieldsGrammar() {
    }

    public static PResult<FieldsNamed> named(Cursor input) {
        return NAMED.parse(input);
    }

    public static PResult<FieldsUnnamed> unnamed(Cursor input) {
        return UNNAMED.parse(input);
    }

    public static PResult<Fields> fields(Cursor input) {
        return ANY.parse(input);
    }
}
