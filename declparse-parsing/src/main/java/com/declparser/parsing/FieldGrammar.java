package com.declparser.parsing;

import com.declparser.TokenType;
import com.declparser.ast.Attribute;
import com.declparser.ast.Field;
import com.declparser.ast.Ident;
import com.declparser.ast.Type;
import com.declparser.ast.Visibility;
import com.declparser.parsing.combinator.Cursor;
import com.declparser.parsing.combinator.Grammar;
import com.declparser.parsing.combinator.PResult;

import java.util.List;

import static com.declparser.parsing.combinator.Combinators.*;

/**
 * Single fields: {@code attrs vis ident : type} for named fields and {@code attrs vis type}
 * for tuple fields.
 */
public final class FieldGrammar {
    private static final String DESCRIPTION = "field";

    private static final Grammar<List<Attribute>> ATTRS = many0(AttributeGrammar::outer);
    private static final Grammar<Visibility> VIS = VisibilityGrammar::visibility;
    private static final Grammar<Ident> IDENT = token(TokenType.IDENT).map(Ident::from);
    private static final Grammar<Type> TYPE = TypeGrammar::type;

    private static final Grammar<Field> NAMED =
        seq(ATTRS, VIS, IDENT, token(TokenType.COLON), TYPE, Field::new).described(DESCRIPTION);

    private static final Grammar<Field> UNNAMED =
        seq(ATTRS, VIS, TYPE, (attrs, vis, ty) -> new Field(attrs, vis, null, null, ty)).described(DESCRIPTION);

    private FieldGrammar() {
    }

    public static PResult<Field> named(Cursor input) {
        return NAMED.parse(input);
    }

    public static PResult<Field> unnamed(Cursor input) {
        return UNNAMED.parse(input);
    }
}
