package com.declparser.parsing;

import com.declparser.TokenType;
import com.declparser.ast.Attribute;
import com.declparser.ast.Expr;
import com.declparser.ast.Fields;
import com.declparser.ast.Ident;
import com.declparser.ast.Variant;
import com.declparser.ast.VariantList;
import com.declparser.parsing.combinator.Cursor;
import com.declparser.parsing.combinator.Grammar;
import com.declparser.parsing.combinator.PResult;

import java.util.List;
import java.util.Optional;

import static com.declparser.parsing.combinator.Combinators.*;

/**
 * Enum variants: {@code attrs ident [fields] [= discriminant]}, and the braced list of
 * them that forms an enum body.
 */
public final class VariantGrammar {
    private static final Grammar<List<Attribute>> ATTRS = many0(AttributeGrammar::outer);
    private static final Grammar<Ident> IDENT = token(TokenType.IDENT).map(Ident::from);
    private static final Grammar<Fields> FIELDS = FieldsGrammar::fields;
    private static final Grammar<Expr> EXPR = ExprGrammar::expr;

    private static final Grammar<Optional<Variant.Discriminant>> DISCRIMINANT =
        optional(seq(token(TokenType.EQ), EXPR, Variant.Discriminant::new));

    private static final Grammar<Variant> VARIANT =
        seq(ATTRS, IDENT, FIELDS, DISCRIMINANT,
            (attrs, ident, fields, discriminant) -> new Variant(attrs, ident, fields, discriminant.orElse(null)))
            .described("enum variant");

    private static final Grammar<VariantList> VARIANT_LIST =
        terminated(TokenType.LBRACE, TokenType.RBRACE, VARIANT, TokenType.COMMA)
            .map(e -> new VariantList(e.delimiter(), e.value()))
            .described("enum variant list");

    private VariantGrammar() {
    }

    public static PResult<Variant> variant(Cursor input) {
        return VARIANT.parse(input);
    }

    public static PResult<VariantList> variantList(Cursor input) {
        return VARIANT_LIST.parse(input);
    }
}
