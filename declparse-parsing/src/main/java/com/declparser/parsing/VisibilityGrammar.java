package com.declparser.parsing;

import com.declparser.Token;
import com.declparser.TokenType;
import com.declparser.ast.Ident;
import com.declparser.ast.Path;
import com.declparser.ast.VisCrate;
import com.declparser.ast.VisInherited;
import com.declparser.ast.VisPublic;
import com.declparser.ast.VisRestricted;
import com.declparser.ast.Visibility;
import com.declparser.parsing.combinator.Combinators;
import com.declparser.parsing.combinator.Cursor;
import com.declparser.parsing.combinator.Grammar;
import com.declparser.parsing.combinator.PResult;

import static com.declparser.parsing.combinator.Combinators.*;

/**
 * Visibility qualifiers. The branches run from most to least specific: every
 * {@code pub(...)} form has to be tried, and backtracked out of, before plain {@code pub}
 * is accepted, or {@code pub(crate)} would be read as {@code pub} followed by a tuple.
 */
public final class VisibilityGrammar {
    private static final String DESCRIPTION = "visibility qualifier, e.g. `pub`";

    private static final Grammar<Path> MOD_STYLE_PATH = PathGrammar::modStyle;

    // pub(crate)
    private static final Grammar<Visibility> CRATE =
        seq(token(TokenType.PUB), parens(token(TokenType.CRATE)),
            (pub, group) -> new VisCrate(pub, group.delimiter(), group.value()));

    // pub(self)
    private static final Grammar<Visibility> SELF =
        seq(token(TokenType.PUB), parens(token(TokenType.SELF)),
            (pub, group) -> new VisRestricted(pub, group.delimiter(), null, Path.from(Ident.from(group.value()))));

    // pub(super)
    private static final Grammar<Visibility> SUPER =
        seq(token(TokenType.PUB), parens(token(TokenType.SUPER)),
            (pub, group) -> new VisRestricted(pub, group.delimiter(), null, Path.from(Ident.from(group.value()))));

    // pub(in some::module)
    private static final Grammar<Visibility> IN_PATH =
        seq(token(TokenType.PUB), parens(seq(token(TokenType.IN), MOD_STYLE_PATH, InPath::new)),
            (pub, group) -> new VisRestricted(pub, group.delimiter(), group.value().in(), group.value().path()));

    private static final Grammar<Visibility> PUBLIC = token(TokenType.PUB).map(VisPublic::new);

    private static final Grammar<Visibility> INHERITED = epsilon(VisInherited::new);

    private static final Grammar<Visibility> VISIBILITY =
        Combinators.<Visibility>alt(CRATE, SELF, SUPER, IN_PATH, PUBLIC, INHERITED).described(DESCRIPTION);

    private record InPath(Token in, Path path) {}

    private VisibilityGrammar() {
    }

    public static PResult<Visibility> visibility(Cursor input) {
        return VISIBILITY.parse(input);
    }
}
