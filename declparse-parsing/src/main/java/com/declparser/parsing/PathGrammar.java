package com.declparser.parsing;

import com.declparser.Token;
import com.declparser.TokenType;
import com.declparser.ast.GenericArgument;
import com.declparser.ast.GenericArguments;
import com.declparser.ast.Ident;
import com.declparser.ast.Lifetime;
import com.declparser.ast.Path;
import com.declparser.ast.PathSegment;
import com.declparser.ast.Punctuated;
import com.declparser.ast.Type;
import com.declparser.parsing.combinator.Cursor;
import com.declparser.parsing.combinator.Grammar;
import com.declparser.parsing.combinator.PResult;
import com.declparser.parsing.combinator.ParseError;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.declparser.parsing.combinator.Combinators.*;

/**
 * Paths in their three flavors: type paths ({@code Vec<T>}), expression paths (generic
 * arguments only with turbofish, {@code size_of::<T>}) and mod-style paths
 * ({@code crate::a::b}, no generic arguments at all).
 */
public final class PathGrammar {
    private static final String DESCRIPTION = "path";

    private static final Grammar<Ident> SEGMENT_IDENT =
        oneOf(TokenType.IDENT, TokenType.SELF, TokenType.SUPER, TokenType.CRATE, TokenType.SELF_TYPE)
            .map(Ident::from);

    private static final Grammar<GenericArguments> ANGLE_ARGS = input -> genericArguments(input, false);
    private static final Grammar<GenericArguments> TURBOFISH_ARGS = input -> genericArguments(input, true);

    private static final Grammar<PathSegment> MOD_SEGMENT =
        SEGMENT_IDENT.map(ident -> new PathSegment(ident, null));

    private static final Grammar<PathSegment> TYPE_SEGMENT =
        seq(SEGMENT_IDENT, optional(alt(TURBOFISH_ARGS, ANGLE_ARGS)),
            (ident, args) -> new PathSegment(ident, args.orElse(null)));

    private static final Grammar<PathSegment> EXPR_SEGMENT =
        seq(SEGMENT_IDENT, optional(TURBOFISH_ARGS),
            (ident, args) -> new PathSegment(ident, args.orElse(null)));

    private static final Grammar<Path> MOD_STYLE = pathOf(MOD_SEGMENT).described(DESCRIPTION);
    private static final Grammar<Path> TYPE_PATH = pathOf(TYPE_SEGMENT).described(DESCRIPTION);
    private static final Grammar<Path> EXPR_PATH = pathOf(EXPR_SEGMENT).described(DESCRIPTION);

    private PathGrammar() {
    }

    public static PResult<Path> modStyle(Cursor input) {
        return MOD_STYLE.parse(input);
    }

    public static PResult<Path> typePath(Cursor input) {
        return TYPE_PATH.parse(input);
    }

    public static PResult<Path> exprPath(Cursor input) {
        return EXPR_PATH.parse(input);
    }

    // [::] segment (:: segment)*
    private static Grammar<Path> pathOf(Grammar<PathSegment> segment) {
        Grammar<List<Tail>> tails = many0(seq(token(TokenType.PATH_SEP), segment, Tail::new));
        return seq(optional(token(TokenType.PATH_SEP)), segment, tails, PathGrammar::assemble);
    }

    private record Tail(Token separator, PathSegment segment) {}

    private static Path assemble(Optional<Token> leading, PathSegment first, List<Tail> tails) {
        List<Punctuated.Pair<PathSegment>> pairs = new ArrayList<>(tails.size() + 1);
        PathSegment previous = first;
        for (Tail tail : tails) {
            pairs.add(new Punctuated.Pair<>(previous, tail.separator()));
            previous = tail.segment();
        }
        pairs.add(new Punctuated.Pair<>(previous, null));
        return new Path(leading.orElse(null), new Punctuated<>(pairs));
    }

    // [::] < (lifetime | type) (, (lifetime | type))* [,] >
    private static PResult<GenericArguments> genericArguments(Cursor input, boolean turbofish) {
        Cursor cursor = input;
        Token colon2 = null;
        if (turbofish) {
            if (!cursor.check(TokenType.PATH_SEP)) {
                return PResult.failure(ParseError.at(cursor, "'::'"));
            }
            colon2 = cursor.peek();
            cursor = cursor.advance();
        }
        if (!cursor.check(TokenType.LT)) {
            return PResult.failure(ParseError.at(cursor, "'<'"));
        }
        Token lt = cursor.peek();
        cursor = cursor.advance();

        List<Punctuated.Pair<GenericArgument>> pairs = new ArrayList<>();
        ParseError furthest = null;
        while (!closesAngle(cursor)) {
            PResult<GenericArgument> arg = genericArgument(cursor);
            if (arg instanceof PResult.Failure<GenericArgument> f) {
                return PResult.failure(ParseError.furthest(f.error(), furthest));
            }
            PResult.Success<GenericArgument> s = (PResult.Success<GenericArgument>) arg;
            cursor = s.rest();
            furthest = ParseError.furthest(furthest, s.furthest());
            if (cursor.check(TokenType.COMMA)) {
                pairs.add(new Punctuated.Pair<>(s.value(), cursor.peek()));
                cursor = cursor.advance();
            } else {
                pairs.add(new Punctuated.Pair<>(s.value(), null));
                if (!closesAngle(cursor)) {
                    return PResult.failure(ParseError.furthest(ParseError.at(cursor, "',' or '>'"), furthest));
                }
            }
        }

        // A >> or >= here closes this list with its first character
        Token gt;
        if (cursor.check(TokenType.GT)) {
            gt = cursor.peek();
            cursor = cursor.advance();
        } else {
            TokenType tail = cursor.check(TokenType.SHR) ? TokenType.GT : TokenType.EQ;
            gt = cursor.splitHead(TokenType.GT);
            cursor = cursor.splitTail(tail);
        }
        return PResult.success(new GenericArguments(colon2, lt, new Punctuated<>(pairs), gt), cursor, furthest);
    }

    private static boolean closesAngle(Cursor cursor) {
        return cursor.check(TokenType.GT) || cursor.check(TokenType.SHR) || cursor.check(TokenType.GE);
    }

    private static PResult<GenericArgument> genericArgument(Cursor input) {
        if (input.check(TokenType.LIFETIME)) {
            return PResult.success(new Lifetime(input.peek()), input.advance());
        }
        PResult<Type> type = TypeGrammar.type(input);
        return type.map(t -> t);
    }
}
