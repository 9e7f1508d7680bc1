package com.declparser.parsing;

import com.declparser.Token;
import com.declparser.TokenType;
import com.declparser.ast.Delimiter;
import com.declparser.ast.Expr;
import com.declparser.ast.Lifetime;
import com.declparser.ast.Path;
import com.declparser.ast.Type;
import com.declparser.ast.TypeArray;
import com.declparser.ast.TypeInfer;
import com.declparser.ast.TypeNever;
import com.declparser.ast.TypePath;
import com.declparser.ast.TypePtr;
import com.declparser.ast.TypeReference;
import com.declparser.ast.TypeSlice;
import com.declparser.ast.TypeTuple;
import com.declparser.parsing.combinator.Combinators;
import com.declparser.parsing.combinator.Cursor;
import com.declparser.parsing.combinator.Grammar;
import com.declparser.parsing.combinator.PResult;
import com.declparser.parsing.combinator.ParseError;

import java.util.Optional;

import static com.declparser.parsing.combinator.Combinators.*;

/**
 * Field types. Covers paths with generic arguments, references, raw pointers, tuples,
 * slices, arrays, {@code !} and {@code _}.
 */
public final class TypeGrammar {
    private static final String DESCRIPTION = "type";

    private static final Grammar<Type> TYPE_REF = TypeGrammar::type;
    private static final Grammar<Path> PATH = PathGrammar::typePath;
    private static final Grammar<Expr> EXPR = ExprGrammar::expr;

    private static final Grammar<Optional<Lifetime>> LIFETIME = optional(token(TokenType.LIFETIME).map(Lifetime::new));
    private static final Grammar<Optional<Token>> MUT = optional(token(TokenType.MUT));

    private static final Grammar<TypeReference> REFERENCE = TypeGrammar::reference;

    private static final Grammar<TypePtr> PTR =
        seq(token(TokenType.STAR), oneOf(TokenType.CONST, TokenType.MUT), TYPE_REF, TypePtr::new);

    private static final Grammar<TypeTuple> TUPLE =
        terminated(TokenType.LPAREN, TokenType.RPAREN, TYPE_REF, TokenType.COMMA)
            .map(e -> new TypeTuple(e.delimiter(), e.value()));

    private static final Grammar<Type> SLICE_OR_ARRAY = TypeGrammar::sliceOrArray;

    private static final Grammar<TypeNever> NEVER = token(TokenType.BANG).map(TypeNever::new);
    private static final Grammar<TypeInfer> INFER = token(TokenType.UNDERSCORE).map(TypeInfer::new);
    private static final Grammar<TypePath> TYPE_PATH = PATH.map(TypePath::new);

    private static final Grammar<Type> TYPE =
        nested(expecting(DESCRIPTION, Combinators.<Type>alt(REFERENCE, PTR, TUPLE, SLICE_OR_ARRAY, NEVER, INFER, TYPE_PATH)))
            .described(DESCRIPTION);

    private TypeGrammar() {
    }

    public static PResult<Type> type(Cursor input) {
        return TYPE.parse(input);
    }

    // [T] or [T; N]. The element is parsed once; the token after it picks the form.
    private static PResult<Type> sliceOrArray(Cursor input) {
        if (!input.check(TokenType.LBRACKET)) {
            return PResult.failure(ParseError.at(input, "'['"));
        }
        Token open = input.peek();
        PResult<Type> elem = TYPE_REF.parse(input.advance());
        if (!(elem instanceof PResult.Success<Type> e)) {
            return elem;
        }
        Cursor cursor = e.rest();
        ParseError furthest = e.furthest();
        if (cursor.check(TokenType.RBRACKET)) {
            TypeSlice slice = new TypeSlice(new Delimiter(open, cursor.peek()), e.value());
            return PResult.success(slice, cursor.advance(), furthest);
        }
        if (!cursor.check(TokenType.SEMI)) {
            return PResult.failure(ParseError.furthest(ParseError.at(cursor, "';' or ']'"), furthest));
        }
        Token semi = cursor.peek();
        PResult<Expr> len = EXPR.parse(cursor.advance());
        if (len instanceof PResult.Failure<Expr> f) {
            return PResult.failure(ParseError.furthest(f.error(), furthest));
        }
        PResult.Success<Expr> l = (PResult.Success<Expr>) len;
        cursor = l.rest();
        furthest = ParseError.furthest(furthest, l.furthest());
        if (!cursor.check(TokenType.RBRACKET)) {
            return PResult.failure(ParseError.furthest(ParseError.at(cursor, "']'"), furthest));
        }
        TypeArray array = new TypeArray(new Delimiter(open, cursor.peek()), e.value(), semi, l.value());
        return PResult.success(array, cursor.advance(), furthest);
    }

    // & ['a] [mut] T, where a && token supplies the & of two nested references
    private static PResult<TypeReference> reference(Cursor input) {
        Token and;
        Cursor cursor;
        if (input.check(TokenType.AND)) {
            and = input.peek();
            cursor = input.advance();
        } else if (input.check(TokenType.AND_AND)) {
            and = input.splitHead(TokenType.AND);
            cursor = input.splitTail(TokenType.AND);
        } else {
            return PResult.failure(ParseError.at(input, "'&'"));
        }
        return seq(LIFETIME, MUT, TYPE_REF,
            (lifetime, mutability, elem) -> new TypeReference(and, lifetime.orElse(null), mutability.orElse(null), elem))
            .parse(cursor);
    }
}
