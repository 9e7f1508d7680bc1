package com.declparser.parsing;

import com.declparser.Token;
import com.declparser.TokenType;
import com.declparser.ast.Expr;
import com.declparser.ast.ExprBinary;
import com.declparser.ast.ExprCast;
import com.declparser.ast.ExprLit;
import com.declparser.ast.ExprParen;
import com.declparser.ast.ExprPath;
import com.declparser.ast.ExprUnary;
import com.declparser.ast.Path;
import com.declparser.ast.Type;
import com.declparser.parsing.combinator.Combinators;
import com.declparser.parsing.combinator.Cursor;
import com.declparser.parsing.combinator.Grammar;
import com.declparser.parsing.combinator.PResult;
import com.declparser.parsing.combinator.ParseError;

import static com.declparser.parsing.combinator.Combinators.*;

/**
 * Constant expressions: literals, paths, unary and binary operators, casts and parentheses.
 * Binary operators are handled by a Pratt loop driven by binding powers.
 */
public final class ExprGrammar {
    // Higher binding power = tighter binding (higher precedence)
    private static final int BP_NONE = 0;
    private static final int BP_OR = 1;          // ||
    private static final int BP_AND = 2;         // &&
    private static final int BP_COMPARE = 3;     // == != < <= > >=
    private static final int BP_BIT_OR = 4;      // |
    private static final int BP_BIT_XOR = 5;     // ^
    private static final int BP_BIT_AND = 6;     // &
    private static final int BP_SHIFT = 7;       // << >>
    private static final int BP_ADDITIVE = 8;    // + -
    private static final int BP_MULTIPLY = 9;    // * / %
    private static final int BP_CAST = 10;       // as

    private static final String DESCRIPTION = "expression";

    private static final Grammar<Expr> LITERAL =
        oneOf(TokenType.INTEGER, TokenType.FLOAT, TokenType.STRING, TokenType.CHAR, TokenType.TRUE, TokenType.FALSE)
            .map(ExprLit::new);

    private static final Grammar<Expr> PATH = Combinators.<Path>nested(PathGrammar::exprPath)
        .map(ExprPath::new);

    private static final Grammar<Expr> PAREN =
        nested(parens(ExprGrammar::expr)).map(e -> new ExprParen(e.delimiter(), e.value()));

    private static final Grammar<Expr> UNARY =
        seq(oneOf(TokenType.MINUS, TokenType.BANG), nested(ExprGrammar::unary), ExprUnary::new);

    private static final Grammar<Expr> OPERAND = expecting(DESCRIPTION, Combinators.<Expr>alt(UNARY, LITERAL, PAREN, PATH));

    private static final Grammar<Expr> EXPR = nested(input -> binary(input, BP_NONE)).described(DESCRIPTION);

    private ExprGrammar() {
    }

    public static PResult<Expr> expr(Cursor input) {
        return EXPR.parse(input);
    }

    private static PResult<Expr> unary(Cursor input) {
        return OPERAND.parse(input);
    }

    private static PResult<Expr> binary(Cursor input, int minBp) {
        PResult<Expr> first = unary(input);
        if (!(first instanceof PResult.Success<Expr> lhsResult)) {
            return first;
        }
        Expr lhs = lhsResult.value();
        Cursor cursor = lhsResult.rest();
        ParseError furthest = lhsResult.furthest();

        while (true) {
            Token op = cursor.peek();
            int bp = infixBindingPower(op.type());
            if (bp <= minBp) {
                break;
            }
            if (op.is(TokenType.AS)) {
                PResult<Type> ty = TypeGrammar.type(cursor.advance());
                if (ty instanceof PResult.Failure<Type> f) {
                    return PResult.failure(ParseError.furthest(f.error(), furthest));
                }
                PResult.Success<Type> s = (PResult.Success<Type>) ty;
                lhs = new ExprCast(lhs, op, s.value());
                cursor = s.rest();
                furthest = ParseError.furthest(furthest, s.furthest());
                continue;
            }
            // Left-associative: the right operand only takes operators that bind tighter
            PResult<Expr> rhs = binary(cursor.advance(), bp);
            if (rhs instanceof PResult.Failure<Expr> f) {
                return PResult.failure(ParseError.furthest(f.error(), furthest));
            }
            PResult.Success<Expr> s = (PResult.Success<Expr>) rhs;
            lhs = new ExprBinary(lhs, op, s.value());
            cursor = s.rest();
            furthest = ParseError.furthest(furthest, s.furthest());
        }
        return PResult.success(lhs, cursor, furthest);
    }

    private static int infixBindingPower(TokenType type) {
        return switch (type) {
            case OR_OR -> BP_OR;
            case AND_AND -> BP_AND;
            case EQ_EQ, NE, LT, LE, GT, GE -> BP_COMPARE;
            case OR -> BP_BIT_OR;
            case CARET -> BP_BIT_XOR;
            case AND -> BP_BIT_AND;
            case SHL, SHR -> BP_SHIFT;
            case PLUS, MINUS -> BP_ADDITIVE;
            case STAR, SLASH, PERCENT -> BP_MULTIPLY;
            case AS -> BP_CAST;
            default -> BP_NONE;
        };
    }
}
