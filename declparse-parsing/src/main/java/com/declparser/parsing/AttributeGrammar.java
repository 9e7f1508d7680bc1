package com.declparser.parsing;

import com.declparser.Token;
import com.declparser.TokenType;
import com.declparser.ast.Attribute;
import com.declparser.ast.Delimiter;
import com.declparser.ast.Path;
import com.declparser.parsing.combinator.Cursor;
import com.declparser.parsing.combinator.Grammar;
import com.declparser.parsing.combinator.PResult;
import com.declparser.parsing.combinator.ParseError;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Outer attributes, {@code #[path ...]}. The tokens after the path are collected up to the
 * closing bracket with delimiters balanced but otherwise uninterpreted.
 */
public final class AttributeGrammar {
    private static final String DESCRIPTION = "attribute";

    private static final Grammar<Attribute> OUTER = ((Grammar<Attribute>) AttributeGrammar::parseOuter)
        .described(DESCRIPTION);

    private AttributeGrammar() {
    }

    public static PResult<Attribute> outer(Cursor input) {
        return OUTER.parse(input);
    }

    private static PResult<Attribute> parseOuter(Cursor input) {
        if (!input.check(TokenType.POUND)) {
            return PResult.failure(ParseError.at(input, "'#'"));
        }
        Token pound = input.peek();
        Cursor cursor = input.advance();
        if (!cursor.check(TokenType.LBRACKET)) {
            return PResult.failure(ParseError.at(cursor, "'['"));
        }
        Token open = cursor.peek();
        cursor = cursor.advance();

        PResult<Path> path = PathGrammar.modStyle(cursor);
        if (!(path instanceof PResult.Success<Path> pathResult)) {
            return PResult.failure(path.error());
        }
        cursor = pathResult.rest();

        List<Token> tokens = new ArrayList<>();
        Deque<TokenType> expectedClosers = new ArrayDeque<>();
        while (true) {
            Token token = cursor.peek();
            if (token.is(TokenType.EOF)) {
                String expected = expectedClosers.isEmpty() ? "']'" : describeCloser(expectedClosers.peek());
                return PResult.failure(ParseError.at(cursor, expected));
            }
            if (expectedClosers.isEmpty() && token.is(TokenType.RBRACKET)) {
                break;
            }
            if (token.type().isOpenDelimiter()) {
                expectedClosers.push(closerOf(token.type()));
            } else if (token.type().isCloseDelimiter()) {
                if (expectedClosers.isEmpty() || expectedClosers.peek() != token.type()) {
                    String expected = expectedClosers.isEmpty() ? "']'" : describeCloser(expectedClosers.peek());
                    return PResult.failure(ParseError.at(cursor, expected));
                }
                expectedClosers.pop();
            }
            tokens.add(token);
            cursor = cursor.advance();
        }
        Token close = cursor.peek();
        Attribute attribute = new Attribute(pound, new Delimiter(open, close), pathResult.value(), tokens);
        return PResult.success(attribute, cursor.advance(), pathResult.furthest());
    }

    private static TokenType closerOf(TokenType open) {
        return switch (open) {
            case LPAREN -> TokenType.RPAREN;
            case LBRACE -> TokenType.RBRACE;
            default -> TokenType.RBRACKET;
        };
    }

    private static String describeCloser(TokenType close) {
        return "'" + close.lexeme() + "'";
    }
}
