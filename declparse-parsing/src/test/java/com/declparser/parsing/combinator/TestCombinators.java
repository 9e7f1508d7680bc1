package com.declparser.parsing.combinator;

import com.declparser.Lexer;
import com.declparser.Token;
import com.declparser.TokenType;
import com.declparser.ast.Punctuated;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static com.declparser.parsing.combinator.Combinators.*;
import static org.junit.jupiter.api.Assertions.*;

public class TestCombinators {

    private static Cursor cursor(String source) {
        return Cursor.of(Lexer.tokenize(source), 8);
    }

    private static <T> PResult.Success<T> success(PResult<T> result) {
        assertTrue(result.isSuccess(), () -> "expected success but got " + result.error().message());
        return (PResult.Success<T>) result;
    }

    private static ParseError failure(PResult<?> result) {
        assertFalse(result.isSuccess(), "expected failure");
        return result.error();
    }

    @Test
    void testTokenMatchesAndAdvances() {
        PResult.Success<Token> s = success(token(TokenType.IDENT).parse(cursor("a b")));
        assertEquals("a", s.value().lexeme());
        assertEquals("b", s.rest().peek().lexeme());

        ParseError error = failure(token(TokenType.COLON).parse(cursor("a")));
        assertEquals("':'", error.expected());
        assertEquals("a", error.token().lexeme());
    }

    @Test
    void testOneOfDescribesEveryChoice() {
        ParseError error = failure(oneOf(TokenType.IDENT, TokenType.SELF, TokenType.SUPER).parse(cursor(",")));
        assertEquals("identifier, 'self' or 'super'", error.expected());
    }

    @Test
    void testSeqFailsWithoutMovingTheCallersCursor() {
        Cursor start = cursor("a b");
        Grammar<String> pair = seq(token(TokenType.IDENT), token(TokenType.COLON), (a, b) -> "pair");
        ParseError error = failure(pair.parse(start));
        assertEquals("':'", error.expected());
        // The caller still holds the original cursor and can try again from it
        assertEquals("a", start.peek().lexeme());
    }

    @Test
    void testAltBacktracksToLaterBranch() {
        Grammar<String> named = seq(token(TokenType.IDENT), token(TokenType.COLON), (a, b) -> "named");
        Grammar<String> bare = token(TokenType.IDENT).map(t -> "bare");

        PResult.Success<String> s = success(Combinators.<String>alt(named, bare).parse(cursor("x y")));
        assertEquals("bare", s.value());
        assertEquals("y", s.rest().peek().lexeme());
        // The abandoned branch is remembered as the furthest error
        assertEquals("':'", s.furthest().expected());
        assertEquals("y", s.furthest().token().lexeme());
    }

    @Test
    void testAltReportsDeepestFailure() {
        Grammar<String> longer = seq(token(TokenType.IDENT), token(TokenType.COLON), token(TokenType.IDENT), (a, b, c) -> "long");
        Grammar<String> shorter = seq(token(TokenType.IDENT), token(TokenType.COMMA), (a, b) -> "short");

        ParseError error = failure(Combinators.<String>alt(shorter, longer).parse(cursor("a : 5")));
        assertEquals("identifier", error.expected());
        assertEquals("5", error.token().lexeme());
    }

    @Test
    void testAltPrefersEarliestBranchOnTies() {
        ParseError error = failure(Combinators.<Token>alt(token(TokenType.COLON), token(TokenType.COMMA)).parse(cursor("x")));
        assertEquals("':'", error.expected());
    }

    @Test
    void testMany0CollectsUntilFailure() {
        PResult.Success<List<Token>> s = success(many0(token(TokenType.IDENT)).parse(cursor("a b c :")));
        assertEquals(3, s.value().size());
        assertTrue(s.rest().check(TokenType.COLON));

        PResult.Success<List<Token>> none = success(many0(token(TokenType.IDENT)).parse(cursor(":")));
        assertTrue(none.value().isEmpty());
        assertEquals(0, none.rest().offset());
    }

    @Test
    void testMany0StopsOnItemThatConsumesNothing() {
        PResult.Success<List<String>> s = success(many0(epsilon(() -> "x")).parse(cursor("a")));
        assertTrue(s.value().isEmpty());
    }

    @Test
    void testOptionalNeverFails() {
        Cursor start = cursor("b");
        PResult.Success<Optional<Token>> absent = success(optional(token(TokenType.COLON)).parse(start));
        assertTrue(absent.value().isEmpty());
        assertSame(start, absent.rest());

        PResult.Success<Optional<Token>> present = success(optional(token(TokenType.IDENT)).parse(start));
        assertEquals("b", present.value().orElseThrow().lexeme());
        assertTrue(present.rest().isAtEnd());
    }

    @Test
    void testTerminatedList() {
        Grammar<Enclosed<Punctuated<Token>>> list =
            terminated(TokenType.LPAREN, TokenType.RPAREN, token(TokenType.IDENT), TokenType.COMMA);

        Punctuated<Token> trailing = success(list.parse(cursor("(a, b,)"))).value().value();
        assertEquals(2, trailing.size());
        assertTrue(trailing.hasTrailingPunct());

        Punctuated<Token> plain = success(list.parse(cursor("(a, b)"))).value().value();
        assertEquals(2, plain.size());
        assertFalse(plain.hasTrailingPunct());

        assertTrue(success(list.parse(cursor("()"))).value().value().isEmpty());
    }

    @Test
    void testTerminatedListFailsWhereCloseWasExpected() {
        Grammar<Enclosed<Punctuated<Token>>> list =
            terminated(TokenType.LPAREN, TokenType.RPAREN, token(TokenType.IDENT), TokenType.COMMA);

        ParseError missingComma = failure(list.parse(cursor("(a b)")));
        assertEquals("',' or ')'", missingComma.expected());
        assertEquals("b", missingComma.token().lexeme());

        ParseError unclosed = failure(list.parse(cursor("(a")));
        assertEquals("',' or ')'", unclosed.expected());
        assertTrue(unclosed.token().is(TokenType.EOF));
        assertTrue(unclosed.message().endsWith("but found end of input"));
    }

    @Test
    void testNestedEnforcesDepthLimit() {
        Grammar<Token> threeDeep = nested(nested(nested(token(TokenType.IDENT))));

        ParseError error = failure(threeDeep.parse(Cursor.of(Lexer.tokenize("a"), 2)));
        assertEquals("shallower nesting (recursion limit of 2 exceeded)", error.expected());

        PResult.Success<Token> s = success(threeDeep.parse(Cursor.of(Lexer.tokenize("a"), 3)));
        assertEquals(0, s.rest().depth());
    }

    @Test
    void testDepthLimitOutranksOtherBranches() {
        Grammar<Token> deep = nested(nested(token(TokenType.IDENT)));
        Grammar<Token> other = seq(token(TokenType.IDENT), token(TokenType.COLON), (a, b) -> a);
        ParseError error = failure(Combinators.<Token>alt(deep, other).parse(Cursor.of(Lexer.tokenize("a b"), 1)));
        assertTrue(error.expected().contains("recursion limit"));
    }

    @Test
    void testCompleteRequiresEndOfInput() {
        ParseError error = failure(complete(token(TokenType.IDENT)).parse(cursor("a b")));
        assertEquals("Expected end of input at line 1, column 2 but found 'b'", error.message());
        assertTrue(complete(token(TokenType.IDENT)).parse(cursor("a")).isSuccess());
    }

    @Test
    void testDescribedKeepsMostSpecificLabel() {
        ParseError outer = failure(token(TokenType.IDENT).described("thing").parse(cursor(",")));
        assertEquals("thing", outer.description());

        ParseError inner = failure(token(TokenType.IDENT).described("inner").described("outer").parse(cursor(",")));
        assertEquals("inner", inner.description());
        assertEquals("Expected identifier (in inner) at line 1, column 0 but found ','", inner.message());
    }

    @Test
    void testExpectingRenamesShallowFailures() {
        Grammar<Token> punct = expecting("punctuation", Combinators.<Token>alt(token(TokenType.COLON), token(TokenType.COMMA)));
        assertEquals("punctuation", failure(punct.parse(cursor("x"))).expected());

        // Failures past the first token keep their own message
        Grammar<String> deeper = expecting("pair", seq(token(TokenType.IDENT), token(TokenType.COLON), (a, b) -> "pair"));
        assertEquals("':'", failure(deeper.parse(cursor("x y"))).expected());
    }

    @Test
    void testSplittingShiftToken() {
        Cursor start = cursor(">>");
        Token head = start.splitHead(TokenType.GT);
        Cursor tail = start.splitTail(TokenType.GT);

        assertEquals(">", head.lexeme());
        assertEquals(TokenType.GT, tail.peek().type());
        assertEquals(1, tail.peek().column());
        assertTrue(head.isJointWith(tail.peek()));
        assertTrue(tail.offset() > start.offset());
        assertTrue(tail.advance().isAtEnd());
    }

    @Test
    void testCursorAppendsEof() {
        List<Token> tokens = Lexer.tokenize("a");
        Cursor c = Cursor.of(tokens.subList(0, 1), 8);
        assertTrue(c.advance().isAtEnd());
        assertSame(c.advance().advance().peek().type(), TokenType.EOF);
    }
}
