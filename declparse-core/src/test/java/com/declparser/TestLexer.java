package com.declparser;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TestLexer {

    private static List<TokenType> types(String source) {
        return Lexer.tokenize(source).stream().map(Token::type).toList();
    }

    @Test
    void testVisibilityAndField() {
        assertEquals(
            List.of(TokenType.PUB, TokenType.LPAREN, TokenType.CRATE, TokenType.RPAREN,
                TokenType.IDENT, TokenType.COLON, TokenType.IDENT, TokenType.EOF),
            types("pub(crate) x: u8"));
    }

    @Test
    void testNestedGenericsCloseWithShiftToken() {
        // The lexer does not know about generics; the type grammar splits >>
        assertEquals(
            List.of(TokenType.IDENT, TokenType.LT, TokenType.IDENT, TokenType.LT, TokenType.IDENT,
                TokenType.SHR, TokenType.EOF),
            types("Vec<Vec<T>>"));
    }

    @Test
    void testLifetimeVersusCharLiteral() {
        assertEquals(List.of(TokenType.AND, TokenType.LIFETIME, TokenType.IDENT, TokenType.EOF), types("&'a str"));
        assertEquals(List.of(TokenType.CHAR, TokenType.EOF), types("'a'"));
        assertEquals(List.of(TokenType.CHAR, TokenType.EOF), types("'\\n'"));
        assertEquals(List.of(TokenType.CHAR, TokenType.EOF), types("b'x'"));
    }

    @Test
    void testNumbers() {
        assertEquals(
            List.of(TokenType.INTEGER, TokenType.INTEGER, TokenType.FLOAT, TokenType.FLOAT, TokenType.FLOAT, TokenType.EOF),
            types("0x1F 1_000u32 2.5f32 1e10 3f64"));
        assertEquals(List.of(TokenType.INTEGER, TokenType.DOT_DOT, TokenType.INTEGER, TokenType.EOF), types("1..2"));
        assertEquals("1_000u32", Lexer.tokenize("1_000u32").get(0).lexeme());
    }

    @Test
    void testCommentsAreSkipped() {
        List<Token> tokens = Lexer.tokenize("a // line\n /* outer /* inner */ still */ b /// doc\n");
        assertEquals(3, tokens.size());
        assertEquals("a", tokens.get(0).lexeme());
        assertEquals("b", tokens.get(1).lexeme());
        assertEquals(2, tokens.get(1).line());
        assertTrue(tokens.get(2).is(TokenType.EOF));
    }

    @Test
    void testRawIdentifiersAndStrings() {
        List<Token> tokens = Lexer.tokenize("r#type r#\"a \"quoted\" b\"# br\"x\" b\"y\"");
        assertEquals(TokenType.IDENT, tokens.get(0).type());
        assertEquals("r#type", tokens.get(0).lexeme());
        assertEquals(TokenType.STRING, tokens.get(1).type());
        assertEquals("r#\"a \"quoted\" b\"#", tokens.get(1).lexeme());
        assertEquals(TokenType.STRING, tokens.get(2).type());
        assertEquals(TokenType.STRING, tokens.get(3).type());
    }

    @Test
    void testKeywords() {
        assertEquals(
            List.of(TokenType.SELF, TokenType.SELF_TYPE, TokenType.SUPER, TokenType.IN, TokenType.UNDERSCORE,
                TokenType.IDENT, TokenType.EOF),
            types("self Self super in _ _x"));
    }

    @Test
    void testPositions() {
        List<Token> tokens = Lexer.tokenize("a\n  bc");
        Token bc = tokens.get(1);
        assertEquals(4, bc.position());
        assertEquals(6, bc.endPosition());
        assertEquals(2, bc.line());
        assertEquals(2, bc.column());
    }

    @Test
    void testAdjacentTokensAreJoint() {
        List<Token> tokens = Lexer.tokenize("a::b c");
        assertTrue(tokens.get(0).isJointWith(tokens.get(1)));
        assertTrue(tokens.get(1).isJointWith(tokens.get(2)));
        assertFalse(tokens.get(2).isJointWith(tokens.get(3)));
    }

    @Test
    void testJointTokensMustLineUpByLineAndColumn() {
        Token pub = new Token(TokenType.PUB, "pub", 0, 3, 1, 0);
        assertTrue(pub.isJointWith(new Token(TokenType.IDENT, "x", 3, 4, 1, 3)));
        assertFalse(pub.isJointWith(new Token(TokenType.IDENT, "x", 3, 4, 2, 0)));
        assertFalse(pub.isJointWith(new Token(TokenType.IDENT, "x", 3, 4, 1, 5)));
        assertFalse(pub.isJointWith(Token.synthetic(TokenType.COMMA)));
    }

    @Test
    void testTokenEqualityIgnoresPosition() {
        Token parsed = Lexer.tokenize("  pub").get(0);
        assertEquals(Token.synthetic(TokenType.PUB), parsed);
        assertEquals(Token.synthetic(TokenType.PUB).hashCode(), parsed.hashCode());
        assertNotEquals(Token.synthetic(TokenType.IDENT, "pub"), parsed);
    }

    @Test
    void testUnterminatedStringReportsPosition() {
        LexException e = assertThrows(LexException.class, () -> Lexer.tokenize("x = \"abc"));
        assertEquals(1, e.getLine());
        assertEquals(4, e.getColumn());
        assertEquals("Unterminated string literal at line 1, column 4", e.getMessage());
    }

    @Test
    void testUnexpectedCharacter() {
        LexException e = assertThrows(LexException.class, () -> Lexer.tokenize("a\n`"));
        assertEquals(2, e.getLine());
        assertEquals(0, e.getColumn());
    }

    @Test
    void testUnterminatedBlockComment() {
        assertThrows(LexException.class, () -> Lexer.tokenize("/* /* */"));
    }
}
