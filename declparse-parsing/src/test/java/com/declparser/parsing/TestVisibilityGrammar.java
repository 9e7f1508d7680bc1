package com.declparser.parsing;

import com.declparser.Lexer;
import com.declparser.ParseException;
import com.declparser.TokenType;
import com.declparser.ast.Field;
import com.declparser.ast.TypePath;
import com.declparser.ast.TypeTuple;
import com.declparser.ast.VisCrate;
import com.declparser.ast.VisInherited;
import com.declparser.ast.VisPublic;
import com.declparser.ast.VisRestricted;
import com.declparser.ast.Visibility;
import com.declparser.parsing.combinator.Cursor;
import com.declparser.parsing.combinator.PResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TestVisibilityGrammar {

    private final DeclParser parser = new DeclParser();

    @Test
    void testPubCrateIsCrateNotPublic() {
        Visibility vis = parser.parseVisibility("pub(crate)");
        assertInstanceOf(VisCrate.class, vis);
        assertEquals(VisCrate.of(), vis);
    }

    @Test
    void testSelfAndSuperShorthands() {
        VisRestricted self = assertInstanceOf(VisRestricted.class, parser.parseVisibility("pub(self)"));
        assertNull(self.inToken());
        assertTrue(self.path().isIdent("self"));

        VisRestricted sup = assertInstanceOf(VisRestricted.class, parser.parseVisibility("pub(super)"));
        assertNull(sup.inToken());
        assertTrue(sup.path().isIdent("super"));
    }

    @Test
    void testInPath() {
        VisRestricted vis = assertInstanceOf(VisRestricted.class, parser.parseVisibility("pub(in a::b)"));
        assertNotNull(vis.inToken());
        assertEquals(TokenType.IN, vis.inToken().type());
        assertEquals("a::b", vis.path().toString());

        VisRestricted crate = assertInstanceOf(VisRestricted.class, parser.parseVisibility("pub(in crate::util)"));
        assertEquals("crate::util", crate.path().toString());

        // pub(in self) keeps its in token, unlike the pub(self) shorthand
        VisRestricted inSelf = assertInstanceOf(VisRestricted.class, parser.parseVisibility("pub(in self)"));
        assertNotNull(inSelf.inToken());
        assertTrue(inSelf.path().isIdent("self"));
    }

    @Test
    void testPlainPub() {
        assertEquals(VisPublic.of(), parser.parseVisibility("pub"));
    }

    @Test
    @DisplayName("No pub means inherited, and nothing is consumed")
    void testInheritedConsumesNothing() {
        assertEquals(new VisInherited(), parser.parseVisibility(""));

        Cursor start = Cursor.of(Lexer.tokenize("x: u8"), ParserOptions.DEFAULT_MAX_DEPTH);
        PResult<Visibility> result = VisibilityGrammar.visibility(start);
        PResult.Success<Visibility> s = assertInstanceOf(PResult.Success.class, result);
        assertInstanceOf(VisInherited.class, s.value());
        assertEquals(start.offset(), s.rest().offset());
    }

    @Test
    void testPubFieldWithSelfRestriction() {
        Field field = parser.parseNamedField("pub(self) field: T");
        VisRestricted vis = assertInstanceOf(VisRestricted.class, field.vis());
        assertNull(vis.inToken());
        assertTrue(vis.path().isIdent("self"));
        assertEquals("field", field.ident().name());
        assertEquals(TypePath.of("T"), field.ty());
    }

    @Test
    @DisplayName("pub followed by a parenthesized type is a public tuple field")
    void testPubFollowedByTupleType() {
        Field field = parser.parseUnnamedField("pub (crate::Foo)");
        assertInstanceOf(VisPublic.class, field.vis());
        TypeTuple tuple = assertInstanceOf(TypeTuple.class, field.ty());
        assertEquals(1, tuple.elems().size());
        assertEquals(TypePath.of("crate", "Foo"), tuple.elems().get(0));
    }

    @Test
    void testMissingCloseParenIsReportedAtTheMissingDelimiter() {
        ParseException e = assertThrows(ParseException.class, () -> parser.parseVisibility("pub(crate T"));
        assertEquals("Expected ')' (in visibility qualifier, e.g. `pub`) at line 1, column 10 but found 'T'",
            e.getMessage());
        assertEquals(1, e.getLine());
        assertEquals(10, e.getColumn());
        assertEquals("T", e.getToken().lexeme());
        assertEquals("visibility qualifier, e.g. `pub`", e.getDescription());
    }

    @Test
    void testInWithoutPath() {
        ParseException e = assertThrows(ParseException.class, () -> parser.parseVisibility("pub(in)"));
        assertEquals(6, e.getColumn());
        assertEquals(")", e.getToken().lexeme());
    }
}
