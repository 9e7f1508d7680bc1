package com.declparser.parsing;

import com.declparser.ParseException;
import com.declparser.TokenType;
import com.declparser.ast.Attribute;
import com.declparser.ast.Field;
import com.declparser.ast.Fields;
import com.declparser.ast.FieldsNamed;
import com.declparser.ast.FieldsUnit;
import com.declparser.ast.FieldsUnnamed;
import com.declparser.ast.TypePath;
import com.declparser.ast.VisInherited;
import com.declparser.ast.VisPublic;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

public class TestFieldsGrammar {

    private final DeclParser parser = new DeclParser();

    @Test
    void testNamedFields() {
        FieldsNamed fields = parser.parseFieldsNamed("{ pub x: f64, y: Vec<u8>, }");
        assertEquals(2, fields.named().size());
        assertTrue(fields.named().hasTrailingPunct());

        Field x = fields.named().get(0);
        assertInstanceOf(VisPublic.class, x.vis());
        assertEquals("x", x.ident().name());
        assertEquals(TokenType.COLON, x.colonToken().type());
        assertEquals(TypePath.of("f64"), x.ty());

        assertInstanceOf(VisInherited.class, fields.named().get(1).vis());
    }

    @Test
    void testUnnamedFields() {
        FieldsUnnamed fields = parser.parseFieldsUnnamed("(pub u8, String)");
        assertEquals(2, fields.unnamed().size());
        assertFalse(fields.unnamed().hasTrailingPunct());
        for (Field field : fields.members()) {
            assertNull(field.ident());
            assertNull(field.colonToken());
        }
        assertEquals(Field.unnamed(VisPublic.of(), TypePath.of("u8")), fields.unnamed().get(0));
    }

    @Test
    void testParseFieldsPicksShapeFromFirstToken() {
        assertInstanceOf(FieldsNamed.class, parser.parseFields("{}"));
        assertInstanceOf(FieldsUnnamed.class, parser.parseFields("()"));
        assertInstanceOf(FieldsUnit.class, parser.parseFields(""));
        assertTrue(parser.parseFields("{}").members().isEmpty());
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "{ a: u8 }",
        "{ pub(crate) a: u8, pub b: &'static str, }",
        "(u8, pub(super) [u8; 4])",
        "(#[cfg(test)] T,)",
        ""
    })
    void testTagConsistency(String source) {
        Fields fields = parser.parseFields(source);
        for (Field field : fields.members()) {
            if (fields instanceof FieldsNamed) {
                assertNotNull(field.ident(), source);
                assertNotNull(field.colonToken(), source);
            } else {
                assertNull(field.ident(), source);
                assertNull(field.colonToken(), source);
            }
        }
    }

    @Test
    void testFieldAttributes() {
        FieldsNamed fields = parser.parseFieldsNamed("{ #[serde(rename = \"a\")] #[doc = \"x\"] pub a: u8 }");
        Field a = fields.named().get(0);
        assertEquals(2, a.attrs().size());
        Attribute serde = a.attrs().get(0);
        assertTrue(serde.path().isIdent("serde"));
        assertEquals(5, serde.tokens().size());
        assertEquals("\"a\"", serde.tokens().get(3).lexeme());
        assertInstanceOf(VisPublic.class, a.vis());
    }

    @Test
    void testMissingCommaBetweenFields() {
        ParseException e = assertThrows(ParseException.class, () -> parser.parseFieldsNamed("{ x: u8 y: u8 }"));
        assertEquals("Expected ',' or '}' (in named fields) at line 1, column 8 but found 'y'", e.getMessage());
    }

    @Test
    void testNamedFieldWithoutColon() {
        ParseException e = assertThrows(ParseException.class, () -> parser.parseNamedField("x u8"));
        assertEquals("Expected ':' (in field) at line 1, column 2 but found 'u8'", e.getMessage());
    }

    @Test
    void testUnnamedFieldRejectsName() {
        assertThrows(ParseException.class, () -> parser.parseFieldsUnnamed("(x: u8)"));
    }

    @Test
    void testUnbalancedAttribute() {
        ParseException e = assertThrows(ParseException.class, () -> parser.parseNamedField("#[cfg(test] a: u8"));
        assertEquals("]", e.getToken().lexeme());
    }
}
