package com.declparser.parsing;

import com.declparser.ParseException;
import com.declparser.ast.Expr;
import com.declparser.ast.ExprBinary;
import com.declparser.ast.ExprCast;
import com.declparser.ast.ExprLit;
import com.declparser.ast.ExprParen;
import com.declparser.ast.ExprPath;
import com.declparser.ast.ExprUnary;
import com.declparser.ast.TypePath;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TestExprGrammar {

    private final DeclParser parser = new DeclParser();

    private static String op(Expr expr) {
        return assertInstanceOf(ExprBinary.class, expr).op().lexeme();
    }

    @Test
    void testPrecedence() {
        ExprBinary sum = assertInstanceOf(ExprBinary.class, parser.parseExpr("1 + 2 * 3"));
        assertEquals("+", sum.op().lexeme());
        assertEquals(ExprLit.integer(1), sum.left());
        assertEquals("*", op(sum.right()));
    }

    @Test
    void testLeftAssociativity() {
        ExprBinary outer = assertInstanceOf(ExprBinary.class, parser.parseExpr("1 - 2 - 3"));
        assertEquals("-", op(outer.left()));
        assertEquals(ExprLit.integer(3), outer.right());
    }

    @Test
    void testShiftBindsTighterThanBitOr() {
        ExprBinary or = assertInstanceOf(ExprBinary.class, parser.parseExpr("1 << 4 | 2"));
        assertEquals("|", or.op().lexeme());
        assertEquals("<<", op(or.left()));
    }

    @Test
    void testUnaryAndParens() {
        ExprUnary neg = assertInstanceOf(ExprUnary.class, parser.parseExpr("-1"));
        assertEquals(ExprLit.integer(1), neg.expr());

        ExprBinary product = assertInstanceOf(ExprBinary.class, parser.parseExpr("(1 + 2) * 3"));
        assertInstanceOf(ExprParen.class, product.left());
        assertInstanceOf(ExprUnary.class, parser.parseExpr("!0"));
    }

    @Test
    void testCastBindsTighterThanAddition() {
        ExprBinary sum = assertInstanceOf(ExprBinary.class, parser.parseExpr("MAX as u8 + 1"));
        ExprCast cast = assertInstanceOf(ExprCast.class, sum.left());
        assertEquals(TypePath.of("u8"), cast.ty());
        assertInstanceOf(ExprPath.class, cast.expr());
    }

    @Test
    void testPaths() {
        ExprPath path = assertInstanceOf(ExprPath.class, parser.parseExpr("Foo::BAR"));
        assertEquals("Foo::BAR", path.path().toString());

        ExprPath turbofish = assertInstanceOf(ExprPath.class, parser.parseExpr("size_of::<u32>"));
        assertNotNull(turbofish.path().segments().get(0).arguments());
    }

    @Test
    void testLiterals() {
        for (String literal : new String[] {"0x1F", "1.5", "\"s\"", "'c'", "true", "false", "1u8"}) {
            assertInstanceOf(ExprLit.class, parser.parseExpr(literal), literal);
        }
    }

    @Test
    void testComparisonIsLooserThanArithmetic() {
        ExprBinary ge = assertInstanceOf(ExprBinary.class, parser.parseExpr("a + 1 >= b && c"));
        assertEquals("&&", ge.op().lexeme());
        assertEquals(">=", op(ge.left()));
    }

    @Test
    void testMissingOperand() {
        ParseException e = assertThrows(ParseException.class, () -> parser.parseExpr("1 +"));
        assertEquals("Expected expression (in expression) at line 1, column 3 but found end of input", e.getMessage());
    }

    @Test
    void testDeeplyNestedParens() {
        String source = "(".repeat(300) + "1" + ")".repeat(300);
        ParseException e = assertThrows(ParseException.class, () -> parser.parseExpr(source));
        assertTrue(e.getMessage().contains("recursion limit of 128 exceeded"), e.getMessage());
    }
}
