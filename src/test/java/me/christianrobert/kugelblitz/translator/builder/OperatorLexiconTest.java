package me.christianrobert.kugelblitz.translator.builder;

import me.christianrobert.kugelblitz.translator.ast.BinaryOperator;
import me.christianrobert.kugelblitz.translator.ast.BoolOperator;
import me.christianrobert.kugelblitz.translator.ast.ComparisonOperator;
import me.christianrobert.kugelblitz.translator.ast.UnaryOperator;
import me.christianrobert.kugelblitz.translator.context.UnsupportedNodeKindException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the operator symbol table.
 */
class OperatorLexiconTest {

    @Test
    void logicalOperators() {
        assertEquals("&&", OperatorLexicon.symbolFor(BoolOperator.AND));
        assertEquals("||", OperatorLexicon.symbolFor(BoolOperator.OR));
    }

    @Test
    void arithmeticOperators() {
        assertEquals("+", OperatorLexicon.symbolFor(BinaryOperator.ADD));
        assertEquals("-", OperatorLexicon.symbolFor(BinaryOperator.SUB));
        assertEquals("*", OperatorLexicon.symbolFor(BinaryOperator.MULT));
        assertEquals("/", OperatorLexicon.symbolFor(BinaryOperator.DIV));
        assertEquals("%", OperatorLexicon.symbolFor(BinaryOperator.MOD));
    }

    @Test
    void floorDivisionSharesDivisionSymbol() {
        assertEquals(OperatorLexicon.symbolFor(BinaryOperator.DIV),
            OperatorLexicon.symbolFor(BinaryOperator.FLOOR_DIV));
    }

    @Test
    void bitwiseOperators() {
        assertEquals("<<", OperatorLexicon.symbolFor(BinaryOperator.LSHIFT));
        assertEquals(">>", OperatorLexicon.symbolFor(BinaryOperator.RSHIFT));
        assertEquals("|", OperatorLexicon.symbolFor(BinaryOperator.BIT_OR));
        assertEquals("^", OperatorLexicon.symbolFor(BinaryOperator.BIT_XOR));
        assertEquals("&", OperatorLexicon.symbolFor(BinaryOperator.BIT_AND));
    }

    @Test
    void unaryOperators() {
        assertEquals("~", OperatorLexicon.symbolFor(UnaryOperator.INVERT));
        assertEquals("!", OperatorLexicon.symbolFor(UnaryOperator.NOT));
        assertEquals("+", OperatorLexicon.symbolFor(UnaryOperator.UADD));
        assertEquals("-", OperatorLexicon.symbolFor(UnaryOperator.USUB));
    }

    @Test
    void comparisonOperators() {
        assertEquals("==", OperatorLexicon.symbolFor(ComparisonOperator.EQ));
        assertEquals("<", OperatorLexicon.symbolFor(ComparisonOperator.LT));
        assertEquals("<=", OperatorLexicon.symbolFor(ComparisonOperator.LTE));
        assertEquals(">", OperatorLexicon.symbolFor(ComparisonOperator.GT));
        assertEquals(">=", OperatorLexicon.symbolFor(ComparisonOperator.GTE));
    }

    @Test
    void powerHasNoSymbol() {
        assertFalse(OperatorLexicon.hasSymbol(BinaryOperator.POW));
        assertThrows(UnsupportedNodeKindException.class, () -> OperatorLexicon.symbolFor(BinaryOperator.POW));
    }

    @Test
    void everyOtherOperatorHasSymbol() {
        for (BinaryOperator op : BinaryOperator.values()) {
            if (op != BinaryOperator.POW) {
                assertTrue(OperatorLexicon.hasSymbol(op), "Missing symbol for " + op);
            }
        }
        for (UnaryOperator op : UnaryOperator.values()) {
            assertTrue(OperatorLexicon.hasSymbol(op), "Missing symbol for " + op);
        }
        for (ComparisonOperator op : ComparisonOperator.values()) {
            assertTrue(OperatorLexicon.hasSymbol(op), "Missing symbol for " + op);
        }
    }
}
