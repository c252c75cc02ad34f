package me.christianrobert.kugelblitz.translator.ast;

import me.christianrobert.kugelblitz.translator.context.ContractViolationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link Compare} construction.
 */
class CompareTest {

    @Test
    void singleComparisonIsBuilt() {
        Compare compare = Compare.of(new Name("x"),
            Collections.singletonList(ComparisonOperator.LT),
            Collections.singletonList(new Num("2")));

        assertEquals(ComparisonOperator.LT, compare.getOp());
        assertEquals("x", ((Name) compare.getLeft()).getId());
        assertEquals("2", ((Num) compare.getComparator()).getLiteral());
    }

    @Test
    @DisplayName("Chained comparison 1 < x < 2 is rejected")
    void chainedComparisonIsRejected() {
        ContractViolationException e = assertThrows(ContractViolationException.class, () ->
            Compare.of(new Num("1"),
                Arrays.asList(ComparisonOperator.LT, ComparisonOperator.LT),
                Arrays.asList(new Name("x"), new Num("2"))));

        assertTrue(e.getMessage().contains("Chained comparisons"));
    }

    @Test
    void mismatchedOperatorAndComparatorCountsAreRejected() {
        assertThrows(ContractViolationException.class, () ->
            Compare.of(new Name("x"),
                Collections.singletonList(ComparisonOperator.EQ),
                Arrays.asList(new Num("1"), new Num("2"))));
    }

    @Test
    void emptyOperatorListIsRejected() {
        assertThrows(ContractViolationException.class, () ->
            Compare.of(new Name("x"), Collections.emptyList(), Collections.emptyList()));
    }

    @Test
    void nullOperandThrowsException() {
        assertThrows(IllegalArgumentException.class, () ->
            new Compare(null, ComparisonOperator.EQ, new Num("1")));
    }

    @Test
    void childrenIncludeOperatorLeaf() {
        Compare compare = new Compare(new Name("a"), ComparisonOperator.GTE, new Name("b"));

        assertEquals(3, compare.getChildren().size());
        assertEquals(NodeKind.OPERATOR, compare.getChildren().get(1).getKind());
    }
}
