package me.christianrobert.kugelblitz.translator.builder;

import me.christianrobert.kugelblitz.translator.ast.BinaryOperator;
import me.christianrobert.kugelblitz.translator.ast.BoolOperator;
import me.christianrobert.kugelblitz.translator.ast.ComparisonOperator;
import me.christianrobert.kugelblitz.translator.ast.OperatorNode;
import me.christianrobert.kugelblitz.translator.ast.UnaryOperator;
import me.christianrobert.kugelblitz.translator.context.UnsupportedNodeKindException;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Fixed mapping from operator leaves to output symbols.
 *
 * <p>Built once when the class loads and never modified afterwards.
 * {@link BinaryOperator#POW} has no entry: it is emitted as a function call by
 * {@link VisitBinOp}.</p>
 */
public final class OperatorLexicon {

    private static final Map<OperatorNode, String> SYMBOLS;

    static {
        Map<OperatorNode, String> symbols = new HashMap<>();

        symbols.put(BoolOperator.AND, "&&");
        symbols.put(BoolOperator.OR, "||");

        symbols.put(BinaryOperator.ADD, "+");
        symbols.put(BinaryOperator.SUB, "-");
        symbols.put(BinaryOperator.MULT, "*");
        symbols.put(BinaryOperator.DIV, "/");
        symbols.put(BinaryOperator.MOD, "%");
        // Same symbol as DIV: there is no integer division operator in the output language
        symbols.put(BinaryOperator.FLOOR_DIV, "/");
        symbols.put(BinaryOperator.LSHIFT, "<<");
        symbols.put(BinaryOperator.RSHIFT, ">>");
        symbols.put(BinaryOperator.BIT_OR, "|");
        symbols.put(BinaryOperator.BIT_XOR, "^");
        symbols.put(BinaryOperator.BIT_AND, "&");

        symbols.put(UnaryOperator.INVERT, "~");
        symbols.put(UnaryOperator.NOT, "!");
        symbols.put(UnaryOperator.UADD, "+");
        symbols.put(UnaryOperator.USUB, "-");

        symbols.put(ComparisonOperator.EQ, "==");
        symbols.put(ComparisonOperator.LT, "<");
        symbols.put(ComparisonOperator.LTE, "<=");
        symbols.put(ComparisonOperator.GT, ">");
        symbols.put(ComparisonOperator.GTE, ">=");

        SYMBOLS = Collections.unmodifiableMap(symbols);
    }

    private OperatorLexicon() {
    }

    /**
     * Looks up the output symbol of an operator.
     *
     * @throws UnsupportedNodeKindException if the operator has no symbol
     */
    public static String symbolFor(OperatorNode operator) {
        String symbol = SYMBOLS.get(operator);
        if (symbol == null) {
            throw new UnsupportedNodeKindException(
                "No output symbol for operator: " + (operator == null ? null : operator.name()),
                String.valueOf(operator));
        }
        return symbol;
    }

    public static boolean hasSymbol(OperatorNode operator) {
        return SYMBOLS.containsKey(operator);
    }
}
