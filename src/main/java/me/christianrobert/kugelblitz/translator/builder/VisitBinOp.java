package me.christianrobert.kugelblitz.translator.builder;

import me.christianrobert.kugelblitz.translator.ast.BinOp;
import me.christianrobert.kugelblitz.translator.ast.BinaryOperator;
import me.christianrobert.kugelblitz.translator.context.SemanticException;
import me.christianrobert.kugelblitz.translator.context.TranslationContext;

/**
 * Static helper for arithmetic and bitwise binary operations.
 *
 * <p>Transformations:
 * <ul>
 *   <li>{@code a ** b} becomes {@code Math.pow(a, b)}, the qualified form of {@code pow(a, b)}
 *       that the generated code can call without a helper</li>
 *   <li>{@code a // b} becomes {@code (a / b)}: true and floor division share one
 *       operator, the result is not floored (rejected in strict mode)</li>
 *   <li>everything else becomes {@code (left OP right)}</li>
 * </ul>
 */
public class VisitBinOp {

    static final String POWER_FUNCTION = "Math.pow";

    public static String v(BinOp node, TranslationContext context, JsCodeBuilder b) {
        if (node.getOp() == BinaryOperator.POW) {
            return POWER_FUNCTION + "(" + b.visit(node.getLeft(), context)
                + ", " + b.visit(node.getRight(), context) + ")";
        }

        if (node.getOp() == BinaryOperator.FLOOR_DIV && context.getOptions().isStrictFloorDivision()) {
            throw new SemanticException(
                "Floor division has no exact equivalent in the output language",
                node.toString(), "Binary operation");
        }

        return "(" + b.visit(node.getLeft(), context)
            + " " + b.visit(node.getOp(), context) + " "
            + b.visit(node.getRight(), context) + ")";
    }
}
