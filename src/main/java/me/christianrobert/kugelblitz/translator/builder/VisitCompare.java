package me.christianrobert.kugelblitz.translator.builder;

import me.christianrobert.kugelblitz.translator.ast.Compare;
import me.christianrobert.kugelblitz.translator.context.TranslationContext;

/**
 * Static helper for comparisons: {@code (left OP comparator)}.
 * Chained comparisons never reach this rule, {@link Compare} cannot hold them.
 */
public class VisitCompare {

    public static String v(Compare node, TranslationContext context, JsCodeBuilder b) {
        return "(" + b.visit(node.getLeft(), context)
            + " " + b.visit(node.getOp(), context) + " "
            + b.visit(node.getComparator(), context) + ")";
    }
}
