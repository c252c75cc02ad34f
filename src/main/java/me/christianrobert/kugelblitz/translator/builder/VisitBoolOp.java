package me.christianrobert.kugelblitz.translator.builder;

import me.christianrobert.kugelblitz.translator.ast.BoolOp;
import me.christianrobert.kugelblitz.translator.context.TranslationContext;

/**
 * Static helper for {@code and} / {@code or}: {@code (left && right)}.
 */
public class VisitBoolOp {

    public static String v(BoolOp node, TranslationContext context, JsCodeBuilder b) {
        return "(" + b.visit(node.getLeft(), context)
            + " " + b.visit(node.getOp(), context) + " "
            + b.visit(node.getRight(), context) + ")";
    }
}
