package me.christianrobert.kugelblitz.translator.builder;

import me.christianrobert.kugelblitz.translator.ast.UnaryOp;
import me.christianrobert.kugelblitz.translator.context.TranslationContext;

/**
 * Static helper for unary operations: the symbol directly followed by the operand,
 * without parentheses ({@code not x} becomes {@code !x}).
 */
public class VisitUnaryOp {

    public static String v(UnaryOp node, TranslationContext context, JsCodeBuilder b) {
        return b.visit(node.getOp(), context) + b.visit(node.getOperand(), context);
    }
}
