package me.christianrobert.kugelblitz.translator.builder;

import me.christianrobert.kugelblitz.translator.ast.Return;
import me.christianrobert.kugelblitz.translator.context.TranslationContext;

/**
 * Static helper for return statements.
 *
 * <p>{@code return value} keeps its shape; a bare {@code return} stays bare.</p>
 */
public class VisitReturn {

    public static String v(Return node, TranslationContext context, JsCodeBuilder b) {
        StringBuilder result = new StringBuilder("return");

        if (node.hasValue()) {
            result.append(" ").append(b.visit(node.getValue(), context));
        }

        return result.toString();
    }
}
