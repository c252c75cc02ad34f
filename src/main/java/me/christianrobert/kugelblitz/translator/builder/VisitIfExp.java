package me.christianrobert.kugelblitz.translator.builder;

import me.christianrobert.kugelblitz.translator.ast.IfExp;
import me.christianrobert.kugelblitz.translator.context.TranslationContext;

/**
 * Static helper for conditional expressions.
 *
 * <p>Source: {@code body if test else orelse}<br>
 * Output: {@code test ? body : orelse}</p>
 */
public class VisitIfExp {

    public static String v(IfExp node, TranslationContext context, JsCodeBuilder b) {
        return b.visit(node.getTest(), context)
            + " ? " + b.visit(node.getBody(), context)
            + " : " + b.visit(node.getOrelse(), context);
    }
}
