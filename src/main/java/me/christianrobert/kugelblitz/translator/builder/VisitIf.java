package me.christianrobert.kugelblitz.translator.builder;

import me.christianrobert.kugelblitz.translator.ast.If;
import me.christianrobert.kugelblitz.translator.context.TranslationContext;

/**
 * Static helper for conditional statements.
 *
 * <h3>Source structure (from the tree):</h3>
 * <pre>
 * if test:
 *     body
 * elif test2:      (nested If as the only orelse statement)
 *     body2
 * else:
 *     orelse
 * </pre>
 *
 * <h3>Output:</h3>
 * <pre>
 * if (test) { body }
 * else { if (test2) { body2 }
 * else { orelse } }
 * </pre>
 *
 * <p>Elif chains are not flattened: the nested If is translated inside the
 * else block exactly as the tree structures it.</p>
 */
public class VisitIf {

    public static String v(If node, TranslationContext context, JsCodeBuilder b) {
        StringBuilder result = new StringBuilder();

        result.append("if (").append(b.visit(node.getTest(), context)).append(") { ");
        result.append(VisitBody.v(node.getBody(), context, b));
        result.append(" }");

        if (node.hasOrelse()) {
            result.append("\n");
            result.append("else { ");
            result.append(VisitBody.v(node.getOrelse(), context, b));
            result.append(" }");
        }

        return result.toString();
    }
}
