package me.christianrobert.kugelblitz.translator.builder;

import me.christianrobert.kugelblitz.translator.ast.Lambda;
import me.christianrobert.kugelblitz.translator.context.TranslationContext;

import java.util.Collections;

/**
 * Static helper for anonymous functions.
 *
 * <p>Source: {@code lambda x, y: x + y}<br>
 * Output:
 * <pre>
 * function(x, y) {
 * return (x + y);
 * }
 * </pre>
 * The single body expression is sequenced like a one-statement body and returned.
 * The enclosing context is kept, so {@code self} inside a method lambda still
 * becomes {@code this}. A parameter named like the method's receiver shadows it
 * and is emitted verbatim.</p>
 */
public class VisitLambda {

    public static String v(Lambda node, TranslationContext context, JsCodeBuilder b) {
        TranslationContext bodyContext = context;
        String receiver = context.getReceiverName();
        if (receiver != null && node.getParameters().contains(receiver)) {
            bodyContext = context.forInstanceMethod(null);
        }

        String body = VisitBody.v(Collections.singletonList(node.getBody()), bodyContext, b);
        return "function(" + String.join(", ", node.getParameters()) + ") {\n"
            + "return " + body + "\n"
            + "}";
    }
}
