package me.christianrobert.kugelblitz.translator.builder;

import me.christianrobert.kugelblitz.translator.ast.FunctionDef;
import me.christianrobert.kugelblitz.translator.context.TranslationContext;

import java.util.List;

/**
 * Static helper for function declarations.
 *
 * <p>Free functions are bound to their own name:
 * <pre>
 * def add(a, b): return a + b
 *   →  var add = function (a, b) { return (a + b); }
 * </pre>
 *
 * <p>Instance methods (class members) become unbound function literals. The first
 * parameter is the receiver: it is dropped from the parameter list and references to
 * it in the body become {@code this}.
 * <pre>
 * def get(self, key): return self.data
 *   →  function (key) { return this.data; }
 * </pre>
 */
public class VisitFunctionDef {

    /**
     * Translates a function declared outside of a class body.
     */
    public static String v(FunctionDef node, TranslationContext context, JsCodeBuilder b) {
        String body = VisitBody.v(node.getBody(), context.forFreeFunction(), b);
        return "var " + node.getName() + " = function ("
            + String.join(", ", node.getParameters()) + ") { " + body + " }";
    }

    /**
     * Translates a function declared in a class body as an instance method.
     */
    public static String instanceMethod(FunctionDef node, TranslationContext context, JsCodeBuilder b) {
        List<String> parameters = node.getParameters();
        String receiver = parameters.isEmpty() ? null : parameters.get(0);
        List<String> emitted = parameters.isEmpty() ? parameters : parameters.subList(1, parameters.size());

        String body = VisitBody.v(node.getBody(), context.forInstanceMethod(receiver), b);
        return "function (" + String.join(", ", emitted) + ") { " + body + " }";
    }
}
