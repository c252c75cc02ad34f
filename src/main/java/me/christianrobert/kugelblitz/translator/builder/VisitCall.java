package me.christianrobert.kugelblitz.translator.builder;

import me.christianrobert.kugelblitz.translator.ast.Call;
import me.christianrobert.kugelblitz.translator.ast.SyntaxNode;
import me.christianrobert.kugelblitz.translator.context.TranslationContext;

import java.util.StringJoiner;

/**
 * Static helper for calls: {@code callee(arg0, arg1, ...)}.
 */
public class VisitCall {

    public static String v(Call node, TranslationContext context, JsCodeBuilder b) {
        StringJoiner args = new StringJoiner(", ");
        for (SyntaxNode arg : node.getArgs()) {
            args.add(b.visit(arg, context));
        }
        return b.visit(node.getFunc(), context) + "(" + args + ")";
    }
}
