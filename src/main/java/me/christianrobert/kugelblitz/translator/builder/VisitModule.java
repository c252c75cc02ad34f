package me.christianrobert.kugelblitz.translator.builder;

import me.christianrobert.kugelblitz.translator.ast.Module;
import me.christianrobert.kugelblitz.translator.context.TranslationContext;

/**
 * Static helper for the program root. Top-level statements are separated by a blank line.
 */
public class VisitModule {

    public static String v(Module node, TranslationContext context, JsCodeBuilder b) {
        return VisitBody.v(node.getBody(), VisitBody.MODULE_SEPARATOR, context, b);
    }
}
