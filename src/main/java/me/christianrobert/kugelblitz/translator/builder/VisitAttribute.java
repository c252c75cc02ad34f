package me.christianrobert.kugelblitz.translator.builder;

import me.christianrobert.kugelblitz.translator.ast.Attribute;
import me.christianrobert.kugelblitz.translator.context.TranslationContext;

/**
 * Static helper for attribute access: {@code value.attr}.
 */
public class VisitAttribute {

    public static String v(Attribute node, TranslationContext context, JsCodeBuilder b) {
        return b.visit(node.getValue(), context) + "." + node.getAttr();
    }
}
