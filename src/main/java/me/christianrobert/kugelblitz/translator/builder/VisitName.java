package me.christianrobert.kugelblitz.translator.builder;

import me.christianrobert.kugelblitz.translator.ast.Name;
import me.christianrobert.kugelblitz.translator.context.TranslationContext;

/**
 * Static helper for visiting identifiers.
 *
 * <p>Identifiers pass through unchanged, except references to the current
 * instance ({@code self}, or the receiver parameter of an instance method),
 * which become {@code this}.</p>
 */
public class VisitName {

    public static String v(Name node, TranslationContext context) {
        if (context.isInstanceReference(node.getId())) {
            return TranslationContext.INSTANCE_KEYWORD;
        }
        return node.getId();
    }
}
