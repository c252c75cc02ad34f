package me.christianrobert.kugelblitz.translator.builder;

import me.christianrobert.kugelblitz.translator.ast.Tuple;
import me.christianrobert.kugelblitz.translator.context.SemanticException;
import me.christianrobert.kugelblitz.translator.context.TranslationContext;

/**
 * Static helper for tuple literals used as values.
 *
 * <p>Tuples have no counterpart in the output language. Only tuple-to-tuple
 * assignment is translated (see {@link VisitAssign}); anywhere else a tuple
 * becomes the placeholder {@value #PLACEHOLDER}, or is rejected in strict mode.</p>
 */
public class VisitTuple {

    public static final String PLACEHOLDER = "?tuple?";

    public static String v(Tuple node, TranslationContext context) {
        if (context.getOptions().isStrictTuples()) {
            throw new SemanticException(
                "Tuple literals are not supported as values", node.toString(), "Tuple expression");
        }
        return PLACEHOLDER;
    }
}
