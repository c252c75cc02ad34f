package me.christianrobert.kugelblitz.translator.context;

/**
 * Structurally valid input that cannot be translated, e.g. a tuple assignment
 * whose sides differ in length.
 */
public class SemanticException extends TranslationException {

    public SemanticException(String message, String node, String context) {
        super(message, node, context);
    }
}
