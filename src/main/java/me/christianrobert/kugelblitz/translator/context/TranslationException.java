package me.christianrobert.kugelblitz.translator.context;

/**
 * Exception thrown during translation of a syntax tree.
 * Carries a description of the offending node and of the rule that rejected it.
 *
 * <p>Translation is all-or-nothing: once thrown, the exception unwinds the whole
 * recursion and no partial output is produced.</p>
 */
public class TranslationException extends RuntimeException {

    private final String node;
    private final String context;

    public TranslationException(String message) {
        this(message, null, null);
    }

    public TranslationException(String message, String node, String context) {
        super(message);
        this.node = node;
        this.context = context;
    }

    /**
     * Description of the node that failed, or null for construction-time errors.
     */
    public String getNode() {
        return node;
    }

    public String getContext() {
        return context;
    }

    /**
     * Message followed by the node and context descriptions, when present.
     */
    public String getDetailedMessage() {
        StringBuilder sb = new StringBuilder(getMessage());
        if (node != null) {
            sb.append("\nNode: ").append(node);
        }
        if (context != null) {
            sb.append("\nContext: ").append(context);
        }
        return sb.toString();
    }
}
