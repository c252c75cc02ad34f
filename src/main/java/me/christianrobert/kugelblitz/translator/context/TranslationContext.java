package me.christianrobert.kugelblitz.translator.context;

/**
 * Per-call translation state passed down the recursion.
 *
 * <p>Contains:
 * <ul>
 *   <li>Whether the enclosing function is translated as an instance method</li>
 *   <li>The receiver parameter name of that method (elided from the parameter list)</li>
 *   <li>The {@link TranslationOptions} of this translation</li>
 * </ul>
 *
 * <p>Instances are immutable. Rules derive a new context for nested function bodies
 * instead of changing the current one, so one context may be shared across threads.</p>
 */
public class TranslationContext {

    /**
     * Reserved self-reference identifier of the source language.
     */
    public static final String SELF_IDENTIFIER = "self";

    /**
     * Instance reference keyword of the output language.
     */
    public static final String INSTANCE_KEYWORD = "this";

    private final TranslationOptions options;
    private final boolean instanceMethod;
    private final String receiverName;

    private TranslationContext(TranslationOptions options, boolean instanceMethod, String receiverName) {
        if (options == null) {
            throw new IllegalArgumentException("Translation options cannot be null");
        }
        this.options = options;
        this.instanceMethod = instanceMethod;
        this.receiverName = receiverName;
    }

    /**
     * Creates a top-level (free function) context.
     */
    public TranslationContext(TranslationOptions options) {
        this(options, false, null);
    }

    public static TranslationContext defaults() {
        return new TranslationContext(TranslationOptions.defaults());
    }

    /**
     * Derives the context for the body of an instance method.
     *
     * @param receiverName first declared parameter, or null when the method declares none
     */
    public TranslationContext forInstanceMethod(String receiverName) {
        return new TranslationContext(options, true, receiverName);
    }

    /**
     * Derives the context for the body of a free function.
     */
    public TranslationContext forFreeFunction() {
        if (!instanceMethod) {
            return this;
        }
        return new TranslationContext(options, false, null);
    }

    public TranslationOptions getOptions() {
        return options;
    }

    public boolean isInstanceMethod() {
        return instanceMethod;
    }

    public String getReceiverName() {
        return receiverName;
    }

    /**
     * Checks whether an identifier refers to the current instance.
     * {@code self} always does; in an instance method the receiver parameter does too.
     */
    public boolean isInstanceReference(String identifier) {
        if (SELF_IDENTIFIER.equals(identifier)) {
            return true;
        }
        return instanceMethod && receiverName != null && receiverName.equals(identifier);
    }

    @Override
    public String toString() {
        return "TranslationContext{instanceMethod=" + instanceMethod
            + ", receiverName='" + receiverName + "', options=" + options + "}";
    }
}
