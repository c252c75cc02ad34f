package me.christianrobert.kugelblitz.translator.context;

/**
 * Result of a translation operation.
 * Contains either the translated program text or an error message, never both.
 * Optionally includes the formatted syntax tree for debugging.
 */
public class TranslationResult {

    private final boolean success;
    private final String javaScript;
    private final String errorMessage;
    private final String errorType;
    private final String syntaxTree;  // Optional formatted input tree (null by default)

    private TranslationResult(boolean success, String javaScript, String errorMessage, String errorType, String syntaxTree) {
        this.success = success;
        this.javaScript = javaScript;
        this.errorMessage = errorMessage;
        this.errorType = errorType;
        this.syntaxTree = syntaxTree;
    }

    /**
     * Creates a successful translation result.
     */
    public static TranslationResult success(String javaScript) {
        return new TranslationResult(true, javaScript, null, null, null);
    }

    /**
     * Creates a successful translation result with the formatted syntax tree.
     */
    public static TranslationResult successWithTree(String javaScript, String syntaxTree) {
        return new TranslationResult(true, javaScript, null, null, syntaxTree);
    }

    /**
     * Creates a failed translation result.
     */
    public static TranslationResult failure(String errorMessage) {
        return new TranslationResult(false, null, errorMessage, null, null);
    }

    /**
     * Creates a failed translation result from an exception.
     */
    public static TranslationResult failure(TranslationException exception) {
        return failureWithTree(exception, null);
    }

    /**
     * Creates a failed translation result from an exception with the formatted syntax tree.
     */
    public static TranslationResult failureWithTree(TranslationException exception, String syntaxTree) {
        return new TranslationResult(false, null, exception.getDetailedMessage(),
            exception.getClass().getSimpleName(), syntaxTree);
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isFailure() {
        return !success;
    }

    public String getJavaScript() {
        return javaScript;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    /**
     * Simple class name of the exception that caused the failure, or null.
     */
    public String getErrorType() {
        return errorType;
    }

    public String getSyntaxTree() {
        return syntaxTree;
    }

    public boolean hasSyntaxTree() {
        return syntaxTree != null;
    }

    @Override
    public String toString() {
        if (success) {
            return "TranslationResult{success=true, javaScript='" + javaScript + "'}";
        } else {
            return "TranslationResult{success=false, error='" + errorMessage + "'}";
        }
    }
}
