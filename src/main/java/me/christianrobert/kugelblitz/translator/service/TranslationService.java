package me.christianrobert.kugelblitz.translator.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import me.christianrobert.kugelblitz.config.service.ConfigService;
import me.christianrobert.kugelblitz.translator.ast.SyntaxNode;
import me.christianrobert.kugelblitz.translator.builder.JsCodeBuilder;
import me.christianrobert.kugelblitz.translator.context.TranslationContext;
import me.christianrobert.kugelblitz.translator.context.TranslationException;
import me.christianrobert.kugelblitz.translator.context.TranslationOptions;
import me.christianrobert.kugelblitz.translator.context.TranslationResult;
import me.christianrobert.kugelblitz.translator.util.SyntaxTreeFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * High-level service for translating syntax trees to JavaScript.
 * This is the main entry point for drivers (command line tools, build plugins, tests).
 *
 * <p>Architecture:
 * <pre>
 * Syntax tree (external front end) → JsCodeBuilder → JavaScript text
 *            ↓                             ↓                ↓
 *       SyntaxNode                  Static visitors      String
 * </pre>
 *
 * <p>Usage:
 * <pre>
 * TranslationResult result = service.translate(module);
 * if (result.isSuccess()) {
 *     String javaScript = result.getJavaScript();
 * } else {
 *     // Handle error: result.getErrorMessage()
 * }
 * </pre>
 *
 * <p>Translation is all-or-nothing: a failed result never carries partial output.</p>
 */
@ApplicationScoped
public class TranslationService {

    private static final Logger log = LoggerFactory.getLogger(TranslationService.class);

    @Inject
    ConfigService configService;

    private final JsCodeBuilder builder = new JsCodeBuilder();

    /**
     * Translates a syntax tree using the configured options.
     * The formatted tree is attached when {@code translator.include-tree} is set.
     *
     * @param tree Root of the syntax tree, normally a module
     * @return TranslationResult containing either JavaScript or error details
     */
    public TranslationResult translate(SyntaxNode tree) {
        return translate(tree, configService.getConfigValueAsBoolean(ConfigService.INCLUDE_TREE, false));
    }

    /**
     * Translates a syntax tree with optional tree output.
     *
     * <p>This is the master translation method that the other overload delegates to.</p>
     *
     * @param tree Root of the syntax tree, normally a module
     * @param includeTree Whether to include the formatted tree in the result (for debugging)
     * @return TranslationResult containing JavaScript and optionally the formatted tree
     */
    public TranslationResult translate(SyntaxNode tree, boolean includeTree) {
        if (tree == null) {
            return TranslationResult.failure("Syntax tree cannot be null");
        }

        String syntaxTree = null;
        if (includeTree) {
            log.debug("Generating syntax tree representation");
            syntaxTree = SyntaxTreeFormatter.format(tree);
        }

        try {
            // STEP 1: Build context from configuration
            TranslationOptions options = currentOptions();
            log.debug("Step 1: Translating {} with {}", tree.getKind(), options);
            TranslationContext context = new TranslationContext(options);

            // STEP 2: Translate tree
            log.debug("Step 2: Translating to JavaScript");
            String javaScript = builder.visit(tree, context);

            log.info("Successfully translated {} tree", tree.getKind());
            log.trace("JavaScript: {}", javaScript);

            if (syntaxTree != null) {
                return TranslationResult.successWithTree(javaScript, syntaxTree);
            }
            return TranslationResult.success(javaScript);

        } catch (TranslationException e) {
            log.warn("Translation failed: {}", e.getDetailedMessage());
            return TranslationResult.failureWithTree(e, syntaxTree);

        } catch (RuntimeException e) {
            log.error("Unexpected error during translation", e);
            return TranslationResult.failure("Unexpected error: " + e.getMessage());
        }
    }

    /**
     * Reads the hardening switches from the configuration.
     */
    TranslationOptions currentOptions() {
        return new TranslationOptions(
            configService.getConfigValueAsBoolean(ConfigService.STRICT_TUPLES, false),
            configService.getConfigValueAsBoolean(ConfigService.STRICT_FLOOR_DIVISION, false),
            configService.getConfigValueAsBoolean(ConfigService.STRICT_CLASS_MEMBERS, false));
    }
}
