package me.christianrobert.kugelblitz.translator.builder;

import me.christianrobert.kugelblitz.translator.ast.NodeKind;
import me.christianrobert.kugelblitz.translator.ast.SyntaxNode;
import me.christianrobert.kugelblitz.translator.context.TranslationContext;

import java.util.List;
import java.util.StringJoiner;

/**
 * Static helper for statement sequences (function bodies, branches, class-free module code).
 *
 * <p>Each statement is translated on its own and terminated with {@code ;}.
 * Conditional statements bring their own braces and get no terminator.</p>
 */
public class VisitBody {

    public static final String LINE_SEPARATOR = "\n";
    public static final String MODULE_SEPARATOR = "\n\n";

    public static String v(List<SyntaxNode> statements, TranslationContext context, JsCodeBuilder b) {
        return v(statements, LINE_SEPARATOR, context, b);
    }

    public static String v(List<SyntaxNode> statements, String separator, TranslationContext context, JsCodeBuilder b) {
        StringJoiner result = new StringJoiner(separator);
        for (SyntaxNode statement : statements) {
            String translated = b.visit(statement, context);
            if (statement.getKind() == NodeKind.IF) {
                result.add(translated);
            } else {
                result.add(translated + ";");
            }
        }
        return result.toString();
    }
}
