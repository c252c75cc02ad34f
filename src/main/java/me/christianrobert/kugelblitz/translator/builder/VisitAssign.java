package me.christianrobert.kugelblitz.translator.builder;

import me.christianrobert.kugelblitz.translator.ast.Assign;
import me.christianrobert.kugelblitz.translator.ast.NodeKind;
import me.christianrobert.kugelblitz.translator.ast.SyntaxNode;
import me.christianrobert.kugelblitz.translator.ast.Tuple;
import me.christianrobert.kugelblitz.translator.context.SemanticException;
import me.christianrobert.kugelblitz.translator.context.TranslationContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helper for assignments.
 *
 * <p>Transformations:
 * <ul>
 *   <li>{@code a = 1} becomes {@code a = 1}</li>
 *   <li>{@code a = b = f(x)} becomes {@code a = f(x);\nb = f(x)}: every target gets its
 *       own statement, the value is translated once</li>
 *   <li>{@code (a, b) = (1, 2)} becomes {@code a = 1;\nb = 2}: elements are paired
 *       left to right</li>
 * </ul>
 *
 * <p>A tuple target needs a tuple value of the same length; anything else is a
 * {@link SemanticException}.</p>
 */
public class VisitAssign {

    public static String v(Assign node, TranslationContext context, JsCodeBuilder b) {
        List<String> statements = new ArrayList<>();
        String sharedValue = null;

        for (SyntaxNode target : node.getTargets()) {
            if (target.getKind() == NodeKind.TUPLE) {
                statements.addAll(unpackTuple((Tuple) target, node.getValue(), context, b));
            } else {
                if (sharedValue == null) {
                    sharedValue = b.visit(node.getValue(), context);
                }
                statements.add(b.visit(target, context) + " = " + sharedValue);
            }
        }

        return String.join(";\n", statements);
    }

    private static List<String> unpackTuple(Tuple target, SyntaxNode value, TranslationContext context, JsCodeBuilder b) {
        if (value.getKind() != NodeKind.TUPLE) {
            throw new SemanticException(
                "Target/value kind mismatch: cannot assign a non-tuple value to a tuple target",
                value.toString(), "Tuple assignment");
        }

        Tuple valueTuple = (Tuple) value;
        if (target.size() != valueTuple.size()) {
            throw new SemanticException(
                "Tuple length mismatch: cannot assign " + valueTuple.size()
                    + " values to " + target.size() + " targets",
                target.toString(), "Tuple assignment");
        }

        List<String> statements = new ArrayList<>(target.size());
        for (int i = 0; i < target.size(); i++) {
            statements.add(b.visit(target.getElements().get(i), context)
                + " = " + b.visit(valueTuple.getElements().get(i), context));
        }
        return statements;
    }
}
