package me.christianrobert.kugelblitz.translator.builder;

import me.christianrobert.kugelblitz.translator.ast.Assign;
import me.christianrobert.kugelblitz.translator.ast.ClassDef;
import me.christianrobert.kugelblitz.translator.ast.FunctionDef;
import me.christianrobert.kugelblitz.translator.ast.Name;
import me.christianrobert.kugelblitz.translator.ast.NodeKind;
import me.christianrobert.kugelblitz.translator.ast.SyntaxNode;
import me.christianrobert.kugelblitz.translator.context.SemanticException;
import me.christianrobert.kugelblitz.translator.context.TranslationContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.StringJoiner;
import java.util.TreeMap;

/**
 * Static helper for class declarations.
 *
 * <p>Source:
 * <pre>
 * class Point:
 *     origin = 0
 *     def __init__(self, x): self.x = x
 *     def norm(self): return self.x
 * </pre>
 *
 * <p>Output:
 * <pre>
 * var Point = function (x) { this.x = x; };
 * Point.prototype = { 'origin': 0,
 * 'norm': function () { return this.x; } }
 * </pre>
 *
 * <h3>Rules:</h3>
 * <ul>
 *   <li>{@value #CONSTRUCTOR_NAME} becomes the constructor, otherwise {@value #EMPTY_CONSTRUCTOR}</li>
 *   <li>Prototype entries: assignments first, then methods, each group sorted by name</li>
 *   <li>Later members with the same name replace earlier ones</li>
 *   <li>Class-level assignments need exactly one plain identifier target</li>
 *   <li>Other members (nested classes, bare expressions, ...) are left out,
 *       or rejected when strict class members are enabled</li>
 * </ul>
 */
public class VisitClassDef {

    private static final Logger log = LoggerFactory.getLogger(VisitClassDef.class);

    public static final String CONSTRUCTOR_NAME = "__init__";
    public static final String EMPTY_CONSTRUCTOR = "function () {}";

    public static String v(ClassDef node, TranslationContext context, JsCodeBuilder b) {
        // Sorted by member name for byte-stable output
        Map<String, FunctionDef> functions = new TreeMap<>();
        Map<String, SyntaxNode> assigns = new TreeMap<>();

        for (SyntaxNode member : node.getBody()) {
            if (member.getKind() == NodeKind.FUNCTION_DEF) {
                FunctionDef function = (FunctionDef) member;
                functions.put(function.getName(), function);
            } else if (member.getKind() == NodeKind.ASSIGN) {
                Assign assign = (Assign) member;
                assigns.put(memberName(node, assign), assign.getValue());
            } else if (context.getOptions().isStrictClassMembers()) {
                throw new SemanticException(
                    "Class member of kind " + member.getKind() + " cannot be translated",
                    member.toString(), "Class " + node.getName());
            } else {
                log.debug("Skipping {} member in class {}", member.getKind(), node.getName());
            }
        }

        // STEP 1: Constructor
        FunctionDef init = functions.remove(CONSTRUCTOR_NAME);
        String constructor = init != null
            ? VisitFunctionDef.instanceMethod(init, context, b)
            : EMPTY_CONSTRUCTOR;

        // STEP 2: Prototype entries, properties before methods
        StringJoiner entries = new StringJoiner(",\n");
        TranslationContext classLevel = context.forFreeFunction();
        for (Map.Entry<String, SyntaxNode> entry : assigns.entrySet()) {
            entries.add("'" + entry.getKey() + "': " + b.visit(entry.getValue(), classLevel));
        }
        for (Map.Entry<String, FunctionDef> entry : functions.entrySet()) {
            entries.add("'" + entry.getKey() + "': " + VisitFunctionDef.instanceMethod(entry.getValue(), context, b));
        }

        return "var " + node.getName() + " = " + constructor + ";\n"
            + node.getName() + ".prototype = { " + entries + " }";
    }

    private static String memberName(ClassDef owner, Assign assign) {
        if (assign.getTargets().size() != 1) {
            throw new SemanticException(
                "Class-level assignment must have exactly one target, found: " + assign.getTargets().size(),
                assign.toString(), "Class " + owner.getName());
        }
        SyntaxNode target = assign.getTargets().get(0);
        if (target.getKind() != NodeKind.NAME) {
            throw new SemanticException(
                "Class-level assignment target must be a simple name, found: " + target.getKind(),
                assign.toString(), "Class " + owner.getName());
        }
        return ((Name) target).getId();
    }
}
