package me.christianrobert.kugelblitz.translator.ast;

import java.util.List;

/**
 * Named function declaration. Parameters are plain identifiers in declaration order.
 */
public class FunctionDef implements SyntaxNode {

    private final String name;
    private final List<String> parameters;
    private final List<SyntaxNode> body;

    public FunctionDef(String name, List<String> parameters, List<? extends SyntaxNode> body) {
        this.name = NodeLists.requireIdentifier(name, "FunctionDef name");
        this.parameters = NodeLists.copyIdentifiers(parameters, "FunctionDef parameters");
        this.body = NodeLists.copyOf(body, "FunctionDef body");
    }

    public String getName() {
        return name;
    }

    public List<String> getParameters() {
        return parameters;
    }

    public List<SyntaxNode> getBody() {
        return body;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.FUNCTION_DEF;
    }

    @Override
    public List<SyntaxNode> getChildren() {
        return body;
    }

    @Override
    public String getLabel() {
        return name + "(" + String.join(", ", parameters) + ")";
    }

    @Override
    public String toString() {
        return "FunctionDef{name='" + name + "', parameters=" + parameters + ", body=" + body + "}";
    }
}
