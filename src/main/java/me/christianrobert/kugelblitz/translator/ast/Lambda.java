package me.christianrobert.kugelblitz.translator.ast;

import java.util.Collections;
import java.util.List;

/**
 * Anonymous function with a single expression body.
 */
public class Lambda implements SyntaxNode {

    private final List<String> parameters;
    private final SyntaxNode body;

    public Lambda(List<String> parameters, SyntaxNode body) {
        this.parameters = NodeLists.copyIdentifiers(parameters, "Lambda parameters");
        this.body = NodeLists.require(body, "Lambda body");
    }

    public List<String> getParameters() {
        return parameters;
    }

    public SyntaxNode getBody() {
        return body;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.LAMBDA;
    }

    @Override
    public List<SyntaxNode> getChildren() {
        return Collections.singletonList(body);
    }

    @Override
    public String getLabel() {
        return "(" + String.join(", ", parameters) + ")";
    }

    @Override
    public String toString() {
        return "Lambda{parameters=" + parameters + ", body=" + body + "}";
    }
}
