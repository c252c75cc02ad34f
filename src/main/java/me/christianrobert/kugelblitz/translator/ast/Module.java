package me.christianrobert.kugelblitz.translator.ast;

import java.util.List;

/**
 * Program root: an ordered sequence of top-level statements.
 */
public class Module implements SyntaxNode {

    private final List<SyntaxNode> body;

    public Module(List<? extends SyntaxNode> body) {
        this.body = NodeLists.copyOf(body, "Module body");
    }

    public List<SyntaxNode> getBody() {
        return body;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.MODULE;
    }

    @Override
    public List<SyntaxNode> getChildren() {
        return body;
    }

    @Override
    public String toString() {
        return "Module{body=" + body + "}";
    }
}
