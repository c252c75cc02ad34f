package me.christianrobert.kugelblitz.translator.ast;

import java.util.List;

/**
 * Tuple literal or tuple assignment pattern.
 */
public class Tuple implements SyntaxNode {

    private final List<SyntaxNode> elements;

    public Tuple(List<? extends SyntaxNode> elements) {
        this.elements = NodeLists.copyOf(elements, "Tuple elements");
    }

    public List<SyntaxNode> getElements() {
        return elements;
    }

    public int size() {
        return elements.size();
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.TUPLE;
    }

    @Override
    public List<SyntaxNode> getChildren() {
        return elements;
    }

    @Override
    public String toString() {
        return "Tuple{elements=" + elements + "}";
    }
}
