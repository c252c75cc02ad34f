package me.christianrobert.kugelblitz.translator.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Assignment with one or more chained targets sharing a single value
 * ({@code a = b = value} has two targets).
 */
public class Assign implements SyntaxNode {

    private final List<SyntaxNode> targets;
    private final SyntaxNode value;

    public Assign(List<? extends SyntaxNode> targets, SyntaxNode value) {
        this.targets = NodeLists.copyOf(targets, "Assign targets");
        if (this.targets.isEmpty()) {
            throw new IllegalArgumentException("Assign requires at least one target");
        }
        this.value = NodeLists.require(value, "Assign value");
    }

    public Assign(SyntaxNode target, SyntaxNode value) {
        this(Collections.singletonList(NodeLists.require(target, "Assign target")), value);
    }

    public List<SyntaxNode> getTargets() {
        return targets;
    }

    public SyntaxNode getValue() {
        return value;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.ASSIGN;
    }

    @Override
    public List<SyntaxNode> getChildren() {
        List<SyntaxNode> children = new ArrayList<>(targets);
        children.add(value);
        return children;
    }

    @Override
    public String toString() {
        return "Assign{targets=" + targets + ", value=" + value + "}";
    }
}
