package me.christianrobert.kugelblitz.translator.ast;

import java.util.Collections;
import java.util.List;

/**
 * Expression used as a statement. Wraps the value without adding meaning.
 */
public class Expr implements SyntaxNode {

    private final SyntaxNode value;

    public Expr(SyntaxNode value) {
        this.value = NodeLists.require(value, "Expr value");
    }

    public SyntaxNode getValue() {
        return value;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.EXPR;
    }

    @Override
    public List<SyntaxNode> getChildren() {
        return Collections.singletonList(value);
    }

    @Override
    public String toString() {
        return "Expr{value=" + value + "}";
    }
}
