package me.christianrobert.kugelblitz.translator.ast;

import java.util.Collections;
import java.util.List;

/**
 * Return statement. The value is null for a bare {@code return}.
 */
public class Return implements SyntaxNode {

    private final SyntaxNode value;

    public Return(SyntaxNode value) {
        this.value = value;
    }

    public SyntaxNode getValue() {
        return value;
    }

    public boolean hasValue() {
        return value != null;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.RETURN;
    }

    @Override
    public List<SyntaxNode> getChildren() {
        return value == null ? Collections.emptyList() : Collections.singletonList(value);
    }

    @Override
    public String toString() {
        return "Return{value=" + value + "}";
    }
}
