package me.christianrobert.kugelblitz.translator.ast;

import java.util.Collections;
import java.util.List;

/**
 * Attribute access {@code value.attr}.
 */
public class Attribute implements SyntaxNode {

    private final SyntaxNode value;
    private final String attr;

    public Attribute(SyntaxNode value, String attr) {
        this.value = NodeLists.require(value, "Attribute value");
        this.attr = NodeLists.requireIdentifier(attr, "Attribute name");
    }

    public SyntaxNode getValue() {
        return value;
    }

    public String getAttr() {
        return attr;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.ATTRIBUTE;
    }

    @Override
    public List<SyntaxNode> getChildren() {
        return Collections.singletonList(value);
    }

    @Override
    public String getLabel() {
        return attr;
    }

    @Override
    public String toString() {
        return "Attribute{value=" + value + ", attr='" + attr + "'}";
    }
}
