package me.christianrobert.kugelblitz.translator.ast;

import java.util.Arrays;
import java.util.List;

/**
 * Conditional expression {@code body if test else orelse}.
 */
public class IfExp implements SyntaxNode {

    private final SyntaxNode test;
    private final SyntaxNode body;
    private final SyntaxNode orelse;

    public IfExp(SyntaxNode test, SyntaxNode body, SyntaxNode orelse) {
        this.test = NodeLists.require(test, "IfExp test");
        this.body = NodeLists.require(body, "IfExp body");
        this.orelse = NodeLists.require(orelse, "IfExp orelse");
    }

    public SyntaxNode getTest() {
        return test;
    }

    public SyntaxNode getBody() {
        return body;
    }

    public SyntaxNode getOrelse() {
        return orelse;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.IF_EXP;
    }

    @Override
    public List<SyntaxNode> getChildren() {
        return Arrays.asList(test, body, orelse);
    }

    @Override
    public String toString() {
        return "IfExp{test=" + test + ", body=" + body + ", orelse=" + orelse + "}";
    }
}
