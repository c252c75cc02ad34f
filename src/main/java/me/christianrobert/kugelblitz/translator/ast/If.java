package me.christianrobert.kugelblitz.translator.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Conditional statement. An {@code elif} arrives as a single nested {@code If}
 * inside {@link #getOrelse()}.
 */
public class If implements SyntaxNode {

    private final SyntaxNode test;
    private final List<SyntaxNode> body;
    private final List<SyntaxNode> orelse;

    public If(SyntaxNode test, List<? extends SyntaxNode> body, List<? extends SyntaxNode> orelse) {
        this.test = NodeLists.require(test, "If test");
        this.body = NodeLists.copyOf(body, "If body");
        this.orelse = NodeLists.copyOf(orelse == null ? Collections.<SyntaxNode>emptyList() : orelse, "If orelse");
    }

    public If(SyntaxNode test, List<? extends SyntaxNode> body) {
        this(test, body, Collections.<SyntaxNode>emptyList());
    }

    public SyntaxNode getTest() {
        return test;
    }

    public List<SyntaxNode> getBody() {
        return body;
    }

    public List<SyntaxNode> getOrelse() {
        return orelse;
    }

    public boolean hasOrelse() {
        return !orelse.isEmpty();
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.IF;
    }

    @Override
    public List<SyntaxNode> getChildren() {
        List<SyntaxNode> children = new ArrayList<>();
        children.add(test);
        children.addAll(body);
        children.addAll(orelse);
        return children;
    }

    @Override
    public String toString() {
        return "If{test=" + test + ", body=" + body + ", orelse=" + orelse + "}";
    }
}
