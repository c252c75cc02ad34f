package me.christianrobert.kugelblitz.translator.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Call of a callee expression with positional arguments.
 */
public class Call implements SyntaxNode {

    private final SyntaxNode func;
    private final List<SyntaxNode> args;

    public Call(SyntaxNode func, List<? extends SyntaxNode> args) {
        this.func = NodeLists.require(func, "Call function");
        this.args = NodeLists.copyOf(args, "Call arguments");
    }

    public SyntaxNode getFunc() {
        return func;
    }

    public List<SyntaxNode> getArgs() {
        return args;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.CALL;
    }

    @Override
    public List<SyntaxNode> getChildren() {
        List<SyntaxNode> children = new ArrayList<>();
        children.add(func);
        children.addAll(args);
        return children;
    }

    @Override
    public String toString() {
        return "Call{func=" + func + ", args=" + args + "}";
    }
}
