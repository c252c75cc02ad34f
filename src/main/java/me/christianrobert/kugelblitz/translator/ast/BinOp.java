package me.christianrobert.kugelblitz.translator.ast;

import java.util.Arrays;
import java.util.List;

/**
 * Arithmetic or bitwise binary operation.
 */
public class BinOp implements SyntaxNode {

    private final SyntaxNode left;
    private final BinaryOperator op;
    private final SyntaxNode right;

    public BinOp(SyntaxNode left, BinaryOperator op, SyntaxNode right) {
        this.left = NodeLists.require(left, "BinOp left operand");
        this.op = NodeLists.require(op, "BinOp operator");
        this.right = NodeLists.require(right, "BinOp right operand");
    }

    public SyntaxNode getLeft() {
        return left;
    }

    public BinaryOperator getOp() {
        return op;
    }

    public SyntaxNode getRight() {
        return right;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.BIN_OP;
    }

    @Override
    public List<SyntaxNode> getChildren() {
        return Arrays.asList(left, op, right);
    }

    @Override
    public String toString() {
        return "BinOp{left=" + left + ", op=" + op + ", right=" + right + "}";
    }
}
