package me.christianrobert.kugelblitz.translator.ast;

import java.util.Arrays;
import java.util.List;

/**
 * Prefix unary operation.
 */
public class UnaryOp implements SyntaxNode {

    private final UnaryOperator op;
    private final SyntaxNode operand;

    public UnaryOp(UnaryOperator op, SyntaxNode operand) {
        this.op = NodeLists.require(op, "UnaryOp operator");
        this.operand = NodeLists.require(operand, "UnaryOp operand");
    }

    public UnaryOperator getOp() {
        return op;
    }

    public SyntaxNode getOperand() {
        return operand;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.UNARY_OP;
    }

    @Override
    public List<SyntaxNode> getChildren() {
        return Arrays.asList(op, operand);
    }

    @Override
    public String toString() {
        return "UnaryOp{op=" + op + ", operand=" + operand + "}";
    }
}
