package me.christianrobert.kugelblitz.translator.ast;

import me.christianrobert.kugelblitz.translator.context.ContractViolationException;

import java.util.Arrays;
import java.util.List;

/**
 * Two-operand boolean operation ({@code and} / {@code or}).
 *
 * <p>Front ends that deliver a flat value list (as in {@code a and b and c}) should
 * use {@link #of(BoolOperator, List)}, which folds the list into nested two-operand
 * operations from the left.</p>
 */
public class BoolOp implements SyntaxNode {

    private final BoolOperator op;
    private final SyntaxNode left;
    private final SyntaxNode right;

    public BoolOp(BoolOperator op, SyntaxNode left, SyntaxNode right) {
        this.op = NodeLists.require(op, "BoolOp operator");
        this.left = NodeLists.require(left, "BoolOp left operand");
        this.right = NodeLists.require(right, "BoolOp right operand");
    }

    /**
     * Builds a boolean operation from a flat operand list.
     *
     * @param op operator shared by all operands
     * @param values at least two operands, in source order
     * @return left-nested operation tree
     * @throws ContractViolationException if fewer than two operands are given
     */
    public static BoolOp of(BoolOperator op, List<? extends SyntaxNode> values) {
        List<SyntaxNode> operands = NodeLists.copyOf(values, "BoolOp values");
        if (operands.size() < 2) {
            throw new ContractViolationException(
                "Boolean operation requires at least 2 operands, found: " + operands.size());
        }
        BoolOp result = new BoolOp(op, operands.get(0), operands.get(1));
        for (int i = 2; i < operands.size(); i++) {
            result = new BoolOp(op, result, operands.get(i));
        }
        return result;
    }

    public BoolOperator getOp() {
        return op;
    }

    public SyntaxNode getLeft() {
        return left;
    }

    public SyntaxNode getRight() {
        return right;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.BOOL_OP;
    }

    @Override
    public List<SyntaxNode> getChildren() {
        return Arrays.asList(left, op, right);
    }

    @Override
    public String toString() {
        return "BoolOp{op=" + op + ", left=" + left + ", right=" + right + "}";
    }
}
