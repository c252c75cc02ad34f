package me.christianrobert.kugelblitz.translator.ast;

import me.christianrobert.kugelblitz.translator.context.ContractViolationException;

import java.util.Arrays;
import java.util.List;

/**
 * Single comparison {@code left OP comparator}.
 *
 * <p>Chained comparisons such as {@code 1 < x < 2} cannot be represented;
 * {@link #of(SyntaxNode, List, List)} rejects them.</p>
 */
public class Compare implements SyntaxNode {

    private final SyntaxNode left;
    private final ComparisonOperator op;
    private final SyntaxNode comparator;

    public Compare(SyntaxNode left, ComparisonOperator op, SyntaxNode comparator) {
        this.left = NodeLists.require(left, "Compare left operand");
        this.op = NodeLists.require(op, "Compare operator");
        this.comparator = NodeLists.require(comparator, "Compare comparator");
    }

    /**
     * Builds a comparison from the operator and comparator lists a front end delivers.
     *
     * @throws ContractViolationException unless exactly one operator and one comparator are given
     */
    public static Compare of(SyntaxNode left, List<ComparisonOperator> ops, List<? extends SyntaxNode> comparators) {
        List<ComparisonOperator> operators = NodeLists.copyOf(ops, "Compare operators");
        List<SyntaxNode> operands = NodeLists.copyOf(comparators, "Compare comparators");
        if (operators.size() != 1 || operands.size() != 1) {
            throw new ContractViolationException(
                "Chained comparisons are not supported: found " + operators.size()
                    + " operators and " + operands.size() + " comparators");
        }
        return new Compare(left, operators.get(0), operands.get(0));
    }

    public SyntaxNode getLeft() {
        return left;
    }

    public ComparisonOperator getOp() {
        return op;
    }

    public SyntaxNode getComparator() {
        return comparator;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.COMPARE;
    }

    @Override
    public List<SyntaxNode> getChildren() {
        return Arrays.asList(left, op, comparator);
    }

    @Override
    public String toString() {
        return "Compare{left=" + left + ", op=" + op + ", comparator=" + comparator + "}";
    }
}
