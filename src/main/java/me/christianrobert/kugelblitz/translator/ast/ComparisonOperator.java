package me.christianrobert.kugelblitz.translator.ast;

/**
 * Operators of a single comparison.
 */
public enum ComparisonOperator implements OperatorNode {
    EQ,
    LT,
    LTE,
    GT,
    GTE
}
