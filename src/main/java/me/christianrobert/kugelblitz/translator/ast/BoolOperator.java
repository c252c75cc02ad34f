package me.christianrobert.kugelblitz.translator.ast;

/**
 * Logical operators of a boolean operation.
 */
public enum BoolOperator implements OperatorNode {
    AND,
    OR
}
