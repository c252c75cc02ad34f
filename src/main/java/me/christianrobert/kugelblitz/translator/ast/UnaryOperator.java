package me.christianrobert.kugelblitz.translator.ast;

/**
 * Prefix operators of a unary operation.
 */
public enum UnaryOperator implements OperatorNode {
    INVERT,
    NOT,
    UADD,
    USUB
}
