package me.christianrobert.kugelblitz.translator.ast;

/**
 * Arithmetic and bitwise operators of a binary operation.
 */
public enum BinaryOperator implements OperatorNode {
    ADD,
    SUB,
    MULT,
    DIV,
    MOD,
    FLOOR_DIV,
    // Emitted as a function call, has no infix symbol
    POW,
    LSHIFT,
    RSHIFT,
    BIT_OR,
    BIT_XOR,
    BIT_AND
}
