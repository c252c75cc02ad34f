package me.christianrobert.kugelblitz.translator.ast;

/**
 * Closed set of node kinds the translator understands.
 *
 * <p>Every {@link SyntaxNode} reports exactly one of these kinds. The dispatcher
 * switches over this enum, so adding a kind without a rule is caught by the
 * missing case rather than by a lookup miss at runtime.</p>
 */
public enum NodeKind {
    MODULE,
    FUNCTION_DEF,
    RETURN,
    NAME,
    CLASS_DEF,
    ASSIGN,
    ATTRIBUTE,
    NUM,
    TUPLE,
    BOOL_OP,
    BIN_OP,
    COMPARE,
    UNARY_OP,
    LAMBDA,
    CALL,
    IF,
    IF_EXP,
    EXPR,

    /**
     * Operator leaves (and/or, arithmetic, bitwise, unary, comparison).
     * These resolve to a literal symbol without recursion.
     */
    OPERATOR
}
