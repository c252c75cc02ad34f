package me.christianrobert.kugelblitz.translator.ast;

/**
 * Marker for operator leaves. Implemented by the operator enums.
 */
public interface OperatorNode extends SyntaxNode {

    @Override
    default NodeKind getKind() {
        return NodeKind.OPERATOR;
    }

    String name();

    @Override
    default String getLabel() {
        return name();
    }
}
