package me.christianrobert.kugelblitz.translator.ast;

/**
 * Identifier reference.
 */
public class Name implements SyntaxNode {

    private final String id;

    public Name(String id) {
        this.id = NodeLists.requireIdentifier(id, "Name id");
    }

    public String getId() {
        return id;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.NAME;
    }

    @Override
    public String getLabel() {
        return id;
    }

    @Override
    public String toString() {
        return "Name{id='" + id + "'}";
    }
}
