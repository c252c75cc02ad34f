package me.christianrobert.kugelblitz.translator.ast;

/**
 * Numeric literal, kept as the front end's textual representation.
 */
public class Num implements SyntaxNode {

    private final String literal;

    public Num(String literal) {
        this.literal = NodeLists.requireIdentifier(literal, "Num literal");
    }

    public static Num of(Number value) {
        return new Num(String.valueOf(NodeLists.require(value, "Num value")));
    }

    public String getLiteral() {
        return literal;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.NUM;
    }

    @Override
    public String getLabel() {
        return literal;
    }

    @Override
    public String toString() {
        return "Num{literal='" + literal + "'}";
    }
}
