package me.christianrobert.kugelblitz.translator.ast;

import java.util.List;

/**
 * Class declaration with its member statements in source order.
 */
public class ClassDef implements SyntaxNode {

    private final String name;
    private final List<SyntaxNode> body;

    public ClassDef(String name, List<? extends SyntaxNode> body) {
        this.name = NodeLists.requireIdentifier(name, "ClassDef name");
        this.body = NodeLists.copyOf(body, "ClassDef body");
    }

    public String getName() {
        return name;
    }

    public List<SyntaxNode> getBody() {
        return body;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.CLASS_DEF;
    }

    @Override
    public List<SyntaxNode> getChildren() {
        return body;
    }

    @Override
    public String getLabel() {
        return name;
    }

    @Override
    public String toString() {
        return "ClassDef{name='" + name + "', body=" + body + "}";
    }
}
