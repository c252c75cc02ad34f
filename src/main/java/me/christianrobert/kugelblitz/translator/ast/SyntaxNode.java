package me.christianrobert.kugelblitz.translator.ast;

import java.util.Collections;
import java.util.List;

/**
 * Base interface for all syntax tree nodes handed to the translator.
 *
 * <p>Trees are built by an external front end and are read-only for the
 * translator: nodes are immutable and are never modified during translation.</p>
 */
public interface SyntaxNode {

    /**
     * @return the discriminant used by the dispatcher to select a rule
     */
    NodeKind getKind();

    /**
     * Child nodes in source order. Used by tree formatting, not by translation.
     */
    default List<SyntaxNode> getChildren() {
        return Collections.emptyList();
    }

    /**
     * Short node-specific text (identifier, literal, declared name) or null.
     */
    default String getLabel() {
        return null;
    }
}
