package me.christianrobert.kugelblitz.translator.context;

/**
 * No translation rule exists for the encountered node.
 */
public class UnsupportedNodeKindException extends TranslationException {

    public UnsupportedNodeKindException(String message, String node) {
        super(message, node, "Node dispatch");
    }
}
