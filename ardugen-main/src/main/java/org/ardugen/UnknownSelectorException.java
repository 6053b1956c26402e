package org.ardugen;

/**
 * An operator, property, constant, aggregate or kind tag that the emitter does not know.
 * The tree and the emitter disagree about the grammar, so there is nothing safe to emit.
 */
public class UnknownSelectorException extends CodeEmitException {

    private final String nodeKind;
    private final String fieldName;
    private final String selector;

    public UnknownSelectorException(String nodeKind, String fieldName, String selector) {
        this("Unknown " + fieldName + " '" + selector + "' on node '" + nodeKind + "'",
             nodeKind, fieldName, selector);
    }

    private UnknownSelectorException(String message, String nodeKind, String fieldName, String selector) {
        super(message, nodeKind + "." + fieldName);
        this.nodeKind = nodeKind;
        this.fieldName = fieldName;
        this.selector = selector;
    }

    /**
     * A node type name that does not map to any operation kind.
     */
    public static UnknownSelectorException forKindTag(String type) {
        return new UnknownSelectorException("Unknown node kind '" + type + "'", null, "type", type);
    }

    public String getNodeKind() {
        return nodeKind;
    }

    public String getFieldName() {
        return fieldName;
    }

    public String getSelector() {
        return selector;
    }
}
