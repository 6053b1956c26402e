package org.ardugen.tree;

/**
 * {@code math_change}: adds {@code DELTA} to the variable identified by {@code VAR}.
 * This is a statement, not a value.
 */
public final class ChangeNode extends OperationNode {

    public static final String VAR = "VAR";
    public static final String DELTA = "DELTA";

    public ChangeNode() {
        super(NodeKind.MATH_CHANGE);
    }

    public ChangeNode(String variableId, OperationNode delta) {
        this();
        setField(VAR, variableId);
        setInput(DELTA, delta);
    }

    public String variableId() {
        return field(VAR);
    }

    @Override
    public <R, A> R accept(OperationVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
