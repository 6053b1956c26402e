package org.ardugen.tree;

/**
 * {@code math_constrain}: clamps {@code VALUE} into {@code [LOW, HIGH]}.
 */
public final class ConstrainNode extends OperationNode {

    public static final String VALUE = "VALUE";
    public static final String LOW = "LOW";
    public static final String HIGH = "HIGH";

    public ConstrainNode() {
        super(NodeKind.MATH_CONSTRAIN);
    }

    public ConstrainNode(OperationNode value, OperationNode low, OperationNode high) {
        this();
        setInput(VALUE, value);
        setInput(LOW, low);
        setInput(HIGH, high);
    }

    @Override
    public <R, A> R accept(OperationVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
