package org.ardugen.tree;

public final class ArithmeticNode extends OperationNode {

    public static final String OP = "OP";
    public static final String A = "A";
    public static final String B = "B";

    public ArithmeticNode() {
        super(NodeKind.MATH_ARITHMETIC);
    }

    public ArithmeticNode(ArithmeticOperator operator, OperationNode a, OperationNode b) {
        this();
        setField(OP, operator.name());
        setInput(A, a);
        setInput(B, b);
    }

    /**
     * @throws org.ardugen.UnknownSelectorException if {@code OP} holds no known operator
     */
    public ArithmeticOperator operator() {
        return Selectors.parse(ArithmeticOperator.class, this, OP);
    }

    @Override
    public <R, A> R accept(OperationVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
