package org.ardugen.tree;

public final class ModuloNode extends OperationNode {

    public static final String DIVIDEND = "DIVIDEND";
    public static final String DIVISOR = "DIVISOR";

    public ModuloNode() {
        super(NodeKind.MATH_MODULO);
    }

    public ModuloNode(OperationNode dividend, OperationNode divisor) {
        this();
        setInput(DIVIDEND, dividend);
        setInput(DIVISOR, divisor);
    }

    @Override
    public <R, A> R accept(OperationVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
