package org.ardugen.tree;

public final class ConstantNode extends OperationNode {

    public static final String CONSTANT = "CONSTANT";

    public ConstantNode() {
        super(NodeKind.MATH_CONSTANT);
    }

    public ConstantNode(MathConstant constant) {
        this();
        setField(CONSTANT, constant.name());
    }

    public MathConstant constant() {
        return Selectors.parse(MathConstant.class, this, CONSTANT);
    }

    @Override
    public <R, A> R accept(OperationVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
