package org.ardugen.tree;

public final class RandomFloatNode extends OperationNode {

    public RandomFloatNode() {
        super(NodeKind.MATH_RANDOM_FLOAT);
    }

    @Override
    public <R, A> R accept(OperationVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
