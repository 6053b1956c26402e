package org.ardugen.tree;

public final class RandomIntNode extends OperationNode {

    public static final String FROM = "FROM";
    public static final String TO = "TO";

    public RandomIntNode() {
        super(NodeKind.MATH_RANDOM_INT);
    }

    public RandomIntNode(OperationNode from, OperationNode to) {
        this();
        setInput(FROM, from);
        setInput(TO, to);
    }

    @Override
    public <R, A> R accept(OperationVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
