package org.ardugen.tree;

/**
 * {@code math_number}: a numeric literal kept as the text typed into the block.
 */
public final class NumberNode extends OperationNode {

    public static final String NUM = "NUM";

    public NumberNode() {
        super(NodeKind.MATH_NUMBER);
    }

    public NumberNode(String value) {
        this();
        setField(NUM, value);
    }

    public NumberNode(double value) {
        this(String.valueOf(value));
    }

    public String value() {
        return field(NUM);
    }

    @Override
    public <R, A> R accept(OperationVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
