package org.ardugen.tree;

public final class OnListNode extends OperationNode {

    public static final String OP = "OP";
    public static final String LIST = "LIST";

    public OnListNode() {
        super(NodeKind.MATH_ON_LIST);
    }

    public OnListNode(ListOperation operation, OperationNode list) {
        this();
        setField(OP, operation.name());
        setInput(LIST, list);
    }

    public ListOperation operation() {
        return Selectors.parse(ListOperation.class, this, OP);
    }

    @Override
    public <R, A> R accept(OperationVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
