package org.ardugen.tree;

public final class VariableGetNode extends OperationNode {

    public static final String VAR = "VAR";

    public VariableGetNode() {
        super(NodeKind.VARIABLES_GET);
    }

    public VariableGetNode(String variableId) {
        this();
        setField(VAR, variableId);
    }

    public String variableId() {
        return field(VAR);
    }

    @Override
    public <R, A> R accept(OperationVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
