package org.ardugen.tree;

import java.util.EnumSet;
import java.util.Set;

/**
 * A function of one operand. The editor offers these through three blocks
 * ({@code math_single}, {@code math_round}, {@code math_trig}) that share one emission rule.
 */
public final class SingleNode extends OperationNode {

    public static final String OP = "OP";
    public static final String NUM = "NUM";

    private static final Set<SingleOperator> ROUNDING =
            EnumSet.of(SingleOperator.ROUND, SingleOperator.ROUNDUP, SingleOperator.ROUNDDOWN);
    private static final Set<SingleOperator> TRIGONOMETRY = EnumSet.of(
            SingleOperator.SIN, SingleOperator.COS, SingleOperator.TAN,
            SingleOperator.ASIN, SingleOperator.ACOS, SingleOperator.ATAN);

    public SingleNode() {
        this(NodeKind.MATH_SINGLE);
    }

    public SingleNode(NodeKind kind) {
        super(checkKind(kind));
    }

    public SingleNode(SingleOperator operator, OperationNode num) {
        this(kindFor(operator));
        setField(OP, operator.name());
        setInput(NUM, num);
    }

    /**
     * The block the editor would use for the operator.
     */
    public static NodeKind kindFor(SingleOperator operator) {
        if (ROUNDING.contains(operator)) {
            return NodeKind.MATH_ROUND;
        }
        if (TRIGONOMETRY.contains(operator)) {
            return NodeKind.MATH_TRIG;
        }
        return NodeKind.MATH_SINGLE;
    }

    private static NodeKind checkKind(NodeKind kind) {
        if (kind != NodeKind.MATH_SINGLE && kind != NodeKind.MATH_ROUND && kind != NodeKind.MATH_TRIG) {
            throw new IllegalArgumentException("Not a single operand kind: " + kind);
        }
        return kind;
    }

    public SingleOperator operator() {
        return Selectors.parse(SingleOperator.class, this, OP);
    }

    @Override
    public <R, A> R accept(OperationVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
