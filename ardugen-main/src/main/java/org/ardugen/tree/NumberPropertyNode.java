package org.ardugen.tree;

/**
 * {@code math_number_property}: tests a number for a property. Only
 * {@link NumberProperty#DIVISIBLE_BY} reads the {@code DIVISOR} slot.
 */
public final class NumberPropertyNode extends OperationNode {

    public static final String PROPERTY = "PROPERTY";
    public static final String NUMBER_TO_CHECK = "NUMBER_TO_CHECK";
    public static final String DIVISOR = "DIVISOR";

    public NumberPropertyNode() {
        super(NodeKind.MATH_NUMBER_PROPERTY);
    }

    public NumberPropertyNode(NumberProperty property, OperationNode numberToCheck) {
        this();
        setField(PROPERTY, property.name());
        setInput(NUMBER_TO_CHECK, numberToCheck);
    }

    public NumberPropertyNode(OperationNode numberToCheck, OperationNode divisor) {
        this(NumberProperty.DIVISIBLE_BY, numberToCheck);
        setInput(DIVISOR, divisor);
    }

    public NumberProperty property() {
        return Selectors.parse(NumberProperty.class, this, PROPERTY);
    }

    @Override
    public <R, A> R accept(OperationVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
