package org.ardugen.tree;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One operation of an authored block tree.
 * <p>
 * A node owns its field values (numbers, selectors, variable identities, all kept as the
 * editor's literal strings) and refers to, but does not own, the children connected to
 * its input slots. A slot with no child is unconnected.
 */
public abstract sealed class OperationNode
        permits NumberNode, ArithmeticNode, SingleNode, ConstantNode, NumberPropertyNode, ChangeNode,
                VariableGetNode, OnListNode, ModuloNode, ConstrainNode, RandomIntNode, RandomFloatNode {

    private final NodeKind kind;
    private final Map<String, String> fields = new LinkedHashMap<>();
    private final Map<String, OperationNode> inputs = new LinkedHashMap<>();

    protected OperationNode(NodeKind kind) {
        this.kind = kind;
    }

    /**
     * Creates an empty node for a block type name, as a tree loader would.
     *
     * @throws org.ardugen.UnknownSelectorException if the type name is not a known kind
     */
    public static OperationNode create(String type) {
        NodeKind kind = NodeKind.fromType(type);
        return switch (kind) {
            case MATH_NUMBER -> new NumberNode();
            case MATH_ARITHMETIC -> new ArithmeticNode();
            case MATH_SINGLE, MATH_ROUND, MATH_TRIG -> new SingleNode(kind);
            case MATH_CONSTANT -> new ConstantNode();
            case MATH_NUMBER_PROPERTY -> new NumberPropertyNode();
            case MATH_CHANGE -> new ChangeNode();
            case VARIABLES_GET -> new VariableGetNode();
            case MATH_ON_LIST -> new OnListNode();
            case MATH_MODULO -> new ModuloNode();
            case MATH_CONSTRAIN -> new ConstrainNode();
            case MATH_RANDOM_INT -> new RandomIntNode();
            case MATH_RANDOM_FLOAT -> new RandomFloatNode();
        };
    }

    public NodeKind kind() {
        return kind;
    }

    /**
     * @return the literal value of the field, or {@code null} when the field is not set
     */
    public String field(String name) {
        return fields.get(name);
    }

    public OperationNode setField(String name, String value) {
        if (value == null) {
            fields.remove(name);
        } else {
            fields.put(name, value);
        }
        return this;
    }

    public Optional<OperationNode> input(String slot) {
        return Optional.ofNullable(inputs.get(slot));
    }

    /**
     * Connects a child to a slot; {@code null} disconnects it.
     */
    public OperationNode setInput(String slot, OperationNode child) {
        if (child == null) {
            inputs.remove(slot);
        } else {
            inputs.put(slot, child);
        }
        return this;
    }

    public Map<String, String> getFields() {
        return Collections.unmodifiableMap(fields);
    }

    public Map<String, OperationNode> getInputs() {
        return Collections.unmodifiableMap(inputs);
    }

    public abstract <R, A> R accept(OperationVisitor<R, A> visitor, A arg);

    @Override
    public String toString() {
        return kind.type() + fields;
    }
}
