package org.ardugen.tree;

import org.ardugen.UnknownSelectorException;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Kind tag of an {@link OperationNode}, carrying the block type name used by the editor.
 */
public enum NodeKind {

    MATH_NUMBER("math_number"),
    MATH_ARITHMETIC("math_arithmetic"),
    MATH_SINGLE("math_single"),
    MATH_ROUND("math_round"),
    MATH_TRIG("math_trig"),
    MATH_CONSTANT("math_constant"),
    MATH_NUMBER_PROPERTY("math_number_property"),
    MATH_CHANGE("math_change"),
    MATH_ON_LIST("math_on_list"),
    MATH_MODULO("math_modulo"),
    MATH_CONSTRAIN("math_constrain"),
    MATH_RANDOM_INT("math_random_int"),
    MATH_RANDOM_FLOAT("math_random_float"),
    VARIABLES_GET("variables_get");

    private static final Map<String, NodeKind> BY_TYPE = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(NodeKind::type, Function.identity()));

    private final String type;

    NodeKind(String type) {
        this.type = type;
    }

    public String type() {
        return type;
    }

    /**
     * @throws UnknownSelectorException if no kind has the given type name
     */
    public static NodeKind fromType(String type) {
        NodeKind kind = type == null ? null : BY_TYPE.get(type);
        if (kind == null) {
            throw UnknownSelectorException.forKindTag(type);
        }
        return kind;
    }
}
