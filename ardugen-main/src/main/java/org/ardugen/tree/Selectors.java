package org.ardugen.tree;

import org.ardugen.UnknownSelectorException;

final class Selectors {

    private Selectors() {}

    static <E extends Enum<E>> E parse(Class<E> type, OperationNode node, String fieldName) {
        String value = node.field(fieldName);
        if (value != null) {
            for (E constant : type.getEnumConstants()) {
                if (constant.name().equals(value)) {
                    return constant;
                }
            }
        }
        throw new UnknownSelectorException(node.kind().type(), fieldName, String.valueOf(value));
    }
}
