package org.ardugen.tree;

/**
 * Checks offered by {@code math_number_property}.
 */
public enum NumberProperty {
    EVEN, ODD, PRIME, WHOLE, POSITIVE, NEGATIVE, DIVISIBLE_BY
}
