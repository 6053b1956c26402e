package org.ardugen.tree;

/**
 * Binary operators of {@code math_arithmetic}.
 */
public enum ArithmeticOperator {
    ADD, MINUS, MULTIPLY, DIVIDE, POWER
}
