package org.ardugen.tree;

/**
 * Single operand functions shared by {@code math_single}, {@code math_round} and {@code math_trig}.
 */
public enum SingleOperator {
    NEG, ABS, ROOT, LN, EXP, POW10, ROUND, ROUNDUP, ROUNDDOWN, SIN, COS, TAN, LOG10, ASIN, ACOS, ATAN
}
