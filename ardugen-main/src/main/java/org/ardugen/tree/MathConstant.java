package org.ardugen.tree;

public enum MathConstant {
    PI, E, GOLDEN_RATIO, SQRT2, SQRT1_2, INFINITY
}
