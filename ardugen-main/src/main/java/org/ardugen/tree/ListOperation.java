package org.ardugen.tree;

/**
 * Aggregates of {@code math_on_list}.
 */
public enum ListOperation {
    SUM, MIN, MAX, AVERAGE, MEDIAN, MODE, STD_DEV, RANDOM
}
