package org.ardugen.emitter;

import java.math.BigDecimal;

final class NumberFormats {

    private NumberFormats() {}

    /**
     * Prints a number as an Arduino literal: whole values without a fraction, others in
     * plain decimal notation, magnitudes from 1e15 up in exponent notation, non-finite values
     * through the math.h macros.
     */
    static String format(double value) {
        if (Double.isNaN(value)) {
            return "NAN";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "INFINITY" : "-INFINITY";
        }
        if (value == 0) {
            return "0";
        }
        if (Math.abs(value) >= 1e15) {
            // too wide for an integer literal
            return Double.toString(value);
        }
        if (value == Math.rint(value)) {
            return Long.toString((long) value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
