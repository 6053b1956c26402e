package org.ardugen.emitter;

/**
 * How tightly emitted text binds, from weakest to strongest. Text of strength {@code S}
 * can be spliced unparenthesised wherever a strength of at most {@code S} is required.
 * <p>
 * The levels follow the C++ expression grammar for the operators the emitter produces.
 */
public enum BindingStrength {

    /** Anything, including the conditional operator. Only safe inside parentheses or as an argument. */
    NONE,
    /** {@code ==}, {@code !=} and the relational operators. */
    EQUALITY,
    /** {@code +}, {@code -}. */
    ADDITIVE,
    /** {@code *}, {@code /}, {@code %}. */
    MULTIPLICATIVE,
    /** Prefix {@code -}, {@code !}, casts. */
    UNARY_PREFIX,
    /** Function calls, subscripts, postfix operators, and parenthesised groups. */
    UNARY_POSTFIX,
    /** Literals and identifiers. */
    ATOMIC;

    public static final BindingStrength FUNCTION_CALL = UNARY_POSTFIX;

    /**
     * @return {@code true} if this binds at least as tightly as {@code other}
     */
    public boolean isAtLeast(BindingStrength other) {
        return compareTo(other) >= 0;
    }

    public static boolean strongerOrEqual(BindingStrength a, BindingStrength b) {
        return a.isAtLeast(b);
    }

    /**
     * The next stronger level; {@link #ATOMIC} is its own successor.
     */
    public BindingStrength stronger() {
        return this == ATOMIC ? ATOMIC : values()[ordinal() + 1];
    }
}
