package org.ardugen.emitter;

/**
 * Text emitted for one node. Statements carry no strength.
 */
public record EmissionResult(String text, BindingStrength strength) {

    public static EmissionResult statement(String text) {
        return new EmissionResult(text, null);
    }

    public boolean isStatement() {
        return strength == null;
    }
}
