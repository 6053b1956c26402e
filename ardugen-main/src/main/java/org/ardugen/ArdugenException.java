package org.ardugen;

/**
 * Root of every failure raised while turning an operation tree into Arduino source.
 */
public class ArdugenException extends RuntimeException {

    public ArdugenException(String message) {
        super(message);
    }

    public ArdugenException(String message, Throwable cause) {
        super(message, cause);
    }

    public ArdugenException(Throwable cause) {
        super(cause);
    }
}
