package org.ardugen;

public class CodeEmitException extends ArdugenException {

    private final String nodeDescription;

    public CodeEmitException(String message, String nodeDescription) {
        super(message);
        this.nodeDescription = nodeDescription;
    }

    public CodeEmitException(String message, String nodeDescription, Throwable cause) {
        super(message, cause);
        this.nodeDescription = nodeDescription;
    }

    public String getNodeDescription() {
        return nodeDescription;
    }
}
