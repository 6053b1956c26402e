package org.ardugen.session;

/**
 * Binds logical variable identities of the tree to the identifiers used in generated code.
 */
@FunctionalInterface
public interface VariableNames {

    String nameOf(String variableId);
}
