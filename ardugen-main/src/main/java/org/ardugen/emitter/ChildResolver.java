package org.ardugen.emitter;

import org.ardugen.CodeEmitException;
import org.ardugen.session.GenerationSession;
import org.ardugen.tree.OperationNode;
import org.ardugen.tree.OperationVisitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Produces the text of the child connected to an input slot, parenthesised when the child
 * binds more weakly than the slot requires.
 */
public final class ChildResolver {

    private static final Logger LOG = LoggerFactory.getLogger(ChildResolver.class);

    public static final String DEFAULT_NUMBER = "0";

    private final OperationVisitor<EmissionResult, GenerationSession> emitter;

    public ChildResolver(OperationVisitor<EmissionResult, GenerationSession> emitter) {
        this.emitter = emitter;
    }

    public String resolve(OperationNode node, String slot, BindingStrength minStrength, GenerationSession session) {
        return resolve(node, slot, minStrength, session, DEFAULT_NUMBER);
    }

    /**
     * @param defaultLiteral text used when nothing is connected to {@code slot}
     */
    public String resolve(OperationNode node, String slot, BindingStrength minStrength,
                          GenerationSession session, String defaultLiteral) {
        return emitChild(node, slot, session)
                .map(result -> parenthesize(result, minStrength))
                .orElse(defaultLiteral);
    }

    /**
     * Emits the child connected to {@code slot} without parenthesising it.
     *
     * @throws CodeEmitException if the child is a statement
     */
    public Optional<EmissionResult> emitChild(OperationNode node, String slot, GenerationSession session) {
        Optional<OperationNode> child = node.input(slot);
        if (child.isEmpty()) {
            return Optional.empty();
        }
        EmissionResult result = child.get().accept(emitter, session);
        if (result.isStatement()) {
            throw new CodeEmitException("Statement '" + child.get().kind().type()
                    + "' cannot be connected to value input '" + slot + "'", node.toString());
        }
        LOG.trace("{}.{} <- '{}' ({})", node.kind().type(), slot, result.text(), result.strength());
        return Optional.of(result);
    }

    public static String parenthesize(EmissionResult result, BindingStrength minStrength) {
        if (result.strength().isAtLeast(minStrength)) {
            return result.text();
        }
        return "(" + result.text() + ")";
    }

    /**
     * Prefixes a negation sign. Text that already starts with one is separated by a space,
     * since {@code --} would lex as a decrement.
     */
    public static String negate(String operand) {
        return operand.startsWith("-") ? "- " + operand : "-" + operand;
    }
}
