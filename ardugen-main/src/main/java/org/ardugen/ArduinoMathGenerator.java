package org.ardugen;

import org.ardugen.emitter.EmissionResult;
import org.ardugen.emitter.MathEmitter;
import org.ardugen.session.GenerationSession;
import org.ardugen.session.IdentifierAllocator;
import org.ardugen.session.VariableNames;
import org.ardugen.tree.OperationNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the program assembler.
 * <pre>{@code
 * ArduinoMathGenerator generator = new ArduinoMathGenerator();
 * GenerationSession session = generator.newSession();
 * String body = generator.statement(root, session);
 * List<HelperDefinition> helpers = session.drainDefinitions(); // emitted ahead of body
 * }</pre>
 * The generator itself is immutable; all per-program state lives in the session.
 */
public final class ArduinoMathGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(ArduinoMathGenerator.class);

    private final EmitterOptions options;
    private final MathEmitter emitter = new MathEmitter();

    public ArduinoMathGenerator() {
        this(EmitterOptions.fromSystemProperties());
    }

    public ArduinoMathGenerator(EmitterOptions options) {
        this.options = options;
    }

    public EmitterOptions options() {
        return options;
    }

    public GenerationSession newSession() {
        LOG.debug("Starting generation session with {}", options);
        return new GenerationSession(options);
    }

    /**
     * Starts a session backed by the program-wide identifier allocator and variable naming
     * of the caller.
     */
    public GenerationSession newSession(IdentifierAllocator allocator, VariableNames variableNames) {
        LOG.debug("Starting generation session with {} and external naming", options);
        return new GenerationSession(options, allocator, variableNames);
    }

    /**
     * Emits a value node.
     *
     * @throws CodeEmitException if the node is a statement
     */
    public EmissionResult expression(OperationNode node, GenerationSession session) {
        EmissionResult result = emitter.emit(node, session);
        if (result.isStatement()) {
            throw new CodeEmitException("Statement '" + node.kind().type() + "' used as a value", node.toString());
        }
        return result;
    }

    /**
     * Emits a node standing on its own. A value node becomes an expression statement.
     */
    public String statement(OperationNode node, GenerationSession session) {
        EmissionResult result = emitter.emit(node, session);
        if (result.isStatement()) {
            return result.text();
        }
        return result.text() + ";" + session.options().lineSeparator();
    }
}
