package org.ardugen.session;

import org.ardugen.EmitterOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Mutable state of one generation pass: the name registry and the table of helper
 * routines requested so far.
 * <p>
 * A session belongs to a single pass on a single thread. Generate programs concurrently
 * with one session each.
 */
public final class GenerationSession {

    private static final Logger LOG = LoggerFactory.getLogger(GenerationSession.class);

    private final EmitterOptions options;
    private final NameRegistry names;
    private final VariableNames variableNames;

    private final Map<String, HelperDefinition> definitions = new LinkedHashMap<>();
    private final Set<String> drained = new HashSet<>();
    private final Set<String> building = new HashSet<>();

    public GenerationSession() {
        this(EmitterOptions.defaults());
    }

    public GenerationSession(EmitterOptions options) {
        this(options, new DistinctNameAllocator(options.reservedWords()));
    }

    public GenerationSession(EmitterOptions options, IdentifierAllocator allocator) {
        this(options, allocator, new AllocatingVariableNames(allocator));
    }

    public GenerationSession(EmitterOptions options, IdentifierAllocator allocator, VariableNames variableNames) {
        this.options = options;
        this.names = new NameRegistry(allocator);
        this.variableNames = variableNames;
    }

    public EmitterOptions options() {
        return options;
    }

    public NameRegistry names() {
        return names;
    }

    public String issueUniqueName(String basis) {
        return names.issueUniqueName(basis);
    }

    public String variableName(String variableId) {
        return variableNames.nameOf(variableId);
    }

    /**
     * Returns the name of the helper routine registered under {@code key}, registering it
     * first if this session has not seen the key yet. {@code buildSource} receives the
     * issued name and runs at most once per key; it may request other helpers, which are
     * then queued ahead of this one.
     *
     * @throws IllegalStateException if {@code buildSource} requests its own key
     */
    public String ensureHelper(String key, Function<String, String> buildSource) {
        HelperDefinition existing = definitions.get(key);
        if (existing != null) {
            return existing.name();
        }
        if (!building.add(key)) {
            throw new IllegalStateException("Helper '" + key + "' was requested while building itself");
        }
        try {
            String name = names.issueUniqueName(key);
            String source = buildSource.apply(name);
            definitions.put(key, new HelperDefinition(key, name, source));
            LOG.debug("Registered helper '{}' as '{}'", key, name);
            return name;
        } finally {
            building.remove(key);
        }
    }

    public Optional<HelperDefinition> helper(String key) {
        return Optional.ofNullable(definitions.get(key));
    }

    /**
     * @return every helper registered in this session, in registration order
     */
    public Collection<HelperDefinition> definitions() {
        return Collections.unmodifiableCollection(definitions.values());
    }

    /**
     * Hands the helpers registered since the last drain to the program assembler, in
     * registration order. Each helper is returned by exactly one drain.
     */
    public List<HelperDefinition> drainDefinitions() {
        List<HelperDefinition> pending = new ArrayList<>();
        for (HelperDefinition definition : definitions.values()) {
            if (drained.add(definition.key())) {
                pending.add(definition);
            }
        }
        LOG.debug("Drained {} helper definition(s)", pending.size());
        return pending;
    }
}
