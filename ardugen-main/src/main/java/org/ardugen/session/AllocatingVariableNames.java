package org.ardugen.session;

import java.util.HashMap;
import java.util.Map;

/**
 * Gives each variable identity one identifier, drawn from the same allocator as helper
 * routine names so the two can never clash.
 */
public class AllocatingVariableNames implements VariableNames {

    private final IdentifierAllocator allocator;
    private final Map<String, String> names = new HashMap<>();

    public AllocatingVariableNames(IdentifierAllocator allocator) {
        this.allocator = allocator;
    }

    @Override
    public String nameOf(String variableId) {
        return names.computeIfAbsent(variableId, allocator::distinctName);
    }
}
