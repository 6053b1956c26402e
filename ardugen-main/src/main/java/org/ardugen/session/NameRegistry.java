package org.ardugen.session;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Session view of the identifier allocator: every name the session hands out goes through
 * the allocator, and the registry remembers which ones it issued.
 */
public final class NameRegistry {

    private final IdentifierAllocator allocator;
    private final Set<String> issued = new LinkedHashSet<>();

    public NameRegistry(IdentifierAllocator allocator) {
        this.allocator = allocator;
    }

    public String issueUniqueName(String basis) {
        String name = allocator.distinctName(basis);
        issued.add(name);
        return name;
    }

    public boolean isIssued(String name) {
        return issued.contains(name);
    }

    /**
     * @return issued names in issue order
     */
    public Set<String> issuedNames() {
        return Collections.unmodifiableSet(issued);
    }

    public IdentifierAllocator allocator() {
        return allocator;
    }
}
