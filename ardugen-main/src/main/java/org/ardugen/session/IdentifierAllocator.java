package org.ardugen.session;

/**
 * Issues identifiers that are unique across the whole generated program.
 */
public interface IdentifierAllocator {

    /**
     * Derives a legal identifier from {@code basis} that no earlier call returned and that
     * is not reserved, and marks it as taken.
     */
    String distinctName(String basis);

    /**
     * Marks a name chosen elsewhere in the program as taken.
     */
    void reserve(String name);

    boolean isTaken(String name);
}
