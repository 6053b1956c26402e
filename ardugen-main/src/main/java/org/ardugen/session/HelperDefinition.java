package org.ardugen.session;

/**
 * A support routine queued for output once per session.
 *
 * @param key    logical identity of the routine, e.g. {@code math_isPrime}
 * @param name   identifier issued for it in this session
 * @param source complete routine text
 */
public record HelperDefinition(String key, String name, String source) {
}
