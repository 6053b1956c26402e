package org.ardugen.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Allocates C++ identifiers, disambiguating clashes with a numeric suffix:
 * {@code math_sum}, {@code math_sum2}, {@code math_sum3}, ...
 * <p>
 * C++ keywords and the Arduino core API are always reserved. Not thread-safe.
 */
public class DistinctNameAllocator implements IdentifierAllocator {

    private static final Logger LOG = LoggerFactory.getLogger(DistinctNameAllocator.class);

    static final Set<String> ARDUINO_RESERVED_WORDS = Set.of(
            // C++ keywords
            "alignas", "alignof", "and", "asm", "auto", "bool", "break", "case", "catch", "char",
            "class", "const", "constexpr", "continue", "default", "delete", "do", "double", "else",
            "enum", "explicit", "extern", "false", "float", "for", "friend", "goto", "if", "inline",
            "int", "long", "mutable", "namespace", "new", "noexcept", "not", "nullptr", "operator",
            "or", "private", "protected", "public", "register", "return", "short", "signed",
            "sizeof", "static", "struct", "switch", "template", "this", "throw", "true", "try",
            "typedef", "typename", "union", "unsigned", "using", "virtual", "void", "volatile",
            "while", "xor",
            // Arduino types and constants
            "boolean", "byte", "word", "String", "size_t", "HIGH", "LOW", "INPUT", "OUTPUT",
            "INPUT_PULLUP", "LED_BUILTIN", "NULL", "NAN", "INFINITY", "RAND_MAX",
            "M_PI", "M_E", "M_SQRT2", "M_SQRT1_2",
            // Arduino core API
            "setup", "loop", "pinMode", "digitalWrite", "digitalRead", "analogReference",
            "analogRead", "analogWrite", "tone", "noTone", "shiftOut", "shiftIn", "pulseIn",
            "millis", "micros", "delay", "delayMicroseconds", "min", "max", "abs", "constrain",
            "map", "pow", "sqrt", "sq", "sin", "cos", "tan", "asin", "acos", "atan", "log",
            "exp", "round", "ceil", "floor", "fmod", "isnan", "rand", "random", "randomSeed",
            "lowByte", "highByte", "bitRead", "bitWrite", "bitSet", "bitClear", "bit",
            "attachInterrupt", "detachInterrupt", "interrupts", "noInterrupts", "Serial");

    private final Set<String> reserved = new HashSet<>(ARDUINO_RESERVED_WORDS);
    private final Set<String> taken = new HashSet<>();

    public DistinctNameAllocator() {
        this(Set.of());
    }

    public DistinctNameAllocator(Collection<String> extraReservedWords) {
        reserved.addAll(extraReservedWords);
    }

    @Override
    public String distinctName(String basis) {
        String safe = safeName(basis);
        String candidate = safe;
        int suffix = 2;
        while (isTaken(candidate)) {
            candidate = safe + suffix;
            suffix++;
        }
        taken.add(candidate);
        if (!candidate.equals(safe)) {
            LOG.debug("Identifier '{}' is taken, issued '{}'", safe, candidate);
        }
        return candidate;
    }

    @Override
    public void reserve(String name) {
        taken.add(name);
    }

    @Override
    public boolean isTaken(String name) {
        return reserved.contains(name) || taken.contains(name);
    }

    /**
     * Maps any text onto a legal C++ identifier: characters outside {@code [A-Za-z0-9_]}
     * become {@code _}, and a leading digit or an empty basis gets a {@code my_} prefix.
     */
    static String safeName(String basis) {
        if (basis == null || basis.isEmpty()) {
            return "my_unnamed";
        }
        StringBuilder sb = new StringBuilder(basis.length());
        for (int i = 0; i < basis.length(); i++) {
            char c = basis.charAt(i);
            boolean legal = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '_';
            sb.append(legal ? c : '_');
        }
        if (Character.isDigit(sb.charAt(0))) {
            sb.insert(0, "my_");
        }
        return sb.toString();
    }
}
