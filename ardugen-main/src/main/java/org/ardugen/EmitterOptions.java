package org.ardugen;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;

/**
 * Settings shared by every session created from one generator.
 * <p>
 * Can be built programmatically or read from system properties:
 * <ul>
 *     <li>{@value #RESERVED_WORDS_PROPERTY}: comma separated identifiers that generated
 *     names must never take, on top of the C++ and Arduino words always reserved</li>
 *     <li>{@value #LINE_SEPARATOR_PROPERTY}: {@code \n} (default) or {@code \r\n}, written
 *     escaped or literally</li>
 * </ul>
 */
public final class EmitterOptions {

    public static final String RESERVED_WORDS_PROPERTY = "ardugen.emitter.reservedWords";
    public static final String LINE_SEPARATOR_PROPERTY = "ardugen.emitter.lineSeparator";

    private static final EmitterOptions DEFAULTS = builder().build();

    private final Set<String> reservedWords;
    private final String lineSeparator;

    private EmitterOptions(Builder builder) {
        this.reservedWords = Collections.unmodifiableSet(new LinkedHashSet<>(builder.reservedWords));
        this.lineSeparator = builder.lineSeparator;
    }

    public static EmitterOptions defaults() {
        return DEFAULTS;
    }

    public static EmitterOptions fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    public static EmitterOptions fromProperties(Properties properties) {
        Builder builder = builder();
        String words = properties.getProperty(RESERVED_WORDS_PROPERTY);
        if (words != null) {
            Arrays.stream(words.split(","))
                    .map(String::trim)
                    .filter(word -> !word.isEmpty())
                    .forEach(builder::reservedWord);
        }
        String separator = properties.getProperty(LINE_SEPARATOR_PROPERTY);
        if (separator != null) {
            builder.lineSeparator(unescape(separator));
        }
        return builder.build();
    }

    private static String unescape(String separator) {
        return separator.replace("\\r", "\r").replace("\\n", "\n");
    }

    public static Builder builder() {
        return new Builder();
    }

    public Set<String> reservedWords() {
        return reservedWords;
    }

    public String lineSeparator() {
        return lineSeparator;
    }

    @Override
    public String toString() {
        return "EmitterOptions{reservedWords=" + reservedWords
                + ", lineSeparator=" + lineSeparator.replace("\r", "\\r").replace("\n", "\\n") + "}";
    }

    public static final class Builder {

        private final Set<String> reservedWords = new LinkedHashSet<>();
        private String lineSeparator = "\n";

        private Builder() {}

        public Builder reservedWord(String word) {
            reservedWords.add(Objects.requireNonNull(word, "word"));
            return this;
        }

        public Builder reservedWords(Collection<String> words) {
            words.forEach(this::reservedWord);
            return this;
        }

        /**
         * @throws IllegalArgumentException unless the separator is {@code \n} or {@code \r\n}
         */
        public Builder lineSeparator(String lineSeparator) {
            if (!"\n".equals(lineSeparator) && !"\r\n".equals(lineSeparator)) {
                throw new IllegalArgumentException("Unsupported line separator: "
                        + String.valueOf(lineSeparator).replace("\r", "\\r").replace("\n", "\\n"));
            }
            this.lineSeparator = lineSeparator;
            return this;
        }

        public EmitterOptions build() {
            return new EmitterOptions(this);
        }
    }
}
