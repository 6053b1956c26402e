package org.ardugen.session;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DistinctNameAllocatorTest {

    @Test
    void clashesGetNumericSuffix() {
        DistinctNameAllocator allocator = new DistinctNameAllocator();

        assertThat(allocator.distinctName("math_sum")).isEqualTo("math_sum");
        assertThat(allocator.distinctName("math_sum")).isEqualTo("math_sum2");
        assertThat(allocator.distinctName("math_sum")).isEqualTo("math_sum3");
    }

    @Test
    void suffixSkipsTakenCandidates() {
        DistinctNameAllocator allocator = new DistinctNameAllocator();
        allocator.reserve("total");
        allocator.reserve("total2");

        assertThat(allocator.distinctName("total")).isEqualTo("total3");
        assertThat(allocator.isTaken("total3")).isTrue();
    }

    @Test
    void reservedWordsAreNeverIssued() {
        DistinctNameAllocator allocator = new DistinctNameAllocator(List.of("sensorValue"));

        assertThat(allocator.distinctName("int")).isEqualTo("int2");
        assertThat(allocator.distinctName("setup")).isEqualTo("setup2");
        assertThat(allocator.distinctName("M_PI")).isEqualTo("M_PI2");
        assertThat(allocator.distinctName("sensorValue")).isEqualTo("sensorValue2");
        assertThat(allocator.isTaken("delay")).isTrue();
    }

    @Test
    void reservedWordsCoverEmittedMathNames() {
        assertThat(DistinctNameAllocator.ARDUINO_RESERVED_WORDS).contains(
                "pow", "sqrt", "abs", "round", "ceil", "floor", "log", "exp", "sin", "cos", "tan",
                "asin", "acos", "atan", "fmod", "isnan", "rand", "NAN", "NULL", "INFINITY", "RAND_MAX",
                "M_PI", "M_E", "M_SQRT2", "M_SQRT1_2", "sizeof", "bool", "double", "int", "long");
    }

    @ParameterizedTest
    @CsvSource({
            "counter, counter",
            "item count, item_count",
            "3rd value, my_3rd_value",
            "temp-°C, temp__C",
            "'', my_unnamed"
    })
    void safeName_mapsToLegalIdentifier(String basis, String expected) {
        assertThat(DistinctNameAllocator.safeName(basis)).isEqualTo(expected);
    }

    @Test
    void safeName_null() {
        assertThat(DistinctNameAllocator.safeName(null)).isEqualTo("my_unnamed");
    }

    @Test
    void namesAreDisambiguatedAfterSanitizing() {
        DistinctNameAllocator allocator = new DistinctNameAllocator();

        assertThat(allocator.distinctName("my list")).isEqualTo("my_list");
        assertThat(allocator.distinctName("my-list")).isEqualTo("my_list2");
    }

    @Test
    void variableNamesAreMemoizedPerIdentity() {
        DistinctNameAllocator allocator = new DistinctNameAllocator();
        AllocatingVariableNames names = new AllocatingVariableNames(allocator);

        assertThat(names.nameOf("x")).isEqualTo("x");
        assertThat(names.nameOf("x")).isEqualTo("x");
        assertThat(allocator.distinctName("x")).isEqualTo("x2");
    }

    @Test
    void registryRecordsIssuedNamesInOrder() {
        NameRegistry registry = new NameRegistry(new DistinctNameAllocator());

        registry.issueUniqueName("b");
        registry.issueUniqueName("a");
        registry.issueUniqueName("b");

        assertThat(registry.issuedNames()).containsExactly("b", "a", "b2");
        assertThat(registry.isIssued("a")).isTrue();
        assertThat(registry.isIssued("c")).isFalse();
    }
}
