package com.example.migrationcompare.application;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ComparisonKeysTest {

    @Test
    void splitRestoresKeyFragmentsInDeclaredOrder() {
        String key = ComparisonKeys.join(List.of("ACC-1", 42L, new BigDecimal("10.50")));

        assertThat(ComparisonKeys.split(key)).containsExactly("ACC-1", "42", "10.5");
    }

    @Test
    void nullFragmentIsDistinctFromEmptyAndLiteralNull() {
        String withNull = ComparisonKeys.join(Arrays.asList("A", null));
        String withEmpty = ComparisonKeys.join(List.of("A", ""));
        String withText = ComparisonKeys.join(List.of("A", "null"));

        assertThat(withNull).isNotEqualTo(withEmpty).isNotEqualTo(withText);
        assertThat(ComparisonKeys.split(withNull)).containsExactly("A", null);
    }

    @Test
    void numericallyEqualValuesProduceIdenticalKeys() {
        assertThat(ComparisonKeys.join(List.of(7L)))
                .isEqualTo(ComparisonKeys.join(List.of(new BigDecimal("7.00"))));
        assertThat(ComparisonKeys.join(List.of(BigDecimal.ZERO)))
                .isEqualTo(ComparisonKeys.join(List.of(new BigDecimal("0.000"))));
    }

    @Test
    void fragmentsContainingTheRecordIdSeparatorDoNotCollide() {
        String first = ComparisonKeys.join(List.of("A|B", "C"));
        String second = ComparisonKeys.join(List.of("A", "B|C"));

        assertThat(first).isNotEqualTo(second);
    }

    @Test
    void describeReplacesControlCharacters() {
        String key = ComparisonKeys.join(Arrays.asList("A", null, 3L));

        assertThat(ComparisonKeys.describe(key)).isEqualTo("A|<null>|3");
    }
}
