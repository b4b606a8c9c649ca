package com.github.rewrite.query.analysis;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class StrategyKindTest {

    @ParameterizedTest
    @CsvSource({
            "default, DEFAULT",
            "count, COUNT",
            "toList, TO_LIST",
            "to-list, TO_LIST",
            "TO_LIST, TO_LIST",
            "yieldReturn, YIELD_RETURN"
    })
    void parsesConfigurationNames(String value, StrategyKind expected) {
        assertThat(StrategyKind.fromString(value)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({"sum", "''"})
    void unknownNamesAreNull(String value) {
        assertThat(StrategyKind.fromString(value)).isNull();
    }
}
