package com.rvctrl.generator.signal;

import com.rvctrl.generator.model.EncodingType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for WidthCalculator.
 */
class WidthCalculatorTest {

    @ParameterizedTest
    @CsvSource({
            "ONE_HOT, 0, 0",
            "ONE_HOT, 1, 1",
            "ONE_HOT, 5, 5",
            "BINARY, 0, 0",
            "BINARY, 1, 0",
            "BINARY, 2, 1",
            "BINARY, 3, 2",
            "BINARY, 4, 2",
            "BINARY, 5, 3",
            "BINARY, 8, 3",
            "BINARY, 9, 4",
            "GRAY, 1, 0",
            "GRAY, 4, 2",
            "GRAY, 17, 5"
    })
    void testWidth(EncodingType type, int valueCount, int expectedWidth) {
        assertThat(WidthCalculator.width(type, valueCount)).isEqualTo(expectedWidth);
    }

    @Test
    void testNegativeValueCountIsRejected() {
        assertThatThrownBy(() -> WidthCalculator.width(EncodingType.BINARY, -1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
