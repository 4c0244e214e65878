package com.rvctrl.generator.signal;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for SignalIdGenerator.
 */
class SignalIdGeneratorTest {

    @Test
    void testUniqueIdIsKept() {
        assertThat(SignalIdGenerator.makeUnique("20240305_140709_123456", Set.of())).isEqualTo("20240305_140709_123456");
    }

    @Test
    void testCollidingIdGetsSuffix() {
        List<String> existing = List.of("20240305_140709_123456", "20240305_140709_123456_1");

        assertThat(SignalIdGenerator.makeUnique("20240305_140709_123456", existing))
                .isEqualTo("20240305_140709_123456_2");
    }
}
