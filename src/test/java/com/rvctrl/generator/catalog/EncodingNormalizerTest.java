package com.rvctrl.generator.catalog;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for EncodingNormalizer.
 */
class EncodingNormalizerTest {

    @Test
    void testNormalizeAddEncoding() {
        String normalized = EncodingNormalizer.normalize("0000000----------000-----0110011");

        assertThat(normalized).isEqualTo("0000000??????????000?????0110011");
        assertThat(normalized).hasSize(32);
    }

    @Test
    void testEveryNonBinaryCharacterBecomesDontCare() {
        assertThat(EncodingNormalizer.normalize("01x -?Z")).isEqualTo("01?????");
    }

    @Test
    void testAlreadyCanonicalIsUnchanged() {
        String canonical = "0000000??????????000?????0110011";
        assertThat(EncodingNormalizer.normalize(canonical)).isEqualTo(canonical);
    }

    @Test
    void testEmptyInput() {
        assertThat(EncodingNormalizer.normalize("")).isEmpty();
    }

    @Test
    void testNullIsRejected() {
        assertThatThrownBy(() -> EncodingNormalizer.normalize(null))
                .isInstanceOf(NullPointerException.class);
    }
}
