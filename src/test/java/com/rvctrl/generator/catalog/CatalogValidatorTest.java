package com.rvctrl.generator.catalog;

import com.rvctrl.generator.model.Instruction;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for CatalogValidator.
 */
class CatalogValidatorTest {

    private final CatalogValidator validator = new CatalogValidator();

    @Test
    void testValidEncodingHasNoIssues() {
        assertThat(validator.validate(List.of(instruction("add", "0000000??????????000?????0110011")))).isEmpty();
    }

    @Test
    void testShortEncoding() {
        List<String> issues = validator.validate(List.of(instruction("c.add", "1001??????????10")));

        assertThat(issues).containsExactly("Instruction 'c.add' encoding is not 32 bits: 16");
    }

    @Test
    void testIllegalCharacters() {
        List<String> issues = validator.validate(List.of(instruction("add", "0000000----------000-----0110011")));

        assertThat(issues).hasSize(1);
        assertThat(issues.get(0)).contains("illegal characters");
    }

    @Test
    void testBothIssuesReported() {
        assertThat(validator.validate(List.of(instruction("x", "01-")))).hasSize(2);
    }

    private static Instruction instruction(String name, String encoding) {
        return Instruction.builder().name(name).extension("rv_i").encoding(encoding).build();
    }
}
