package com.rvctrl.generator.cli.validation;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for value specification parsing.
 */
class GenerateOptionsValidatorTest {

    @Test
    void testParseValueSpecs() {
        List<String> errors = new ArrayList<>();

        Map<String, List<String>> specs = GenerateOptionsValidator.parseValueSpecs(
                List.of("MEM=lw, sw", "ALU=add,,sub", "NOP="), errors);

        assertThat(errors).isEmpty();
        assertThat(specs).containsExactly(
                Map.entry("MEM", List.of("lw", "sw")),
                Map.entry("ALU", List.of("add", "sub")),
                Map.entry("NOP", List.of()));
    }

    @Test
    void testInvalidSpecsAreCollected() {
        List<String> errors = new ArrayList<>();

        Map<String, List<String>> specs = GenerateOptionsValidator.parseValueSpecs(
                List.of("ALU", "=add", "MEM=lw", "MEM=sw"), errors);

        assertThat(specs).containsOnlyKeys("MEM");
        assertThat(errors).hasSize(3);
    }

    @Test
    void testParseExtensions() {
        assertThat(ConvertOptionsValidator.parseExtensions("rv_i, rv64_i,,rv_m")).containsExactly("rv_i", "rv64_i", "rv_m");
        assertThat(ConvertOptionsValidator.parseExtensions(null)).isEmpty();
    }
}
