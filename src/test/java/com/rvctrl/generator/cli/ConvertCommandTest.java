package com.rvctrl.generator.cli;

import com.rvctrl.generator.GeneratorApplication;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the "convert" command.
 */
class ConvertCommandTest {

    @TempDir
    Path tempDir;

    private Path database;
    private Path output;

    @BeforeEach
    void setUp() throws IOException {
        database = tempDir.resolve("instr_dict.json");
        output = tempDir.resolve("riscv_instructions.csv");
        Files.writeString(database, """
                {
                  "add": {"encoding": "0000000----------000-----0110011",
                          "variable_fields": ["rd", "rs1", "rs2"], "extension": ["rv_i"]},
                  "mul": {"encoding": "0000001----------000-----0110011",
                          "variable_fields": ["rd", "rs1", "rs2"], "extension": ["rv_m"]},
                  "c_add": {"encoding": "1001----------10",
                            "variable_fields": ["rd_rs1_n0", "c_rs2_n0"], "extension": ["rv_c"]}
                }
                """);
    }

    @Test
    void testConvertAll() throws IOException {
        int exitCode = execute("convert", "-i", database.toString(), "-o", output.toString());

        assertThat(exitCode).isZero();
        assertThat(Files.readAllLines(output)).containsExactly(
                "add rv_i 0000000??????????000?????0110011 rd rs1 rs2",
                "mul rv_m 0000001??????????000?????0110011 rd rs1 rs2",
                "c_add rv_c 1001??????????10 rd_rs1_n0 c_rs2_n0");
    }

    @Test
    void testConvertWithExtensionFilter() throws IOException {
        int exitCode = execute("convert", "-i", database.toString(), "-o", output.toString(), "-e", "rv_m, rv_v");

        assertThat(exitCode).isZero();
        assertThat(Files.readAllLines(output)).containsExactly("mul rv_m 0000001??????????000?????0110011 rd rs1 rs2");
    }

    @Test
    void testNoValidExtension() {
        int exitCode = execute("convert", "-i", database.toString(), "-o", output.toString(), "-e", "rv_v");

        assertThat(exitCode).isEqualTo(1);
        assertThat(Files.exists(output)).isFalse();
    }

    @Test
    void testValidationFailsOnCompressedEncoding() {
        int exitCode = execute("convert", "-i", database.toString(), "-o", output.toString(), "-v");

        assertThat(exitCode).isEqualTo(1);
        assertThat(Files.exists(output)).isFalse();
    }

    @Test
    void testValidationPassesAfterFilter() {
        int exitCode = execute("convert", "-i", database.toString(), "-o", output.toString(), "-v", "-e", "rv_i");

        assertThat(exitCode).isZero();
        assertThat(Files.exists(output)).isTrue();
    }

    @Test
    void testListExtensionsWritesNothing() {
        int exitCode = execute("convert", "-i", database.toString(), "-o", output.toString(), "-l");

        assertThat(exitCode).isZero();
        assertThat(Files.exists(output)).isFalse();
    }

    @Test
    void testMissingInput() {
        assertThat(execute("convert", "-i", tempDir.resolve("missing.json").toString())).isEqualTo(1);
    }

    @Test
    void testInvalidJson() throws IOException {
        Files.writeString(database, "{ not json");

        assertThat(execute("convert", "-i", database.toString(), "-o", output.toString())).isEqualTo(1);
    }

    @Test
    void testEmptyDatabase() throws IOException {
        Files.writeString(database, "{}");

        assertThat(execute("convert", "-i", database.toString(), "-o", output.toString())).isEqualTo(1);
    }

    private static int execute(String... args) {
        return GeneratorApplication.createCommandLine().execute(args);
    }
}
