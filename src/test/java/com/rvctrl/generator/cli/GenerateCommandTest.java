package com.rvctrl.generator.cli;

import com.rvctrl.generator.GeneratorApplication;
import com.rvctrl.generator.model.ControlSignal;
import com.rvctrl.generator.model.EncodingType;
import com.rvctrl.generator.store.RecordStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the "generate" and "records" commands.
 */
class GenerateCommandTest {

    @TempDir
    Path tempDir;

    @Test
    void testGenerateStoresRecordAndWritesFiles() throws IOException {
        Path records = tempDir.resolve("records.json");
        Path out = tempDir.resolve("out");

        int exitCode = execute("generate", "-n", "InstTypeCtrl", "-t", "binary",
                "-v", "ALU=add,sub", "-v", "MEM=lw", "-v", "NOP=",
                "-r", records.toString(), "-o", out.toString());

        assertThat(exitCode).isZero();
        List<ControlSignal> stored = new RecordStore(records).list();
        assertThat(stored).hasSize(1);
        assertThat(stored.get(0).getEncodingType()).isEqualTo(EncodingType.BINARY);
        assertThat(stored.get(0).getWidth()).isEqualTo(2);
        assertThat(stored.get(0).getValues()).containsOnlyKeys("ALU", "MEM", "NOP");

        try (Stream<Path> files = Files.list(out)) {
            assertThat(files.map(p -> p.getFileName().toString()))
                    .hasSize(2)
                    .anySatisfy(name -> assertThat(name).startsWith("InstTypeCtrl_").endsWith(".scala"))
                    .anySatisfy(name -> assertThat(name).startsWith("InstTypeCtrlField_").endsWith(".scala"));
        }
    }

    @Test
    void testConflictFailsWithoutRecord() {
        Path records = tempDir.resolve("records.json");

        int exitCode = execute("generate", "-n", "InstTypeCtrl",
                "-v", "ALU=add,sub", "-v", "MEM=lw,add", "-r", records.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(Files.exists(records)).isFalse();
    }

    @Test
    void testNoSaveKeepsStoreUntouched() {
        Path records = tempDir.resolve("records.json");

        int exitCode = execute("generate", "-n", "InstTypeCtrl", "-v", "ALU=add",
                "-r", records.toString(), "--no-save");

        assertThat(exitCode).isZero();
        assertThat(Files.exists(records)).isFalse();
    }

    @Test
    void testMissingNameAndValues() {
        assertThat(execute("generate", "-r", tempDir.resolve("records.json").toString())).isEqualTo(1);
    }

    @Test
    void testMalformedValueSpec() {
        assertThat(execute("generate", "-n", "X", "-v", "ALU", "-r", tempDir.resolve("records.json").toString()))
                .isEqualTo(1);
    }

    @Test
    void testUnknownEncodingIsRejectedByParser() {
        assertThat(execute("generate", "-n", "X", "-t", "thermometer", "-v", "A=add",
                "-r", tempDir.resolve("records.json").toString())).isNotZero();
    }

    @Test
    void testCustomTemplate() throws IOException {
        Path template = tempDir.resolve("ctrl.tmpl");
        Files.writeString(template, "// {signal_name} is {signal_width} bits\n");
        Path out = tempDir.resolve("out");

        int exitCode = execute("generate", "-n", "InstTypeCtrl", "-t", "Gray", "-v", "A=add", "-v", "B=sub",
                "-v", "C=lw", "--ctrl-template", template.toString(), "--no-save",
                "-r", tempDir.resolve("records.json").toString(), "-o", out.toString());

        assertThat(exitCode).isZero();
        try (Stream<Path> files = Files.list(out)) {
            Path ctrl = files.filter(p -> p.getFileName().toString().startsWith("InstTypeCtrl_")).findFirst().orElseThrow();
            assertThat(Files.readString(ctrl)).isEqualTo("// InstTypeCtrl is 2 bits\n");
        }
    }

    @Test
    void testEditFromRecord() {
        Path records = tempDir.resolve("records.json");
        assertThat(execute("generate", "-n", "InstTypeCtrl", "-v", "ALU=add,sub", "-v", "MEM=lw",
                "-r", records.toString())).isZero();
        ControlSignal original = new RecordStore(records).list().get(0);

        int exitCode = execute("generate", "--from-record", original.getSignalId(),
                "-v", "ALU=add", "-v", "SYS=ecall", "-r", records.toString());

        assertThat(exitCode).isZero();
        List<ControlSignal> stored = new RecordStore(records).list();
        assertThat(stored).hasSize(2);
        assertThat(stored).contains(original);
        ControlSignal edited = stored.stream().filter(r -> !r.equals(original)).findFirst().orElseThrow();
        assertThat(edited.getName()).isEqualTo("InstTypeCtrl");
        assertThat(edited.getEncodingType()).isEqualTo(EncodingType.ONE_HOT);
        assertThat(edited.getValues().keySet()).containsExactly("ALU", "MEM", "SYS");
        assertThat(edited.getValues().get("ALU")).containsExactly("add");
    }

    @Test
    void testRecordsSubcommands() {
        Path records = tempDir.resolve("records.json");
        assertThat(execute("generate", "-n", "InstTypeCtrl", "-v", "ALU=add", "-r", records.toString())).isZero();
        String id = new RecordStore(records).list().get(0).getSignalId();
        Path out = tempDir.resolve("rendered");

        assertThat(execute("records", "list", "-r", records.toString())).isZero();
        assertThat(execute("records", "show", id, "-r", records.toString())).isZero();
        assertThat(execute("records", "render", id, "--artifact", "field", "-o", out.toString(),
                "-r", records.toString())).isZero();
        String[] rendered = out.toFile().list();
        assertThat(rendered).hasSize(1);
        assertThat(rendered[0]).startsWith("InstTypeCtrlField_");

        assertThat(execute("records", "delete", id, "-r", records.toString())).isZero();
        assertThat(execute("records", "delete", id, "-r", records.toString())).isEqualTo(1);
        assertThat(execute("records", "show", id, "-r", records.toString())).isEqualTo(1);
        assertThat(new RecordStore(records).list()).isEmpty();
    }

    private static int execute(String... args) {
        return GeneratorApplication.createCommandLine().execute(args);
    }
}
