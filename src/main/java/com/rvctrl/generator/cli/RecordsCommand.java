package com.rvctrl.generator.cli;

import java.io.IOException;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rvctrl.generator.cli.model.RecordsFileOptions;
import com.rvctrl.generator.cli.output.GenerateResultsPrinter;
import com.rvctrl.generator.cli.output.RecordsPrinter;
import com.rvctrl.generator.codegen.ArtifactWriter;
import com.rvctrl.generator.codegen.ControlSignalGenerator;
import com.rvctrl.generator.codegen.GeneratorConfig;
import com.rvctrl.generator.codegen.GeneratorResult;
import com.rvctrl.generator.model.ArtifactKind;
import com.rvctrl.generator.model.ControlSignal;
import com.rvctrl.generator.store.RecordStore;
import com.rvctrl.generator.store.RecordStoreException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/**
 * Browses and maintains the stored control signal records.
 */
@Command(
        name = "records",
        mixinStandardHelpOptions = true,
        description = "Lists, shows, deletes and re-renders stored control signal records."
)
public class RecordsCommand implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(RecordsCommand.class);

    @Spec
    CommandSpec spec;

    private final RecordsPrinter printer = new RecordsPrinter();

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    @Command(name = "list", mixinStandardHelpOptions = true, description = "Lists all records, newest first.")
    int list(@Mixin RecordsFileOptions store) {
        RecordStore recordStore = new RecordStore(store.getRecordsFileOrDefault());
        printer.printTable(recordStore.list(), recordStore.getStorePath());
        return 0;
    }

    @Command(name = "show", mixinStandardHelpOptions = true, description = "Shows one record.")
    int show(@Parameters(paramLabel = "SIGNAL_ID") String signalId,
             @Mixin RecordsFileOptions store) {
        RecordStore recordStore = new RecordStore(store.getRecordsFileOrDefault());
        Optional<ControlSignal> record = recordStore.find(signalId);
        if (record.isEmpty()) {
            printer.printNotFound(signalId, recordStore.getStorePath());
            return 1;
        }
        printer.printDetails(record.get());
        return 0;
    }

    @Command(name = "delete", mixinStandardHelpOptions = true, description = "Deletes one record.")
    int delete(@Parameters(paramLabel = "SIGNAL_ID") String signalId,
               @Mixin RecordsFileOptions store) {
        RecordStore recordStore = new RecordStore(store.getRecordsFileOrDefault());
        try {
            if (!recordStore.delete(signalId)) {
                printer.printNotFound(signalId, recordStore.getStorePath());
                return 1;
            }
        } catch (RecordStoreException e) {
            log.error(e.getMessage());
            return 1;
        }
        printer.printDeleted(signalId);
        return 0;
    }

    @Command(name = "render", mixinStandardHelpOptions = true,
            description = "Renders the Ctrl and Field code of a stored record again.")
    int render(@Parameters(paramLabel = "SIGNAL_ID") String signalId,
               @Option(names = { "--artifact", "-a" }, split = ",", paramLabel = "KIND",
                       description = "Artifacts to render: ${COMPLETION-CANDIDATES} (default: all)")
               List<ArtifactKind> artifacts,
               @Option(names = { "--output-dir", "-o" }, description = "Save generated .scala files to this directory")
               Path outputDir,
               @Option(names = { "--no-format" }, description = "Skip re-indentation of the generated code")
               boolean noFormat,
               @Mixin RecordsFileOptions store) {
        GeneratorConfig config = GeneratorConfig.builder()
                .recordsFile(store.getRecordsFileOrDefault())
                .autoFormat(!noFormat)
                .persist(false)
                .build();

        GeneratorResult result = new ControlSignalGenerator(config).regenerate(signalId);
        GenerateResultsPrinter resultsPrinter = new GenerateResultsPrinter();
        if (!result.isSuccess()) {
            resultsPrinter.printFailure(result);
            return 1;
        }

        Map<ArtifactKind, String> selected = new EnumMap<>(ArtifactKind.class);
        selected.putAll(result.getArtifacts());
        if (artifacts != null && !artifacts.isEmpty()) {
            selected.keySet().retainAll(artifacts);
        }

        if (outputDir != null) {
            try {
                List<Path> written = new ArtifactWriter(outputDir, config.getClock()).write(result.getSignal(), selected);
                written.forEach(file -> log.info("Saved: {}", file.toAbsolutePath()));
            } catch (IOException e) {
                log.error("Failed to write generated code: {}", e.getMessage());
                return 1;
            }
        }

        resultsPrinter.printCode(result.toBuilder().clearArtifacts().artifacts(selected).build());
        return 0;
    }
}
