package com.rvctrl.generator.cli;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rvctrl.generator.cli.exception.OptionsValidationException;
import com.rvctrl.generator.cli.model.GenerateOptions;
import com.rvctrl.generator.cli.model.ValidatedGenerateOptions;
import com.rvctrl.generator.cli.output.GenerateResultsPrinter;
import com.rvctrl.generator.cli.validation.GenerateOptionsValidator;
import com.rvctrl.generator.codegen.ControlSignalGenerator;
import com.rvctrl.generator.codegen.GeneratorConfig;
import com.rvctrl.generator.codegen.GeneratorResult;
import com.rvctrl.generator.codegen.TemplateEngine;
import com.rvctrl.generator.model.ControlSignal;
import com.rvctrl.generator.model.EncodingType;
import com.rvctrl.generator.signal.ValuePartition;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command that classifies instructions into values and generates the Chisel Ctrl and Field objects.
 */
@Command(
        name = "generate",
        mixinStandardHelpOptions = true,
        description = "Generates Chisel Ctrl/Field objects for a control signal and stores its definition.",
        footer = {
                "",
                "Example:",
                "  generate -n InstTypeCtrl -t OneHot -c riscv-opcode.db -v ALU=add,sub -v LSU=lw,sw"
        }
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    @Mixin
    private GenerateOptions options;

    private final GenerateOptionsValidator validator = new GenerateOptionsValidator();
    private final GenerateResultsPrinter printer = new GenerateResultsPrinter();

    @Override
    public Integer call() {
        try {
            ValidatedGenerateOptions validated = validator.validate(options);
            GeneratorConfig config = buildConfig(validated);
            ControlSignalGenerator generator = new ControlSignalGenerator(config);

            Optional<String> catalogError = generator.loadCatalog();
            if (catalogError.isPresent()) {
                log.error(catalogError.get());
                return 1;
            }

            ValuePartition partition;
            String signalName = options.getSignalName();
            EncodingType encodingType = options.getEncodingType();

            if (options.getFromRecord() != null) {
                Optional<ControlSignal> record = generator.getRecordStore().find(options.getFromRecord());
                if (record.isEmpty()) {
                    log.error("No record with id {} in {}", options.getFromRecord(), validated.getRecordsFile());
                    return 1;
                }
                partition = ValuePartition.fromRecord(record.get(), config.getClock());
                if (signalName == null || signalName.isBlank()) {
                    signalName = record.get().getName();
                }
                if (encodingType == null) {
                    encodingType = record.get().getEncodingType();
                }
                log.info("Editing record {} ({})", record.get().getSignalId(), record.get().getName());
            } else {
                partition = new ValuePartition(config.getClock());
            }
            if (encodingType == null) {
                encodingType = EncodingType.ONE_HOT;
            }

            applyValueSpecs(partition, validated.getValueSpecs());

            printer.printBanner(signalName, encodingType, partition.size(), validated.getRecordsFile());

            Map<String, List<String>> conflicts = partition.computeConflicts();
            if (!conflicts.isEmpty()) {
                printer.printConflicts(conflicts);
            }

            GeneratorResult result = generator.generate(partition, signalName, encodingType);
            if (!result.isSuccess()) {
                printer.printFailure(result);
                return 1;
            }

            printer.printSuccess(result);
            return 0;

        } catch (OptionsValidationException e) {
            e.getErrors().forEach(log::error);
            return 1;
        } catch (IOException e) {
            log.error("Generation failed: {}", e.getMessage());
            log.debug("Generation failure", e);
            return 1;
        }
    }

    private GeneratorConfig buildConfig(ValidatedGenerateOptions validated) throws IOException {
        String ctrlTemplate = options.isExampleTemplate()
                ? TemplateEngine.loadBuiltInTemplate(TemplateEngine.EXAMPLE_CTRL_TEMPLATE_RESOURCE)
                : readTemplate(options.getCtrlTemplate());

        return GeneratorConfig.builder()
                .catalogFile(options.getCatalogFile())
                .recordsFile(validated.getRecordsFile())
                .ctrlTemplate(ctrlTemplate)
                .fieldTemplate(readTemplate(options.getFieldTemplate()))
                .autoFormat(!options.isNoFormat())
                .persist(!options.isNoSave())
                .outputDir(options.getOutputDir())
                .build();
    }

    private static String readTemplate(Path templateFile) throws IOException {
        return templateFile == null ? null : Files.readString(templateFile, StandardCharsets.UTF_8);
    }

    /**
     * Values named on the command line replace same-named values of the record being edited;
     * new names are appended in command-line order.
     */
    static void applyValueSpecs(ValuePartition partition, Map<String, List<String>> valueSpecs) {
        valueSpecs.forEach((name, instructions) -> {
            if (partition.getValue(name).isPresent()) {
                partition.setInstructions(name, instructions);
            } else {
                partition.addValue(name, instructions);
            }
        });
    }
}
