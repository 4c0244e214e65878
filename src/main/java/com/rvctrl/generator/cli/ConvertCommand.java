package com.rvctrl.generator.cli;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rvctrl.generator.catalog.CatalogValidator;
import com.rvctrl.generator.catalog.CatalogWriter;
import com.rvctrl.generator.catalog.ExtensionFilterResult;
import com.rvctrl.generator.catalog.InstructionCatalog;
import com.rvctrl.generator.catalog.InstructionDatabaseImporter;
import com.rvctrl.generator.catalog.InvalidInstructionDatabaseException;
import com.rvctrl.generator.catalog.NoMatchingExtensionsException;
import com.rvctrl.generator.cli.exception.OptionsValidationException;
import com.rvctrl.generator.cli.model.ConvertOptions;
import com.rvctrl.generator.cli.model.ValidatedConvertOptions;
import com.rvctrl.generator.cli.output.ConvertResultsPrinter;
import com.rvctrl.generator.cli.validation.ConvertOptionsValidator;
import com.rvctrl.generator.model.Instruction;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * Converts the structured instruction database into the flat catalog format.
 */
@Command(
        name = "convert",
        mixinStandardHelpOptions = true,
        description = "Converts a RISC-V instruction database (JSON) into a space-separated instruction catalog.",
        footer = {
                "",
                "Examples:",
                "  convert -i instr_dict.json -o output.csv",
                "  convert -i instr_dict.json -o output.csv -e rv_i,rv64_i",
                "  convert -i instr_dict.json -l"
        }
)
public class ConvertCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ConvertCommand.class);

    @Mixin
    private ConvertOptions options;

    private final ConvertOptionsValidator validator = new ConvertOptionsValidator();
    private final ConvertResultsPrinter printer = new ConvertResultsPrinter();
    private final InstructionDatabaseImporter importer = new InstructionDatabaseImporter();
    private final CatalogValidator catalogValidator = new CatalogValidator();
    private final CatalogWriter writer = new CatalogWriter();

    @Override
    public Integer call() {
        try {
            ValidatedConvertOptions validated = validator.validate(options);

            List<Instruction> instructions = importer.importFile(options.getInput());
            if (instructions.isEmpty()) {
                log.error("No valid instructions found in {}", options.getInput());
                return 1;
            }
            InstructionCatalog catalog = InstructionCatalog.of(instructions);

            if (options.isListExtensions()) {
                printer.printExtensions(catalog.getExtensions());
                return 0;
            }

            if (!validated.getExtensions().isEmpty()) {
                ExtensionFilterResult filtered;
                try {
                    filtered = catalog.filterByExtensions(validated.getExtensions());
                } catch (NoMatchingExtensionsException e) {
                    printer.printNoMatchingExtensions(catalog.getExtensions());
                    return 1;
                }
                if (filtered.getInstructions().isEmpty()) {
                    log.error("No instructions left after filtering");
                    return 1;
                }
                printer.printFilter(filtered);
                instructions = filtered.getInstructions();
            } else {
                printer.printUnfiltered(instructions.size());
            }

            if (options.isValidate()) {
                List<String> issues = catalogValidator.validate(instructions);
                if (!issues.isEmpty()) {
                    printer.printValidationIssues(issues);
                    return 1;
                }
            }

            writer.write(instructions, options.getOutput());
            printer.printSuccess(options.getOutput(), instructions.size());
            return 0;

        } catch (OptionsValidationException e) {
            e.getErrors().forEach(log::error);
            return 1;
        } catch (InvalidInstructionDatabaseException e) {
            log.error(e.getMessage());
            return 1;
        } catch (NoSuchFileException e) {
            log.error("Input file does not exist: {}", e.getFile());
            return 1;
        } catch (IOException e) {
            log.error("Conversion failed: {}", e.getMessage());
            log.debug("Conversion failure", e);
            return 1;
        }
    }
}
