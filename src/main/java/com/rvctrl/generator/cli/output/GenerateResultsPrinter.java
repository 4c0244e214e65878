package com.rvctrl.generator.cli.output;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rvctrl.generator.codegen.GeneratorResult;
import com.rvctrl.generator.model.ArtifactKind;
import com.rvctrl.generator.model.ControlSignal;
import com.rvctrl.generator.model.EncodingType;

/**
 * Responsible only for printing CLI output for the "generate" command.
 * No validation, no execution, no prompting.
 */
public class GenerateResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(GenerateResultsPrinter.class);

    public void printBanner(String signalName, EncodingType encodingType, int valueCount, Path recordsFile) {
        log.info("=================================================");
        log.info("RISC-V Control Signal Generator");
        log.info("=================================================");
        log.info("Signal Name: {}", signalName);
        log.info("Encoding: {}", encodingType);
        log.info("Values: {}", valueCount);
        log.info("Record Store: {}", recordsFile.toAbsolutePath());
        log.info("=================================================");
    }

    public void printConflicts(Map<String, List<String>> conflicts) {
        log.error("Instructions claimed by more than one value:");
        conflicts.forEach((instruction, values) ->
                log.error("  {}: {}", instruction, String.join(", ", values)));
    }

    public void printSuccess(GeneratorResult result) {
        ControlSignal signal = result.getSignal();

        log.info("");
        log.info("=================================================");
        log.info("GENERATION SUCCESSFUL");
        log.info("=================================================");
        log.info("Signal: {} ({}, width {})", signal.getName(), signal.getEncodingType(), signal.getWidth());
        log.info("Values: {}", signal.getValueCount());
        log.info("Instructions: {}", signal.getInstructions().size());
        if (result.isRecordSaved()) {
            log.info("Record ID: {}", signal.getSignalId());
        }
        for (Path file : result.getWrittenFiles()) {
            log.info("Saved: {}", file.toAbsolutePath());
        }
        log.info("=================================================");

        printCode(result);
    }

    public void printCode(GeneratorResult result) {
        for (Map.Entry<ArtifactKind, String> artifact : result.getArtifacts().entrySet()) {
            log.info("");
            log.info("// ----- {} -----", artifact.getKey());
            log.info(artifact.getValue());
        }
    }

    public void printFailure(GeneratorResult result) {
        log.error("Generation failed: {}", result.getErrorMessage());
        if (result.isPermissionDenied()) {
            log.error("The file system denied access; retry with elevated privileges or another location.");
        }
    }
}
