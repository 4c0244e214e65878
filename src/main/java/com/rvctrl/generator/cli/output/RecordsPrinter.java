package com.rvctrl.generator.cli.output;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rvctrl.generator.model.ControlSignal;

/**
 * Responsible only for printing CLI output for the "records" subcommands.
 */
public class RecordsPrinter {

    private static final Logger log = LoggerFactory.getLogger(RecordsPrinter.class);

    static final int MAX_INSTRUCTIONS_SHOWN = 8;

    public void printTable(List<ControlSignal> records, Path storePath) {
        if (records.isEmpty()) {
            log.info("No records in {}", storePath);
            return;
        }
        log.info(String.format("%-24s %-20s %-8s %5s %6s  %s",
                "ID", "NAME", "ENCODING", "WIDTH", "VALUES", "CREATED"));
        for (ControlSignal record : records) {
            log.info(String.format("%-24s %-20s %-8s %5d %6d  %s",
                    record.getSignalId(),
                    record.getName(),
                    record.getEncodingType(),
                    record.getWidth(),
                    record.getValueCount(),
                    record.getCreatedAt()));
        }
        log.info("Total: {} records", records.size());
    }

    public void printDetails(ControlSignal record) {
        log.info("Signal: {}", record.getName());
        log.info("ID: {}", record.getSignalId());
        log.info("Encoding: {}", record.getEncodingType());
        log.info("Width: {} bits", record.getWidth());
        log.info("Created: {}", record.getCreatedAt());
        log.info("Instructions: {}", record.getInstructions().size());
        log.info("Values:");
        for (Map.Entry<String, List<String>> value : record.getValues().entrySet()) {
            log.info("  {} ({}): {}", value.getKey(), value.getValue().size(), abbreviate(value.getValue()));
        }
    }

    static String abbreviate(List<String> instructions) {
        if (instructions.isEmpty()) {
            return "-";
        }
        if (instructions.size() <= MAX_INSTRUCTIONS_SHOWN) {
            return String.join(", ", instructions);
        }
        return String.join(", ", instructions.subList(0, MAX_INSTRUCTIONS_SHOWN))
                + ", ... (" + (instructions.size() - MAX_INSTRUCTIONS_SHOWN) + " more)";
    }

    public void printNotFound(String signalId, Path storePath) {
        log.error("No record with id {} in {}", signalId, storePath);
    }

    public void printDeleted(String signalId) {
        log.info("Deleted record {}", signalId);
    }
}
