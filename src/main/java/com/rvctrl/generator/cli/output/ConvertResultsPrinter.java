package com.rvctrl.generator.cli.output;

import java.nio.file.Path;
import java.util.List;
import java.util.SortedSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rvctrl.generator.catalog.ExtensionFilterResult;

/**
 * Responsible only for printing CLI output for the "convert" command.
 */
public class ConvertResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(ConvertResultsPrinter.class);

    static final int MAX_ISSUES_SHOWN = 5;

    public void printExtensions(SortedSet<String> extensions) {
        if (extensions.isEmpty()) {
            log.info("No extensions found");
            return;
        }
        log.info("Available extensions:");
        for (String extension : extensions) {
            log.info("  {}", extension);
        }
        log.info("Total: {} extensions", extensions.size());
    }

    public void printFilter(ExtensionFilterResult result) {
        log.info("Filtered extensions: {}", String.join(", ", result.getAppliedExtensions()));
        log.info("Before filter: {} instructions", result.getOriginalCount());
        log.info("After filter: {} instructions ({} removed)",
                result.getInstructions().size(), result.getRemovedCount());
    }

    public void printUnfiltered(int count) {
        log.info("Found {} instructions (no filter)", count);
    }

    public void printNoMatchingExtensions(SortedSet<String> available) {
        log.error("No valid extensions");
        log.error("Available extensions: {}", String.join(", ", available));
    }

    public void printValidationIssues(List<String> issues) {
        log.error("Validation found {} issues:", issues.size());
        issues.stream().limit(MAX_ISSUES_SHOWN).forEach(issue -> log.error("  - {}", issue));
        if (issues.size() > MAX_ISSUES_SHOWN) {
            log.error("  ... and {} more", issues.size() - MAX_ISSUES_SHOWN);
        }
    }

    public void printSuccess(Path output, int count) {
        log.info("Generated: {}", output);
        log.info("Contains {} instructions", count);
    }
}
