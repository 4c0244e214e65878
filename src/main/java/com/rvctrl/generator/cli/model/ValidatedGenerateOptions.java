package com.rvctrl.generator.cli.model;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the generate command.
 */
@Data
@AllArgsConstructor
public class ValidatedGenerateOptions {
    /**
     * Parsed --value entries in command-line order.
     */
    Map<String, List<String>> valueSpecs;
    Path recordsFile;
}
