package com.rvctrl.generator.cli.model;

import java.util.Set;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the convert command.
 */
@Data
@AllArgsConstructor
public class ValidatedConvertOptions {
    /**
     * Requested extension tags; empty when no filter was given.
     */
    Set<String> extensions;
}
