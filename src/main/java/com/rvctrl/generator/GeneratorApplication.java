package com.rvctrl.generator;

import com.rvctrl.generator.cli.RvCtrlCommand;
import com.rvctrl.generator.model.EncodingType;
import picocli.CommandLine;

/**
 * Main entry point for the RISC-V control signal generator.
 * Converts instruction databases into flat catalogs and generates Chisel Ctrl/Field objects
 * from user-defined instruction classifications.
 */
public class GeneratorApplication {

    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }

    public static CommandLine createCommandLine() {
        return new CommandLine(new RvCtrlCommand())
                .registerConverter(EncodingType.class, EncodingType::fromLabel)
                .setCaseInsensitiveEnumValuesAllowed(true);
    }
}
