package com.rvctrl.generator.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level command; does nothing on its own besides printing usage.
 */
@Command(
        name = "rvctrl-gen",
        mixinStandardHelpOptions = true,
        version = "rvctrl-gen 1.0.0",
        description = "RISC-V control signal generator for Chisel decoders.",
        subcommands = {
                ConvertCommand.class,
                GenerateCommand.class,
                RecordsCommand.class,
                CommandLine.HelpCommand.class
        }
)
public class RvCtrlCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }
}
