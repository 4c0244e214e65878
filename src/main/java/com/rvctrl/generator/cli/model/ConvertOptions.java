package com.rvctrl.generator.cli.model;

import java.nio.file.Path;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "convert" command. No validation, no execution logic, no printing.
 */
@Getter
public class ConvertOptions {

	@Option(names = { "--input", "-i" }, required = true, description = "Input instruction database JSON (instr_dict.json)")
	private Path input;

	@Option(names = { "--output",
			"-o" }, defaultValue = "riscv_instructions.csv", description = "Output catalog file (default: ${DEFAULT-VALUE})")
	private Path output;

	@Option(names = { "--extensions",
			"-e" }, description = "Keep only instructions of these extensions (comma-separated, e.g. rv_i,rv64_i)")
	private String extensions;

	@Option(names = { "--list-extensions", "-l" }, description = "List all extensions in the database and exit")
	private boolean listExtensions;

	@Option(names = { "--validate",
			"-v" }, description = "Fail if any encoding is not 32 bits or contains characters other than 0, 1, ?")
	private boolean validate;

}
