package com.rvctrl.generator.cli.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.rvctrl.generator.model.EncodingType;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "generate" command. No validation, no execution logic, no printing.
 */
@Getter
public class GenerateOptions {

	@Option(names = { "--name", "-n" }, description = "Signal name, e.g. InstTypeCtrl")
	private String signalName;

	@Option(names = { "--encoding",
			"-t" }, description = "Encoding scheme: OneHot, Binary or Gray (default: OneHot, or the record's scheme with --from-record)")
	private EncodingType encodingType;

	@Option(names = { "--value",
			"-v" }, paramLabel = "NAME=INST[,INST...]", description = "A value and its instructions, e.g. ALU=add,sub. Repeat in declaration order.")
	private List<String> values = new ArrayList<>();

	@Option(names = { "--catalog", "-c" }, description = "Flat instruction catalog used to check instruction names")
	private Path catalogFile;

	@Option(names = { "--records-file",
			"-r" }, description = "Record store (default: ~/.config/rvctrl-gen/records.json)")
	private Path recordsFile;

	@Option(names = { "--ctrl-template" }, description = "Custom template file for the Ctrl object")
	private Path ctrlTemplate;

	@Option(names = { "--field-template" }, description = "Custom template file for the Field object")
	private Path fieldTemplate;

	@Option(names = { "--example-template" }, description = "Use the annotated example Ctrl template")
	private boolean exampleTemplate;

	@Option(names = { "--output-dir", "-o" }, description = "Save generated .scala files to this directory")
	private Path outputDir;

	@Option(names = { "--no-format" }, description = "Skip re-indentation of the generated code")
	private boolean noFormat;

	@Option(names = { "--no-save" }, description = "Do not append the signal to the record store")
	private boolean noSave;

	@Option(names = {
			"--from-record" }, paramLabel = "SIGNAL_ID", description = "Start from a stored record; --value entries replace or extend its values")
	private String fromRecord;

}
