package com.rvctrl.generator.cli.model;

import java.nio.file.Path;

import com.rvctrl.generator.codegen.GeneratorConfig;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Record store location shared by the "records" subcommands.
 */
@Getter
public class RecordsFileOptions {

	@Option(names = { "--records-file",
			"-r" }, description = "Record store (default: ~/.config/rvctrl-gen/records.json)")
	private Path recordsFile;

	public Path getRecordsFileOrDefault() {
		return recordsFile != null ? recordsFile : GeneratorConfig.defaultRecordsFile();
	}
}
