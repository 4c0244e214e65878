package com.rvctrl.generator.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.rvctrl.generator.cli.exception.OptionsValidationException;
import com.rvctrl.generator.cli.model.GenerateOptions;
import com.rvctrl.generator.cli.model.ValidatedGenerateOptions;
import com.rvctrl.generator.codegen.GeneratorConfig;

public class GenerateOptionsValidator {

	public ValidatedGenerateOptions validate(GenerateOptions o) {
		List<String> errors = new ArrayList<>();

		boolean fromRecord = !isBlank(o.getFromRecord());

		if (!fromRecord && isBlank(o.getSignalName())) {
			errors.add("Signal name is required (--name / -n).");
		}
		if (!fromRecord && o.getValues().isEmpty()) {
			errors.add("At least one value is required (--value / -v NAME=INST,...).");
		}

		Map<String, List<String>> valueSpecs = parseValueSpecs(o.getValues(), errors);

		if (o.getCatalogFile() != null && !Files.isRegularFile(o.getCatalogFile())) {
			errors.add("Catalog file does not exist: " + o.getCatalogFile());
		}
		if (o.getCtrlTemplate() != null && !Files.isRegularFile(o.getCtrlTemplate())) {
			errors.add("Ctrl template does not exist: " + o.getCtrlTemplate());
		}
		if (o.getFieldTemplate() != null && !Files.isRegularFile(o.getFieldTemplate())) {
			errors.add("Field template does not exist: " + o.getFieldTemplate());
		}
		if (o.getCtrlTemplate() != null && o.isExampleTemplate()) {
			errors.add("--ctrl-template and --example-template cannot be combined.");
		}
		if (o.getOutputDir() != null && Files.exists(o.getOutputDir()) && !Files.isDirectory(o.getOutputDir())) {
			errors.add("Output path exists and is not a directory: " + o.getOutputDir());
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		Path recordsFile = o.getRecordsFile() != null ? o.getRecordsFile() : GeneratorConfig.defaultRecordsFile();
		return new ValidatedGenerateOptions(valueSpecs, recordsFile);
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}

	/**
	 * "ALU=add,sub" -> ALU: [add, sub]; "NOP=" -> NOP: []
	 */
	static Map<String, List<String>> parseValueSpecs(List<String> specs, List<String> errors) {
		Map<String, List<String>> result = new LinkedHashMap<>();
		for (String spec : specs) {
			int eq = spec.indexOf('=');
			if (eq < 0) {
				errors.add("Invalid value '" + spec + "', expected NAME=INST[,INST...].");
				continue;
			}
			String name = spec.substring(0, eq).trim();
			if (name.isEmpty()) {
				errors.add("Value name is empty in '" + spec + "'.");
				continue;
			}
			if (result.containsKey(name)) {
				errors.add("Value '" + name + "' is given more than once.");
				continue;
			}
			List<String> instructions = Arrays.stream(spec.substring(eq + 1).split(","))
					.map(String::trim)
					.filter(s -> !s.isEmpty())
					.toList();
			result.put(name, instructions);
		}
		return result;
	}
}
