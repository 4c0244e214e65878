package com.rvctrl.generator.cli.validation;

import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.rvctrl.generator.cli.exception.OptionsValidationException;
import com.rvctrl.generator.cli.model.ConvertOptions;
import com.rvctrl.generator.cli.model.ValidatedConvertOptions;

public class ConvertOptionsValidator {

	public ValidatedConvertOptions validate(ConvertOptions o) {
		List<String> errors = new ArrayList<>();

		if (o.getInput() == null) {
			errors.add("Input file is required (--input / -i).");
		} else if (!Files.isRegularFile(o.getInput())) {
			errors.add("Input file does not exist: " + o.getInput());
		}

		Set<String> extensions = parseExtensions(o.getExtensions());
		if (o.getExtensions() != null && extensions.isEmpty()) {
			errors.add("No valid extensions provided (--extensions / -e): '" + o.getExtensions() + "'");
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return new ValidatedConvertOptions(extensions);
	}

	/**
	 * "rv_i, rv64_i,,rv_m" -> [rv_i, rv64_i, rv_m]
	 */
	static Set<String> parseExtensions(String raw) {
		if (raw == null) {
			return Set.of();
		}
		Set<String> result = new LinkedHashSet<>();
		Arrays.stream(raw.split(",")).map(String::trim).filter(s -> !s.isEmpty()).forEach(result::add);
		return result;
	}
}
