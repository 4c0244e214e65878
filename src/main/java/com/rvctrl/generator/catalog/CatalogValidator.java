package com.rvctrl.generator.catalog;

import com.rvctrl.generator.model.Instruction;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Sanity checks for converted instructions: RV32/RV64 base encodings are 32 bits wide and use
 * only the canonical alphabet.
 */
public class CatalogValidator {

    public static final int EXPECTED_ENCODING_WIDTH = 32;

    private static final Pattern CANONICAL_ENCODING = Pattern.compile("^[01?]+$");

    public List<String> validate(Collection<Instruction> instructions) {
        List<String> issues = new ArrayList<>();

        for (Instruction instruction : instructions) {
            String encoding = instruction.getEncoding();
            if (encoding.length() != EXPECTED_ENCODING_WIDTH) {
                issues.add("Instruction '" + instruction.getName() + "' encoding is not "
                        + EXPECTED_ENCODING_WIDTH + " bits: " + encoding.length());
            }
            if (!CANONICAL_ENCODING.matcher(encoding).matches()) {
                issues.add("Instruction '" + instruction.getName() + "' encoding contains illegal characters: "
                        + encoding);
            }
        }

        return issues;
    }
}
