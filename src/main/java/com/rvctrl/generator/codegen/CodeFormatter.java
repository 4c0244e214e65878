package com.rvctrl.generator.codegen;

/**
 * Best-effort re-indenter for generated Scala.
 *
 * Works on line shape only, not on syntax: braces inside string literals or comments can
 * misindent a line. Each non-blank line is right-trimmed and prefixed with two spaces per level;
 * its own leading whitespace is kept.
 */
public class CodeFormatter {

    private static final String INDENT = "  ";

    public String format(String code) {
        String[] lines = code.split("\n", -1);
        StringBuilder sb = new StringBuilder(code.length() + 64);

        int level = 0;
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].stripTrailing();
            String trimmed = line.trim();

            if (trimmed.startsWith("}") || trimmed.endsWith("}")) {
                level = Math.max(0, level - 1);
            }

            if (!trimmed.isEmpty()) {
                sb.append(INDENT.repeat(level)).append(line);
            }
            if (i < lines.length - 1) {
                sb.append('\n');
            }

            if (trimmed.endsWith("{") || trimmed.endsWith("=>")) {
                level++;
            }
        }
        return sb.toString();
    }
}
