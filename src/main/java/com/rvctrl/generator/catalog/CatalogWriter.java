package com.rvctrl.generator.catalog;

import com.rvctrl.generator.codegen.util.FileWriteUtil;
import com.rvctrl.generator.model.Instruction;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;

/**
 * Writes instructions in the flat catalog format read by {@link CatalogParser}.
 */
public class CatalogWriter {

    /**
     * Written in place of a missing extension so the encoding stays the third token.
     */
    public static final String NO_EXTENSION = "unknown";

    public void write(Collection<Instruction> instructions, Path outputFile) throws IOException {
        FileWriteUtil.safeWriteString(outputFile, format(instructions));
    }

    public String format(Collection<Instruction> instructions) {
        StringBuilder sb = new StringBuilder();
        for (Instruction instruction : instructions) {
            sb.append(instruction.getName())
                    .append(' ').append(extensionToken(instruction))
                    .append(' ').append(instruction.getEncoding());
            for (String arg : instruction.getArgs()) {
                sb.append(' ').append(arg);
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    private static String extensionToken(Instruction instruction) {
        String extension = instruction.getExtension().trim();
        return extension.isEmpty() ? NO_EXTENSION : extension;
    }
}
