package com.rvctrl.generator.codegen.util;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for whole-file writes with automatic directory creation.
 */
public class FileWriteUtil {

    private FileWriteUtil() {
        // Utility class
    }

    /**
     * Writes content to a file as UTF-8, creating parent directories if needed.
     * The file is truncated and rewritten; there is no partial-write recovery.
     */
    public static void safeWriteString(Path filePath, String content) throws IOException {
        createParentDirectories(filePath);
        try (Writer writer = Files.newBufferedWriter(filePath, StandardCharsets.UTF_8)) {
            writer.write(content);
        }
    }

    /**
     * Creates the parent directory of a file, if it has one.
     */
    public static void createParentDirectories(Path filePath) throws IOException {
        Path parentDir = filePath.toAbsolutePath().getParent();
        if (parentDir != null) {
            Files.createDirectories(parentDir);
        }
    }
}
