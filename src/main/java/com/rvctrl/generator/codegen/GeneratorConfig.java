package com.rvctrl.generator.codegen;

import com.rvctrl.generator.model.ArtifactKind;
import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Settings for a generator run. Built by the caller and passed explicitly to each component;
 * where these settings are persisted is the caller's concern.
 */
@Data
@Builder
public class GeneratorConfig {

    public static final String DEFAULT_CONFIG_DIR = ".config/rvctrl-gen";
    public static final String DEFAULT_RECORDS_FILE = "records.json";

    /**
     * Flat instruction catalog; optional. When present, unknown instruction names are reported.
     */
    private Path catalogFile;

    private Path recordsFile;

    /**
     * Custom Ctrl template text; {@code null} or blank selects the built-in template.
     */
    private String ctrlTemplate;

    /**
     * Custom Field template text; {@code null} or blank selects the built-in template.
     */
    private String fieldTemplate;

    @Builder.Default
    private boolean autoFormat = true;

    /**
     * Whether committed signals are appended to the record store.
     */
    @Builder.Default
    private boolean persist = true;

    /**
     * Directory for generated .scala files; {@code null} keeps the code in memory only.
     */
    private Path outputDir;

    @Builder.Default
    private Clock clock = Clock.systemDefaultZone();

    public String getTemplate(ArtifactKind kind) {
        return switch (kind) {
            case CTRL -> ctrlTemplate;
            case FIELD -> fieldTemplate;
        };
    }

    /**
     * Records file, defaulting to {@code ~/.config/rvctrl-gen/records.json}.
     */
    public Path getRecordsFileOrDefault() {
        if (recordsFile != null) {
            return recordsFile;
        }
        return defaultRecordsFile();
    }

    public static Path defaultRecordsFile() {
        return Path.of(System.getProperty("user.home"), DEFAULT_CONFIG_DIR, DEFAULT_RECORDS_FILE);
    }
}
