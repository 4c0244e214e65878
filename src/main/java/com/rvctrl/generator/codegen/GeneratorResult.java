package com.rvctrl.generator.codegen;

import com.rvctrl.generator.model.ArtifactKind;
import com.rvctrl.generator.model.ControlSignal;
import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Result of a control signal generation run.
 */
@Data
@Builder(toBuilder = true)
public class GeneratorResult {
    private boolean success;
    private String errorMessage;

    /**
     * Set when a write failed because the file system denied access.
     */
    private boolean permissionDenied;

    private ControlSignal signal;
    private boolean recordSaved;

    @Singular("artifact")
    private Map<ArtifactKind, String> artifacts;

    @Singular
    private List<Path> writtenFiles;

    @Singular
    private List<String> warnings;

    public String getCode(ArtifactKind kind) {
        return artifacts.get(kind);
    }

    public static GeneratorResult failure(String errorMessage) {
        return GeneratorResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .build();
    }

    public static GeneratorResult permissionFailure(String errorMessage) {
        return GeneratorResult.builder()
                .success(false)
                .permissionDenied(true)
                .errorMessage(errorMessage)
                .build();
    }
}
