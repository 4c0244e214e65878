package com.rvctrl.generator.codegen;

import com.rvctrl.generator.codegen.util.FileWriteUtil;
import com.rvctrl.generator.model.ArtifactKind;
import com.rvctrl.generator.model.ControlSignal;
import com.rvctrl.generator.signal.SignalIdGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Saves rendered artifacts as {@code <Signal>_<yyyyMMdd_HHmmss>.scala} and
 * {@code <Signal>Field_<yyyyMMdd_HHmmss>.scala}.
 */
public class ArtifactWriter {
    private static final Logger log = LoggerFactory.getLogger(ArtifactWriter.class);

    private static final String EXTENSION = ".scala";

    private final Path outputDir;
    private final SignalIdGenerator stamps;

    public ArtifactWriter(Path outputDir, Clock clock) {
        this.outputDir = Objects.requireNonNull(outputDir, "outputDir");
        this.stamps = new SignalIdGenerator(clock);
    }

    public List<Path> write(ControlSignal signal, Map<ArtifactKind, String> artifacts) throws IOException {
        String stamp = stamps.fileStamp();
        List<Path> written = new ArrayList<>();
        for (Map.Entry<ArtifactKind, String> artifact : artifacts.entrySet()) {
            Path file = outputDir.resolve(fileName(signal, artifact.getKey(), stamp));
            FileWriteUtil.safeWriteString(file, artifact.getValue());
            log.debug("Wrote {} artifact to {}", artifact.getKey(), file);
            written.add(file);
        }
        return written;
    }

    static String fileName(ControlSignal signal, ArtifactKind kind, String stamp) {
        return signal.getName() + kind.getFileSuffix() + "_" + stamp + EXTENSION;
    }
}
