package com.rvctrl.generator.codegen;

import com.rvctrl.generator.catalog.InstructionCatalog;
import com.rvctrl.generator.catalog.MalformedCatalogRowException;
import com.rvctrl.generator.model.ArtifactKind;
import com.rvctrl.generator.model.ControlSignal;
import com.rvctrl.generator.model.EncodingType;
import com.rvctrl.generator.signal.SignalIdGenerator;
import com.rvctrl.generator.signal.ValueDefinition;
import com.rvctrl.generator.signal.ValuePartition;
import com.rvctrl.generator.signal.exception.SignalDefinitionException;
import com.rvctrl.generator.store.RecordStore;
import com.rvctrl.generator.store.RecordStoreException;
import com.rvctrl.generator.store.RecordStorePermissionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Drives the pipeline: catalog, partition commit, width, rendering, persistence and file output.
 *
 * Failures are returned as unsuccessful {@link GeneratorResult}s; nothing is retried.
 */
public class ControlSignalGenerator {
    private static final Logger log = LoggerFactory.getLogger(ControlSignalGenerator.class);

    private final GeneratorConfig config;
    private final InstructionCatalog catalog;
    private final TemplateEngine templateEngine;
    private final RecordStore recordStore;

    public ControlSignalGenerator(GeneratorConfig config) {
        this(config, new InstructionCatalog(), new TemplateEngine(config),
                new RecordStore(config.getRecordsFileOrDefault()));
    }

    public ControlSignalGenerator(GeneratorConfig config,
                                  InstructionCatalog catalog,
                                  TemplateEngine templateEngine,
                                  RecordStore recordStore) {
        this.config = Objects.requireNonNull(config, "config");
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.templateEngine = Objects.requireNonNull(templateEngine, "templateEngine");
        this.recordStore = Objects.requireNonNull(recordStore, "recordStore");
    }

    public InstructionCatalog getCatalog() {
        return catalog;
    }

    public RecordStore getRecordStore() {
        return recordStore;
    }

    /**
     * Loads the configured catalog file, if any. A failed load leaves the current catalog in place.
     */
    public Optional<String> loadCatalog() {
        Path catalogFile = config.getCatalogFile();
        if (catalogFile == null) {
            return Optional.empty();
        }
        try {
            catalog.load(catalogFile);
            return Optional.empty();
        } catch (NoSuchFileException e) {
            return Optional.of("Catalog file does not exist: " + catalogFile);
        } catch (MalformedCatalogRowException e) {
            return Optional.of(e.getMessage());
        } catch (IOException e) {
            log.debug("Catalog load failed", e);
            return Optional.of("Failed to read catalog " + catalogFile + ": " + e.getMessage());
        }
    }

    /**
     * Commits the partition, stores the record and renders both artifacts.
     */
    public GeneratorResult generate(ValuePartition partition, String signalName, EncodingType encodingType) {
        List<String> warnings = collectWarnings(partition);
        warnings.forEach(log::warn);

        ControlSignal signal;
        try {
            signal = partition.commit(signalName, encodingType);
        } catch (SignalDefinitionException e) {
            return GeneratorResult.failure(e.getMessage());
        }

        boolean saved = false;
        if (config.isPersist()) {
            try {
                signal = withUniqueId(signal);
                recordStore.append(signal);
                saved = true;
                log.info("Saved record {} to {}", signal.getSignalId(), recordStore.getStorePath());
            } catch (RecordStorePermissionException e) {
                return GeneratorResult.permissionFailure(e.getMessage()
                        + ". Choose another --records-file or check the directory permissions.");
            } catch (RecordStoreException e) {
                return GeneratorResult.failure(e.getMessage());
            }
        }

        return render(signal, saved, warnings);
    }

    /**
     * Renders the artifacts of a stored record again, without creating a new record.
     */
    public GeneratorResult regenerate(String signalId) {
        Optional<ControlSignal> record = recordStore.find(signalId);
        if (record.isEmpty()) {
            return GeneratorResult.failure("No record with id " + signalId + " in " + recordStore.getStorePath());
        }
        return render(record.get(), false, List.of());
    }

    private GeneratorResult render(ControlSignal signal, boolean saved, List<String> warnings) {
        Map<ArtifactKind, String> artifacts = templateEngine.renderAll(signal);

        List<Path> written = List.of();
        if (config.getOutputDir() != null) {
            try {
                written = new ArtifactWriter(config.getOutputDir(), config.getClock()).write(signal, artifacts);
            } catch (AccessDeniedException e) {
                return GeneratorResult.permissionFailure("Permission denied writing to " + e.getFile());
            } catch (IOException e) {
                return GeneratorResult.failure("Failed to write generated code: " + e.getMessage());
            }
        }

        return GeneratorResult.builder()
                .success(true)
                .signal(signal)
                .recordSaved(saved)
                .artifacts(artifacts)
                .writtenFiles(written)
                .warnings(warnings)
                .build();
    }

    private ControlSignal withUniqueId(ControlSignal signal) {
        Set<String> existing = recordStore.list().stream()
                .map(ControlSignal::getSignalId)
                .collect(Collectors.toSet());
        String unique = SignalIdGenerator.makeUnique(signal.getSignalId(), existing);
        if (unique.equals(signal.getSignalId())) {
            return signal;
        }
        return signal.toBuilder().signalId(unique).build();
    }

    private List<String> collectWarnings(ValuePartition partition) {
        List<String> warnings = new ArrayList<>();

        for (ValueDefinition value : partition.incompleteValues()) {
            if (!value.hasName()) {
                warnings.add("Value without a name is skipped: " + value.getInstructions());
            } else {
                warnings.add("Value " + value.getName() + " has no instructions");
            }
        }

        if (!catalog.isEmpty()) {
            List<String> unknown = partition.assignedInstructions().stream()
                    .filter(name -> !catalog.contains(name))
                    .toList();
            if (!unknown.isEmpty()) {
                warnings.add("Instructions not in the catalog: " + String.join(", ", unknown));
            }
        }

        return warnings;
    }
}
