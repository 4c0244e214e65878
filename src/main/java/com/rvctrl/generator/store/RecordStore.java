package com.rvctrl.generator.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.rvctrl.generator.codegen.util.FileWriteUtil;
import com.rvctrl.generator.model.ControlSignal;
import com.rvctrl.generator.signal.SignalIdGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Persists control signal records as one JSON array.
 *
 * Every write reads the whole list, modifies it and rewrites the whole file. The cycle is not
 * transactional: two processes sharing a store path can lose each other's updates, and a crash
 * mid-write can leave an unreadable file.
 *
 * Reads are lenient ({@link #list()} returns an empty list for a missing or unreadable store),
 * writes are not: {@link #append} and {@link #delete} refuse to replace a store they cannot parse.
 */
public class RecordStore {
    private static final Logger log = LoggerFactory.getLogger(RecordStore.class);

    private static final TypeReference<List<ControlSignal>> RECORD_LIST = new TypeReference<>() {
    };

    /** Later timestamps first; timestamps that do not parse go last. */
    private static final Comparator<ControlSignal> NEWEST_FIRST = Comparator.comparing(
            RecordStore::parseCreatedAt, Comparator.nullsLast(Comparator.<LocalDateTime>reverseOrder()));

    private final Path storePath;
    private final ObjectMapper objectMapper;

    public RecordStore(Path storePath) {
        this(storePath, createObjectMapper());
    }

    public RecordStore(Path storePath, ObjectMapper objectMapper) {
        this.storePath = Objects.requireNonNull(storePath, "storePath");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    public static ObjectMapper createObjectMapper() {
        return new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
                .enable(DeserializationFeature.FAIL_ON_MISSING_CREATOR_PROPERTIES);
    }

    public Path getStorePath() {
        return storePath;
    }

    /**
     * All records, newest first. A missing or unreadable store yields an empty list.
     */
    public List<ControlSignal> list() {
        List<ControlSignal> records;
        try {
            records = readAll();
        } catch (RecordStoreException e) {
            log.warn("Ignoring unreadable record store {}: {}", storePath, e.getCause() != null
                    ? e.getCause().getMessage() : e.getMessage());
            return List.of();
        }
        List<ControlSignal> sorted = new ArrayList<>(records);
        sorted.sort(NEWEST_FIRST);
        return sorted;
    }

    public Optional<ControlSignal> find(String signalId) {
        return list().stream()
                .filter(r -> r.getSignalId().equals(signalId))
                .findFirst();
    }

    public void append(ControlSignal record) throws RecordStoreException {
        Objects.requireNonNull(record, "record");
        List<ControlSignal> records = readAll();
        records.add(record);
        writeAll(records);
        log.debug("Appended record {} ({}) to {}", record.getSignalId(), record.getName(), storePath);
    }

    /**
     * @return whether a record with that id existed
     */
    public boolean delete(String signalId) throws RecordStoreException {
        List<ControlSignal> records = readAll();
        boolean removed = records.removeIf(r -> r.getSignalId().equals(signalId));
        writeAll(records);
        log.debug("Delete {} from {}: {}", signalId, storePath, removed ? "removed" : "not found");
        return removed;
    }

    /**
     * Records in file order. A missing or blank file is an empty store.
     */
    List<ControlSignal> readAll() throws RecordStoreException {
        if (!Files.exists(storePath)) {
            return new ArrayList<>();
        }
        try {
            String json = Files.readString(storePath, StandardCharsets.UTF_8);
            if (json.isBlank()) {
                return new ArrayList<>();
            }
            List<ControlSignal> records = objectMapper.readValue(json, RECORD_LIST);
            if (records == null || records.contains(null)) {
                throw new RecordStoreCorruptedException(storePath, null);
            }
            return new ArrayList<>(records);
        } catch (JsonProcessingException e) {
            throw new RecordStoreCorruptedException(storePath, e);
        } catch (RecordStoreException e) {
            throw e;
        } catch (IOException e) {
            throw new RecordStoreException("Failed to read record store: " + storePath, storePath, e);
        }
    }

    private void writeAll(List<ControlSignal> records) throws RecordStoreException {
        try {
            FileWriteUtil.safeWriteString(storePath, objectMapper.writeValueAsString(records));
        } catch (AccessDeniedException e) {
            throw new RecordStorePermissionException(storePath, e);
        } catch (IOException e) {
            throw new RecordStoreException("Failed to write record store: " + storePath, storePath, e);
        }
    }

    private static LocalDateTime parseCreatedAt(ControlSignal record) {
        try {
            return LocalDateTime.parse(record.getCreatedAt(), SignalIdGenerator.CREATED_AT_FORMAT);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
