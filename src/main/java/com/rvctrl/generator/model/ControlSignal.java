package com.rvctrl.generator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.rvctrl.generator.signal.WidthCalculator;
import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A committed control signal definition, as stored in the record store.
 *
 * Immutable: editing a signal produces a new record. Value order is significant because it
 * determines the order of declarations in generated code.
 */
@Value
@JsonPropertyOrder({"name", "encoding_type", "width", "values", "created_at", "instructions", "signal_id"})
public class ControlSignal {

    @JsonProperty("name")
    String name;

    @JsonProperty("encoding_type")
    EncodingType encodingType;

    @JsonProperty("width")
    int width;

    @JsonProperty("values")
    Map<String, List<String>> values;

    @JsonProperty("created_at")
    String createdAt;

    /**
     * Deduplicated union of all instructions referenced by {@link #values}.
     */
    @JsonProperty("instructions")
    List<String> instructions;

    @JsonProperty("signal_id")
    String signalId;

    @Builder(toBuilder = true)
    @JsonCreator
    public ControlSignal(@JsonProperty(value = "name", required = true) String name,
                         @JsonProperty(value = "encoding_type", required = true) EncodingType encodingType,
                         @JsonProperty(value = "width", required = true) int width,
                         @JsonProperty(value = "values", required = true) Map<String, List<String>> values,
                         @JsonProperty(value = "created_at", required = true) String createdAt,
                         @JsonProperty(value = "instructions", required = true) List<String> instructions,
                         @JsonProperty(value = "signal_id", required = true) String signalId) {
        this.name = Objects.requireNonNull(name, "name");
        this.encodingType = Objects.requireNonNull(encodingType, "encoding_type");
        if (width < 0) {
            throw new IllegalArgumentException("width must be >= 0, got " + width);
        }
        this.width = width;
        this.values = copyValues(Objects.requireNonNull(values, "values"));
        this.createdAt = Objects.requireNonNull(createdAt, "created_at");
        this.instructions = List.copyOf(Objects.requireNonNull(instructions, "instructions"));
        this.signalId = Objects.requireNonNull(signalId, "signal_id");
        checkConsistency();
    }

    /**
     * Each instruction belongs to at most one value, {@code instructions} is exactly the union of
     * the values and the width matches the encoding scheme.
     */
    private void checkConsistency() {
        Set<String> union = new LinkedHashSet<>();
        for (Map.Entry<String, List<String>> value : values.entrySet()) {
            for (String instruction : value.getValue()) {
                if (!union.add(instruction)) {
                    throw new IllegalArgumentException("Instruction " + instruction
                            + " is listed more than once in values (last under " + value.getKey() + ")");
                }
            }
        }
        if (instructions.size() != union.size() || !union.containsAll(instructions)) {
            throw new IllegalArgumentException("instructions " + instructions
                    + " is not the union of the values " + union);
        }
        int expectedWidth = WidthCalculator.width(encodingType, values.size());
        if (width != expectedWidth) {
            throw new IllegalArgumentException("width " + width + " does not match " + encodingType
                    + " with " + values.size() + " values, expected " + expectedWidth);
        }
    }

    private static Map<String, List<String>> copyValues(Map<String, List<String>> source) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        source.forEach((valueName, members) -> copy.put(
                Objects.requireNonNull(valueName, "value name"),
                members == null ? List.of() : List.copyOf(members)));
        return Collections.unmodifiableMap(copy);
    }

    @JsonIgnore
    public int getValueCount() {
        return values.size();
    }
}
