package com.rvctrl.generator.signal;

import com.rvctrl.generator.model.ControlSignal;
import com.rvctrl.generator.model.EncodingType;
import com.rvctrl.generator.signal.exception.DuplicateInstructionAssignmentException;
import com.rvctrl.generator.signal.exception.DuplicateValueNameException;
import com.rvctrl.generator.signal.exception.EmptyConfigurationException;
import com.rvctrl.generator.signal.exception.MissingSignalNameException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Assignment of instructions to the values of the signal being authored.
 *
 * While editing, two values may transiently claim the same instruction; {@link #computeConflicts()}
 * reports such overlaps and {@link #commit(String, EncodingType)} rejects them. Value order is the
 * order in which values were added and is carried into the committed signal.
 */
public class ValuePartition {
    private static final Logger log = LoggerFactory.getLogger(ValuePartition.class);

    private final List<ValueDefinition> values = new ArrayList<>();
    private final SignalIdGenerator idGenerator;

    public ValuePartition() {
        this(Clock.systemDefaultZone());
    }

    public ValuePartition(Clock clock) {
        this.idGenerator = new SignalIdGenerator(clock);
    }

    /**
     * Loads a stored signal for editing. The record itself is not modified; committing the
     * partition produces a new record.
     */
    public static ValuePartition fromRecord(ControlSignal record, Clock clock) {
        ValuePartition partition = new ValuePartition(clock);
        record.getValues().forEach(partition::addValue);
        return partition;
    }

    // ---- editing ----

    public ValueDefinition addValue(String name) {
        ValueDefinition value = new ValueDefinition(name);
        values.add(value);
        return value;
    }

    public ValueDefinition addValue(String name, Collection<String> instructions) {
        ValueDefinition value = addValue(name);
        value.setInstructions(instructions);
        return value;
    }

    /**
     * Adds a value with the default name {@code Value<n>}.
     */
    public ValueDefinition addValue() {
        return addValue("Value" + (values.size() + 1));
    }

    public boolean removeValue(String name) {
        return values.removeIf(v -> v.getName().equals(name));
    }

    public Optional<ValueDefinition> removeLastValue() {
        if (values.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(values.remove(values.size() - 1));
    }

    public Optional<ValueDefinition> getValue(String name) {
        return values.stream().filter(v -> v.getName().equals(name)).findFirst();
    }

    public List<ValueDefinition> getValues() {
        return Collections.unmodifiableList(values);
    }

    public int size() {
        return values.size();
    }

    public void assign(String valueName, String instruction) {
        requireValue(valueName).add(instruction);
    }

    public boolean unassign(String valueName, String instruction) {
        return requireValue(valueName).remove(instruction);
    }

    public void setInstructions(String valueName, Collection<String> instructions) {
        requireValue(valueName).setInstructions(instructions);
    }

    private ValueDefinition requireValue(String valueName) {
        return getValue(valueName)
                .orElseThrow(() -> new IllegalArgumentException("Unknown value: " + valueName));
    }

    // ---- queries ----

    /**
     * Instructions claimed by two or more values, mapped to the claiming value names in value order.
     */
    public Map<String, List<String>> computeConflicts() {
        Map<String, List<String>> claims = new LinkedHashMap<>();
        for (ValueDefinition value : values) {
            for (String instruction : value.getInstructions()) {
                claims.computeIfAbsent(instruction, k -> new ArrayList<>()).add(value.getName());
            }
        }
        claims.values().removeIf(claimants -> claimants.size() < 2);
        return claims;
    }

    /**
     * Name of another value that already holds the instruction, if any. Used to annotate
     * instructions that are unavailable to {@code owner}.
     */
    public Optional<String> claimedElsewhere(String instruction, ValueDefinition owner) {
        return values.stream()
                .filter(v -> v != owner)
                .filter(v -> v.holds(instruction))
                .map(ValueDefinition::getName)
                .findFirst();
    }

    /**
     * Values without a name or without instructions. These are allowed, but worth a warning.
     */
    public List<ValueDefinition> incompleteValues() {
        return values.stream().filter(v -> !v.isComplete()).toList();
    }

    /**
     * Union of all assigned instructions, in first-appearance order.
     */
    public Set<String> assignedInstructions() {
        Set<String> all = new LinkedHashSet<>();
        values.forEach(v -> all.addAll(v.getInstructions()));
        return all;
    }

    // ---- commit ----

    /**
     * Validates the whole configuration and produces an immutable signal record.
     * Values with a blank name are skipped; values without instructions are kept.
     *
     * @throws MissingSignalNameException if the signal name is blank
     * @throws EmptyConfigurationException if no value has a name
     * @throws DuplicateValueNameException if two named values share a name
     * @throws DuplicateInstructionAssignmentException if an instruction is claimed by several values
     */
    public ControlSignal commit(String signalName, EncodingType encodingType) {
        Objects.requireNonNull(encodingType, "encodingType");
        if (signalName == null || signalName.isBlank()) {
            throw new MissingSignalNameException();
        }

        List<ValueDefinition> named = values.stream().filter(ValueDefinition::hasName).toList();
        if (named.isEmpty()) {
            throw new EmptyConfigurationException();
        }

        Map<String, List<String>> mapping = new LinkedHashMap<>();
        List<String> duplicatedNames = new ArrayList<>();
        for (ValueDefinition value : named) {
            String valueName = value.getName().trim();
            if (mapping.containsKey(valueName)) {
                duplicatedNames.add(valueName);
                continue;
            }
            mapping.put(valueName, List.copyOf(value.getInstructions()));
        }
        if (!duplicatedNames.isEmpty()) {
            throw new DuplicateValueNameException(duplicatedNames);
        }

        Map<String, List<String>> conflicts = conflictsOf(mapping);
        if (!conflicts.isEmpty()) {
            throw new DuplicateInstructionAssignmentException(conflicts);
        }

        Set<String> union = new LinkedHashSet<>();
        mapping.values().forEach(union::addAll);

        LocalDateTime now = idGenerator.now();
        ControlSignal signal = ControlSignal.builder()
                .name(signalName.trim())
                .encodingType(encodingType)
                .width(WidthCalculator.width(encodingType, mapping.size()))
                .values(mapping)
                .instructions(List.copyOf(union))
                .createdAt(SignalIdGenerator.CREATED_AT_FORMAT.format(now))
                .signalId(SignalIdGenerator.SIGNAL_ID_FORMAT.format(now))
                .build();

        log.debug("Committed signal {} ({}, width {}) with {} values",
                signal.getName(), encodingType, signal.getWidth(), mapping.size());
        return signal;
    }

    private static Map<String, List<String>> conflictsOf(Map<String, List<String>> mapping) {
        Map<String, List<String>> claims = new LinkedHashMap<>();
        mapping.forEach((valueName, instructions) -> instructions.forEach(
                instruction -> claims.computeIfAbsent(instruction, k -> new ArrayList<>()).add(valueName)));
        claims.values().removeIf(claimants -> claimants.size() < 2);
        return claims;
    }
}
