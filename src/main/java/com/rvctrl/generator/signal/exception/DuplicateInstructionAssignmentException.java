package com.rvctrl.generator.signal.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * One or more instructions are claimed by more than one value.
 */
public class DuplicateInstructionAssignmentException extends SignalDefinitionException {

    private static final long serialVersionUID = 1L;

    private final Map<String, List<String>> conflicts;

    public DuplicateInstructionAssignmentException(Map<String, List<String>> conflicts) {
        super("Instructions assigned to more than one value: " + describe(conflicts));
        Map<String, List<String>> copy = new LinkedHashMap<>();
        conflicts.forEach((instruction, values) -> copy.put(instruction, List.copyOf(values)));
        this.conflicts = Collections.unmodifiableMap(copy);
    }

    /**
     * Instruction name to the value names claiming it, in the order the conflicts were found.
     */
    public Map<String, List<String>> getConflicts() {
        return conflicts;
    }

    public List<String> getInstructions() {
        return conflicts.keySet().stream().sorted().toList();
    }

    private static String describe(Map<String, List<String>> conflicts) {
        return conflicts.entrySet().stream()
                .map(e -> e.getKey() + " (" + String.join(", ", e.getValue()) + ")")
                .collect(Collectors.joining(", "));
    }
}
