package com.rvctrl.generator.signal;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A named classification bucket being edited. Instruction order is insertion order.
 */
public class ValueDefinition {

    private String name;
    private final Set<String> instructions = new LinkedHashSet<>();

    public ValueDefinition(String name) {
        this.name = name == null ? "" : name;
    }

    public ValueDefinition(String name, Collection<String> instructions) {
        this(name);
        setInstructions(instructions);
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name == null ? "" : name;
    }

    public boolean hasName() {
        return !name.isBlank();
    }

    public Set<String> getInstructions() {
        return Collections.unmodifiableSet(instructions);
    }

    public boolean add(String instruction) {
        return instructions.add(Objects.requireNonNull(instruction, "instruction"));
    }

    public boolean remove(String instruction) {
        return instructions.remove(instruction);
    }

    public boolean holds(String instruction) {
        return instructions.contains(instruction);
    }

    public void setInstructions(Collection<String> replacement) {
        List<String> copy = List.copyOf(replacement);
        instructions.clear();
        copy.forEach(this::add);
    }

    public boolean isEmpty() {
        return instructions.isEmpty();
    }

    /**
     * A value is complete when it has a name and at least one instruction.
     */
    public boolean isComplete() {
        return hasName() && !isEmpty();
    }

    @Override
    public String toString() {
        return name + instructions;
    }
}
