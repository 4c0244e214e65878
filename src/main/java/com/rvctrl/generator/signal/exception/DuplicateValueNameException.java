package com.rvctrl.generator.signal.exception;

import java.util.List;

public class DuplicateValueNameException extends SignalDefinitionException {

    private static final long serialVersionUID = 1L;

    private final List<String> valueNames;

    public DuplicateValueNameException(List<String> valueNames) {
        super("Value names must be unique, duplicated: " + String.join(", ", valueNames));
        this.valueNames = List.copyOf(valueNames);
    }

    public List<String> getValueNames() {
        return valueNames;
    }
}
