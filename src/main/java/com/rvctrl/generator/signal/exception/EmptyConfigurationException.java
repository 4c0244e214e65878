package com.rvctrl.generator.signal.exception;

public class EmptyConfigurationException extends SignalDefinitionException {

    private static final long serialVersionUID = 1L;

    public EmptyConfigurationException() {
        super("At least one value with a non-empty name is required");
    }
}
