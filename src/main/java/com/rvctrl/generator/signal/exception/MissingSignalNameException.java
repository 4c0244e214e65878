package com.rvctrl.generator.signal.exception;

public class MissingSignalNameException extends SignalDefinitionException {

    private static final long serialVersionUID = 1L;

    public MissingSignalNameException() {
        super("Signal name is required");
    }
}
