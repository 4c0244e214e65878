package com.rvctrl.generator.signal.exception;

/**
 * Base class for configurations that cannot be committed to a control signal.
 */
public abstract class SignalDefinitionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    protected SignalDefinitionException(String message) {
        super(message);
    }
}
