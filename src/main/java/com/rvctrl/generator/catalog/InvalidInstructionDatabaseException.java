package com.rvctrl.generator.catalog;

/**
 * The structured instruction database is not valid JSON or not a JSON object.
 */
public class InvalidInstructionDatabaseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public InvalidInstructionDatabaseException(String message) {
        super(message);
    }

    public InvalidInstructionDatabaseException(String message, Throwable cause) {
        super(message, cause);
    }
}
