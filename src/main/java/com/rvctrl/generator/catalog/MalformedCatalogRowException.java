package com.rvctrl.generator.catalog;

/**
 * A flat catalog row that does not carry at least name, extension and encoding.
 */
public class MalformedCatalogRowException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int lineNumber;
    private final String line;

    public MalformedCatalogRowException(int lineNumber, String line) {
        super("Malformed catalog row at line " + lineNumber
                + " (expected: name extension encoding [args...]): " + line);
        this.lineNumber = lineNumber;
        this.line = line;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    public String getLine() {
        return line;
    }
}
