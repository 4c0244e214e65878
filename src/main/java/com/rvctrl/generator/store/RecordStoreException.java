package com.rvctrl.generator.store;

import java.io.IOException;
import java.nio.file.Path;

/**
 * The record store could not be read or written.
 */
public class RecordStoreException extends IOException {

    private static final long serialVersionUID = 1L;

    private final transient Path storePath;

    public RecordStoreException(String message, Path storePath, Throwable cause) {
        super(message, cause);
        this.storePath = storePath;
    }

    public Path getStorePath() {
        return storePath;
    }
}
