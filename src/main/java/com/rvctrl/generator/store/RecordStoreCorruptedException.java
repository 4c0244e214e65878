package com.rvctrl.generator.store;

import java.nio.file.Path;

/**
 * The record store exists but is not a readable list of records; it is left as it is rather
 * than overwritten.
 */
public class RecordStoreCorruptedException extends RecordStoreException {

    private static final long serialVersionUID = 1L;

    public RecordStoreCorruptedException(Path storePath, Throwable cause) {
        super("Record store is unreadable and will not be overwritten: " + storePath, storePath, cause);
    }
}
