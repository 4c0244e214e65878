package com.rvctrl.generator.store;

import java.nio.file.Path;

/**
 * Writing the record store was denied by the file system. Kept apart from other I/O failures so
 * the caller can suggest different permissions or another location.
 */
public class RecordStorePermissionException extends RecordStoreException {

    private static final long serialVersionUID = 1L;

    public RecordStorePermissionException(Path storePath, Throwable cause) {
        super("Permission denied writing record store: " + storePath, storePath, cause);
    }
}
