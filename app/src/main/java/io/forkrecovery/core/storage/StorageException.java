package io.forkrecovery.core.storage;

/** Local persistence failed; nothing from the failed write may be treated as committed. */
public class StorageException extends RuntimeException {
    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
