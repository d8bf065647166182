package org.qbitspark.filevaultbackend.globeadvice.exceptions;

/**
 * Content backend I/O failure. Always surfaced to the caller.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Thrown when no object exists under the requested key.
     */
    public static class ObjectNotFoundException extends StorageException {
        private final String storageKey;

        public ObjectNotFoundException(String storageKey) {
            super("Stored object not found: " + storageKey);
            this.storageKey = storageKey;
        }

        public String getStorageKey() {
            return storageKey;
        }
    }
}
