package org.qbitspark.filevaultbackend.globeadvice.exceptions;

import lombok.Getter;

/**
 * Stored bytes no longer match the recorded checksum. The content must not be served.
 */
@Getter
public class IntegrityException extends RuntimeException {

    private final String storageKey;
    private final String expectedChecksum;
    private final String actualChecksum;

    public IntegrityException(String storageKey, String expectedChecksum, String actualChecksum) {
        super(String.format("Checksum mismatch for %s: expected %s but was %s",
                storageKey, expectedChecksum, actualChecksum));
        this.storageKey = storageKey;
        this.expectedChecksum = expectedChecksum;
        this.actualChecksum = actualChecksum;
    }
}
