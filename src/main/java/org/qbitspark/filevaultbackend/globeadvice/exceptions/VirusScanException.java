package org.qbitspark.filevaultbackend.globeadvice.exceptions;

public class VirusScanException extends Exception {
    public VirusScanException(String message) {
        super(message);
    }

    public VirusScanException(String message, Throwable cause) {
        super(message, cause);
    }
}
