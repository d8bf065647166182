package org.qbitspark.filevaultbackend.globeadvice.exceptions;

public class UnauthorizedAccessException extends Exception {
    public UnauthorizedAccessException(String message) {
        super(message);
    }
}
