package org.qbitspark.filevaultbackend.globeadvice.exceptions;

public class AccessDeniedException extends Exception {
    public AccessDeniedException(String message) {
        super(message);
    }
}
