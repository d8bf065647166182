package org.qbitspark.filevaultbackend.globeadvice.exceptions;

public class ShareExpiredException extends Exception {
    public ShareExpiredException(String message) {
        super(message);
    }
}
