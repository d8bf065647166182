package org.qbitspark.filevaultbackend.globeadvice.exceptions;

public class ShareLimitReachedException extends Exception {
    public ShareLimitReachedException(String message) {
        super(message);
    }
}
