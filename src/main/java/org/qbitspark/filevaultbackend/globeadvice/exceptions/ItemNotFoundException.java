package org.qbitspark.filevaultbackend.globeadvice.exceptions;

public class ItemNotFoundException extends Exception {
    public ItemNotFoundException(String message) {
        super(message);
    }
}
