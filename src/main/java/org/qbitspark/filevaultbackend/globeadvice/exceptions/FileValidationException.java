package org.qbitspark.filevaultbackend.globeadvice.exceptions;

import lombok.Getter;
import org.qbitspark.filevaultbackend.upload_validation_service.enums.ValidationFailure;

/**
 * Rejection of an upload or a request before anything was written.
 */
@Getter
public class FileValidationException extends Exception {

    private final ValidationFailure failure;

    public FileValidationException(ValidationFailure failure, String message) {
        super(message);
        this.failure = failure;
    }
}
