package org.qbitspark.filevaultbackend.upload_validation_service.payload;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.qbitspark.filevaultbackend.globeadvice.exceptions.FileValidationException;
import org.qbitspark.filevaultbackend.upload_validation_service.enums.ValidationFailure;

@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ValidationResult {

    private static final ValidationResult OK = new ValidationResult(true, null, null);

    private final boolean valid;
    private final ValidationFailure failure;
    private final String reason;

    public static ValidationResult ok() {
        return OK;
    }

    public static ValidationResult rejected(ValidationFailure failure, String reason) {
        return new ValidationResult(false, failure, reason);
    }

    public void throwIfRejected() throws FileValidationException {
        if (!valid) {
            throw new FileValidationException(failure, reason);
        }
    }
}
