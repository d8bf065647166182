package org.qbitspark.filevaultbackend.globe_utils;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import org.qbitspark.filevaultbackend.globeadvice.exceptions.FileValidationException;
import org.qbitspark.filevaultbackend.upload_validation_service.enums.ValidationFailure;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Runs the Bean Validation constraints declared on request payloads.
 */
@Component
@RequiredArgsConstructor
public class RequestValidator {

    private final Validator validator;

    public <T> void validate(T request) throws FileValidationException {
        if (request == null) {
            throw new FileValidationException(ValidationFailure.INVALID_REQUEST, "Request is required");
        }
        Set<ConstraintViolation<T>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            String message = violations.stream()
                    .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                    .map(ConstraintViolation::getMessage)
                    .collect(Collectors.joining("; "));
            throw new FileValidationException(ValidationFailure.INVALID_REQUEST, message);
        }
    }
}
