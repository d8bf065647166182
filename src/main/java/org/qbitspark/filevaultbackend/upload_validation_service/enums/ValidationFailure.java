package org.qbitspark.filevaultbackend.upload_validation_service.enums;

public enum ValidationFailure {
    EMPTY_FILE,
    FILE_TOO_LARGE,
    TYPE_NOT_ALLOWED,
    UNSAFE_FILENAME,
    MALICIOUS_CONTENT,
    HEADER_MISMATCH,
    INVALID_STRUCTURE,
    INVALID_REQUEST,
    NOT_STREAMABLE,
    INVALID_RANGE
}
