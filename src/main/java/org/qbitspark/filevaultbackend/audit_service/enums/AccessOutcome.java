package org.qbitspark.filevaultbackend.audit_service.enums;

public enum AccessOutcome {
    SUCCESS,
    FAILURE
}
