package org.qbitspark.filevaultbackend.versioning_service.enums;

public enum ChangeType {
    CREATE,
    UPDATE,
    OPTIMIZE,
    RESTORE,
    METADATA,
    BACKUP
}
