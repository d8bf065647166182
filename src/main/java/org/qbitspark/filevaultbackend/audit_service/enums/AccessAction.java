package org.qbitspark.filevaultbackend.audit_service.enums;

public enum AccessAction {
    UPLOAD,
    VIEW,
    DOWNLOAD,
    STREAM,
    THUMBNAIL,
    UPDATE,
    DELETE,
    RESTORE,
    PURGE,
    TAG,
    MOVE,
    COPY,
    VERSION_CREATE,
    VERSION_RESTORE,
    SHARE_CREATE,
    SHARE_REVOKE,
    SHARE_DOWNLOAD
}
