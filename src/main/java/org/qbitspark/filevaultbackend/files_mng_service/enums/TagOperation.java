package org.qbitspark.filevaultbackend.files_mng_service.enums;

public enum TagOperation {
    ADD,
    REMOVE,
    REPLACE
}
