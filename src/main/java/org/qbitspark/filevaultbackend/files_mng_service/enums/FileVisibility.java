package org.qbitspark.filevaultbackend.files_mng_service.enums;

public enum FileVisibility {
    PUBLIC,
    PRIVATE
}
