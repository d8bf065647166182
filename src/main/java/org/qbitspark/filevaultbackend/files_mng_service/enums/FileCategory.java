package org.qbitspark.filevaultbackend.files_mng_service.enums;

public enum FileCategory {
    FORMATION,
    PLAYER_PHOTO,
    TEAM_LOGO,
    DOCUMENT,
    VIDEO,
    AUDIO,
    ARCHIVE,
    BACKUP,
    REPORT,
    OTHER;

    // Path segment used when building storage keys
    public String storagePrefix() {
        return name().toLowerCase();
    }
}
