package org.qbitspark.filevaultbackend.files_mng_service.enums;

public enum VirusScanStatus {
    PENDING,    // Stored, scan not attempted yet
    CLEAN,      // Scanner found nothing
    INFECTED,   // Never persisted, upload is rejected
    FAILED,     // Scanner unavailable, accepted by configuration
    SKIPPED     // Scanning disabled globally or for the category
}
