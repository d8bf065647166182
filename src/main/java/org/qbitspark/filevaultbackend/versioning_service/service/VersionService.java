package org.qbitspark.filevaultbackend.versioning_service.service;

import org.qbitspark.filevaultbackend.files_mng_service.entity.FileEntity;
import org.qbitspark.filevaultbackend.globeadvice.exceptions.AccessDeniedException;
import org.qbitspark.filevaultbackend.globeadvice.exceptions.ConflictException;
import org.qbitspark.filevaultbackend.globeadvice.exceptions.FileValidationException;
import org.qbitspark.filevaultbackend.globeadvice.exceptions.ItemNotFoundException;
import org.qbitspark.filevaultbackend.globeadvice.exceptions.VirusScanException;
import org.qbitspark.filevaultbackend.globesecurity.AccessContext;
import org.qbitspark.filevaultbackend.versioning_service.entity.FileVersionEntity;
import org.qbitspark.filevaultbackend.versioning_service.payload.CreateVersionRequest;
import org.qbitspark.filevaultbackend.versioning_service.payload.FileVersionResponse;
import org.qbitspark.filevaultbackend.versioning_service.payload.RestoreVersionRequest;
import org.qbitspark.filevaultbackend.versioning_service.payload.VersionDiffResponse;
import org.qbitspark.filevaultbackend.versioning_service.payload.VersionHistoryResponse;
import org.qbitspark.filevaultbackend.versioning_service.payload.VersionRestoreResponse;

import java.math.BigDecimal;
import java.util.UUID;

public interface VersionService {

    FileVersionResponse createVersion(UUID fileId, CreateVersionRequest request, AccessContext context)
            throws ItemNotFoundException, AccessDeniedException, FileValidationException, ConflictException, VirusScanException;

    VersionHistoryResponse listVersions(UUID fileId, int page, int size, AccessContext context)
            throws ItemNotFoundException, AccessDeniedException;

    FileVersionResponse getVersion(UUID fileId, BigDecimal version, AccessContext context)
            throws ItemNotFoundException, AccessDeniedException;

    VersionRestoreResponse restoreVersion(UUID fileId, RestoreVersionRequest request, AccessContext context)
            throws ItemNotFoundException, AccessDeniedException, FileValidationException, ConflictException;

    VersionDiffResponse compareVersions(UUID fileId, BigDecimal fromVersion, BigDecimal toVersion, AccessContext context)
            throws ItemNotFoundException, AccessDeniedException;

    /**
     * Writes the CREATE entry for a freshly stored record. Runs in the caller's transaction.
     */
    FileVersionEntity recordInitialVersion(FileEntity file, UUID actorId);
}
