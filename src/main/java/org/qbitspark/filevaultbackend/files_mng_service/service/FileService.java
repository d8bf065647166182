package org.qbitspark.filevaultbackend.files_mng_service.service;

import org.qbitspark.filevaultbackend.audit_service.payload.AccessLogResponse;
import org.qbitspark.filevaultbackend.files_mng_service.enums.FileCategory;
import org.qbitspark.filevaultbackend.files_mng_service.enums.TagOperation;
import org.qbitspark.filevaultbackend.files_mng_service.payload.FileDownload;
import org.qbitspark.filevaultbackend.files_mng_service.payload.FileListResponse;
import org.qbitspark.filevaultbackend.files_mng_service.payload.FileResponse;
import org.qbitspark.filevaultbackend.files_mng_service.payload.FileSearchCriteria;
import org.qbitspark.filevaultbackend.files_mng_service.payload.FileStreamChunk;
import org.qbitspark.filevaultbackend.files_mng_service.payload.UpdateFileRequest;
import org.qbitspark.filevaultbackend.files_mng_service.payload.UploadFileRequest;
import org.qbitspark.filevaultbackend.globeadvice.exceptions.AccessDeniedException;
import org.qbitspark.filevaultbackend.globeadvice.exceptions.ConflictException;
import org.qbitspark.filevaultbackend.globeadvice.exceptions.FileValidationException;
import org.qbitspark.filevaultbackend.globeadvice.exceptions.ItemNotFoundException;
import org.qbitspark.filevaultbackend.globeadvice.exceptions.VirusScanException;
import org.qbitspark.filevaultbackend.globesecurity.AccessContext;

import java.util.Collection;
import java.util.UUID;

public interface FileService {

    FileResponse upload(UploadFileRequest request, AccessContext context)
            throws FileValidationException, AccessDeniedException, VirusScanException;

    FileResponse getFile(UUID fileId, AccessContext context) throws ItemNotFoundException, AccessDeniedException;

    FileDownload download(UUID fileId, AccessContext context) throws ItemNotFoundException, AccessDeniedException;

    /**
     * Serves {@code start..end} (inclusive) of a streamable audio or video file. A missing start
     * means 0; a missing or overlong end means the last byte. Does not count as a download.
     */
    FileStreamChunk stream(UUID fileId, Long start, Long end, AccessContext context)
            throws ItemNotFoundException, AccessDeniedException, FileValidationException;

    FileDownload getThumbnail(UUID fileId, AccessContext context) throws ItemNotFoundException, AccessDeniedException;

    FileResponse updateFile(UUID fileId, UpdateFileRequest request, AccessContext context)
            throws ItemNotFoundException, AccessDeniedException, FileValidationException, ConflictException;

    FileListResponse listFiles(FileSearchCriteria criteria, AccessContext context);

    void softDeleteFile(UUID fileId, AccessContext context)
            throws ItemNotFoundException, AccessDeniedException, ConflictException;

    FileResponse restoreDeletedFile(UUID fileId, AccessContext context)
            throws ItemNotFoundException, AccessDeniedException, ConflictException;

    void purgeFile(UUID fileId, AccessContext context) throws ItemNotFoundException, AccessDeniedException;

    FileResponse applyTags(UUID fileId, TagOperation operation, Collection<String> tags, AccessContext context)
            throws ItemNotFoundException, AccessDeniedException, FileValidationException, ConflictException;

    FileResponse changeCategory(UUID fileId, FileCategory category, AccessContext context)
            throws ItemNotFoundException, AccessDeniedException, FileValidationException, ConflictException;

    FileResponse copyFile(UUID fileId, FileCategory targetCategory, AccessContext context)
            throws ItemNotFoundException, AccessDeniedException, FileValidationException, ConflictException;

    AccessLogResponse getAccessLog(UUID fileId, int page, int size, AccessContext context)
            throws ItemNotFoundException, AccessDeniedException;
}
