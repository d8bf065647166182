package org.qbitspark.filevaultbackend.files_mng_service.service;

import lombok.RequiredArgsConstructor;
import org.qbitspark.filevaultbackend.files_mng_service.entity.FileEntity;
import org.qbitspark.filevaultbackend.files_mng_service.repo.FileRepository;
import org.qbitspark.filevaultbackend.globeadvice.exceptions.AccessDeniedException;
import org.qbitspark.filevaultbackend.globeadvice.exceptions.ItemNotFoundException;
import org.qbitspark.filevaultbackend.globesecurity.AccessContext;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Loads file records on behalf of a caller and applies the access rules:
 * read needs privilege, ownership or a public file; write needs privilege or ownership.
 * Soft-deleted records are reported as missing to anyone without privilege.
 */
@Component
@RequiredArgsConstructor
public class FileAccessPolicy {

    private final FileRepository fileRepository;

    public FileEntity loadReadable(UUID fileId, AccessContext context)
            throws ItemNotFoundException, AccessDeniedException {
        FileEntity file = loadVisible(fileId, context);
        if (!canRead(file, context)) {
            throw new AccessDeniedException("Access denied: You don't have access to this file");
        }
        return file;
    }

    public FileEntity loadWritable(UUID fileId, AccessContext context)
            throws ItemNotFoundException, AccessDeniedException {
        FileEntity file = loadVisible(fileId, context);
        if (!canWrite(file, context)) {
            throw new AccessDeniedException("Access denied: You don't own this file");
        }
        return file;
    }

    public FileEntity loadVisible(UUID fileId, AccessContext context) throws ItemNotFoundException {
        if (fileId == null) {
            throw new ItemNotFoundException("File not found");
        }
        FileEntity file = fileRepository.findById(fileId)
                .orElseThrow(() -> new ItemNotFoundException("File not found"));
        if (file.isDeleted() && !isPrivileged(context)) {
            throw new ItemNotFoundException("File not found");
        }
        return file;
    }

    public boolean canRead(FileEntity file, AccessContext context) {
        return isPrivileged(context) || file.isOwnedBy(userId(context)) || file.isPublic();
    }

    public boolean canWrite(FileEntity file, AccessContext context) {
        return isPrivileged(context) || file.isOwnedBy(userId(context));
    }

    public void requirePrivileged(AccessContext context, String operation) throws AccessDeniedException {
        if (!isPrivileged(context)) {
            throw new AccessDeniedException("Access denied: " + operation + " requires administrator privileges");
        }
    }

    public void requireAuthenticated(AccessContext context) throws AccessDeniedException {
        if (context == null || !context.isAuthenticated()) {
            throw new AccessDeniedException("Access denied: Authentication required");
        }
    }

    private static boolean isPrivileged(AccessContext context) {
        return context != null && context.isPrivileged();
    }

    private static UUID userId(AccessContext context) {
        return context != null ? context.getUserId() : null;
    }
}
