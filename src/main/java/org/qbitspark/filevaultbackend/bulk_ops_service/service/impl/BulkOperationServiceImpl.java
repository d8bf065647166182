package org.qbitspark.filevaultbackend.bulk_ops_service.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.qbitspark.filevaultbackend.bulk_ops_service.payload.BulkCopyRequest;
import org.qbitspark.filevaultbackend.bulk_ops_service.payload.BulkDeleteRequest;
import org.qbitspark.filevaultbackend.bulk_ops_service.payload.BulkMoveRequest;
import org.qbitspark.filevaultbackend.bulk_ops_service.payload.BulkOperationResponse;
import org.qbitspark.filevaultbackend.bulk_ops_service.payload.BulkTagRequest;
import org.qbitspark.filevaultbackend.bulk_ops_service.service.BulkOperationService;
import org.qbitspark.filevaultbackend.files_mng_service.entity.FileEntity;
import org.qbitspark.filevaultbackend.files_mng_service.repo.FileRepository;
import org.qbitspark.filevaultbackend.files_mng_service.service.FileAccessPolicy;
import org.qbitspark.filevaultbackend.files_mng_service.service.FileService;
import org.qbitspark.filevaultbackend.globe_utils.RequestValidator;
import org.qbitspark.filevaultbackend.globeadvice.exceptions.FileValidationException;
import org.qbitspark.filevaultbackend.globesecurity.AccessContext;
import org.qbitspark.filevaultbackend.upload_validation_service.enums.ValidationFailure;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Runs each item through the transactional {@link FileService} proxy, so every file commits
 * or rolls back on its own. This class opens no transaction of its own.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BulkOperationServiceImpl implements BulkOperationService {

    static final int MAX_BATCH_SIZE = 100;

    private final FileService fileService;
    private final FileRepository fileRepository;
    private final FileAccessPolicy accessPolicy;
    private final RequestValidator requestValidator;

    @Override
    public BulkOperationResponse bulkDelete(BulkDeleteRequest request, AccessContext context)
            throws FileValidationException {
        requestValidator.validate(request);
        List<UUID> fileIds = distinctIds(request.getFileIds());

        if (request.isPermanent()) {
            return process("delete", fileIds, context, fileId -> {
                accessPolicy.requirePrivileged(context, "Permanent deletion");
                fileService.purgeFile(fileId, context);
            });
        }
        return process("delete", fileIds, context, fileId -> fileService.softDeleteFile(fileId, context));
    }

    @Override
    public BulkOperationResponse bulkMove(BulkMoveRequest request, AccessContext context)
            throws FileValidationException {
        requestValidator.validate(request);
        List<UUID> fileIds = distinctIds(request.getFileIds());

        return process("move", fileIds, context,
                fileId -> fileService.changeCategory(fileId, request.getTargetCategory(), context));
    }

    @Override
    public BulkOperationResponse bulkCopy(BulkCopyRequest request, AccessContext context)
            throws FileValidationException {
        requestValidator.validate(request);
        List<UUID> fileIds = distinctIds(request.getFileIds());

        return process("copy", fileIds, context,
                fileId -> fileService.copyFile(fileId, request.getTargetCategory(), context));
    }

    @Override
    public BulkOperationResponse bulkTag(BulkTagRequest request, AccessContext context)
            throws FileValidationException {
        requestValidator.validate(request);
        List<UUID> fileIds = distinctIds(request.getFileIds());

        return process("tag", fileIds, context,
                fileId -> fileService.applyTags(fileId, request.getOperation(), request.getTags(), context));
    }

    private BulkOperationResponse process(String operation, List<UUID> fileIds, AccessContext context,
                                          ItemAction action) {
        log.info("Starting bulk {} by {} - Files: {}", operation, actorOf(context), fileIds.size());

        List<UUID> successfulIds = new ArrayList<>();
        List<BulkOperationResponse.FailedOperation> failures = new ArrayList<>();

        for (UUID fileId : fileIds) {
            try {
                action.apply(fileId);
                successfulIds.add(fileId);
                log.debug("Bulk {} succeeded for file: {}", operation, fileId);

            } catch (Exception e) {
                failures.add(BulkOperationResponse.FailedOperation.builder()
                        .fileId(fileId)
                        .fileName(getFileNameSafely(fileId, context))
                        .reason(e.getMessage())
                        .build());

                log.warn("Bulk {} failed for file {}: {}", operation, fileId, e.getMessage());
            }
        }

        int total = fileIds.size();
        int successful = successfulIds.size();
        int failed = failures.size();

        log.info("Bulk {} completed by {} - Success: {}, Failed: {}",
                operation, actorOf(context), successful, failed);

        return BulkOperationResponse.builder()
                .operation(operation)
                .totalRequested(total)
                .successful(successful)
                .failed(failed)
                .successfulIds(successfulIds)
                .failures(failures)
                .summary(buildSummary(operation, successful, failed, total))
                .build();
    }

    private List<UUID> distinctIds(List<UUID> fileIds) throws FileValidationException {
        List<UUID> distinct = new ArrayList<>(new LinkedHashSet<>(fileIds));
        distinct.removeIf(Objects::isNull);

        if (distinct.isEmpty()) {
            throw new FileValidationException(ValidationFailure.INVALID_REQUEST,
                    "At least one file must be selected");
        }
        if (distinct.size() > MAX_BATCH_SIZE) {
            throw new FileValidationException(ValidationFailure.INVALID_REQUEST,
                    "Bulk operations are limited to " + MAX_BATCH_SIZE + " files, got " + distinct.size());
        }
        return distinct;
    }

    // Names are only reported for files the caller could already see
    private String getFileNameSafely(UUID fileId, AccessContext context) {
        try {
            return fileRepository.findById(fileId)
                    .filter(file -> !file.isDeleted() || (context != null && context.isPrivileged()))
                    .filter(file -> accessPolicy.canRead(file, context))
                    .map(FileEntity::getOriginalName)
                    .orElse("Unknown file");
        } catch (RuntimeException e) {
            return "Unknown file";
        }
    }

    private static String buildSummary(String operation, int successful, int failed, int total) {
        if (failed == 0) {
            return String.format("Bulk %s succeeded for %d file(s)", operation, successful);
        } else if (successful == 0) {
            return String.format("Bulk %s failed for all %d file(s)", operation, total);
        } else {
            return String.format("Bulk %s succeeded for %d file(s), %d failed", operation, successful, failed);
        }
    }

    private static Object actorOf(AccessContext context) {
        return context != null && context.getUserId() != null ? context.getUserId() : "anonymous";
    }

    @FunctionalInterface
    private interface ItemAction {
        void apply(UUID fileId) throws Exception;
    }
}
