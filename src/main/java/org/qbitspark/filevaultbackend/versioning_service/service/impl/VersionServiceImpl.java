package org.qbitspark.filevaultbackend.versioning_service.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.qbitspark.filevaultbackend.audit_service.enums.AccessAction;
import org.qbitspark.filevaultbackend.audit_service.service.AccessLogService;
import org.qbitspark.filevaultbackend.files_mng_service.entity.FileEntity;
import org.qbitspark.filevaultbackend.files_mng_service.enums.VirusScanStatus;
import org.qbitspark.filevaultbackend.files_mng_service.service.FileAccessPolicy;
import org.qbitspark.filevaultbackend.files_mng_service.service.FileRecordWriter;
import org.qbitspark.filevaultbackend.files_mng_service.service.MetadataExtractor;
import org.qbitspark.filevaultbackend.files_mng_service.service.ThumbnailGenerator;
import org.qbitspark.filevaultbackend.globe_utils.MimeTypes;
import org.qbitspark.filevaultbackend.globe_utils.RequestValidator;
import org.qbitspark.filevaultbackend.globeadvice.exceptions.AccessDeniedException;
import org.qbitspark.filevaultbackend.globeadvice.exceptions.ConflictException;
import org.qbitspark.filevaultbackend.globeadvice.exceptions.FileValidationException;
import org.qbitspark.filevaultbackend.globeadvice.exceptions.ItemNotFoundException;
import org.qbitspark.filevaultbackend.globeadvice.exceptions.StorageException;
import org.qbitspark.filevaultbackend.globeadvice.exceptions.VirusScanException;
import org.qbitspark.filevaultbackend.globesecurity.AccessContext;
import org.qbitspark.filevaultbackend.storage_service.service.ContentStore;
import org.qbitspark.filevaultbackend.upload_validation_service.enums.ValidationFailure;
import org.qbitspark.filevaultbackend.upload_validation_service.payload.CategoryPolicy;
import org.qbitspark.filevaultbackend.upload_validation_service.service.CategoryPolicyRegistry;
import org.qbitspark.filevaultbackend.upload_validation_service.service.UploadValidator;
import org.qbitspark.filevaultbackend.versioning_service.entity.FileVersionEntity;
import org.qbitspark.filevaultbackend.versioning_service.enums.ChangeType;
import org.qbitspark.filevaultbackend.versioning_service.enums.VersionBump;
import org.qbitspark.filevaultbackend.versioning_service.payload.CreateVersionRequest;
import org.qbitspark.filevaultbackend.versioning_service.payload.FileVersionResponse;
import org.qbitspark.filevaultbackend.versioning_service.payload.RestoreVersionRequest;
import org.qbitspark.filevaultbackend.versioning_service.payload.VersionDiffResponse;
import org.qbitspark.filevaultbackend.versioning_service.payload.VersionHistoryResponse;
import org.qbitspark.filevaultbackend.versioning_service.payload.VersionRestoreResponse;
import org.qbitspark.filevaultbackend.versioning_service.repo.FileVersionRepository;
import org.qbitspark.filevaultbackend.versioning_service.service.VersionService;
import org.qbitspark.filevaultbackend.versioning_service.service.VersionSnapshots;
import org.qbitspark.filevaultbackend.virus_scanner_service.payload.VirusScanResult;
import org.qbitspark.filevaultbackend.virus_scanner_service.service.VirusScanService;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class VersionServiceImpl implements VersionService {

    private static final int MAX_PAGE_SIZE = 100;

    private final FileVersionRepository versionRepository;
    private final FileAccessPolicy accessPolicy;
    private final FileRecordWriter recordWriter;
    private final CategoryPolicyRegistry policyRegistry;
    private final UploadValidator uploadValidator;
    private final VirusScanService virusScanService;
    private final MetadataExtractor metadataExtractor;
    private final ThumbnailGenerator thumbnailGenerator;
    private final ContentStore contentStore;
    private final AccessLogService accessLogService;
    private final RequestValidator requestValidator;
    private final Clock clock;

    @Override
    @Transactional(rollbackFor = Exception.class)
    public FileVersionResponse createVersion(UUID fileId, CreateVersionRequest request, AccessContext context)
            throws ItemNotFoundException, AccessDeniedException, FileValidationException, ConflictException, VirusScanException {

        requestValidator.validate(request);
        FileEntity file = accessPolicy.loadWritable(fileId, context);
        if (file.isDeleted()) {
            throw new ConflictException("Cannot create a version of a deleted file");
        }

        String newStorageKey = null;
        if (request.getContent() != null) {
            newStorageKey = applyNewContent(file, request);
        }

        BigDecimal previous = file.getVersion();
        BigDecimal next = request.getBump().apply(highestRecordedVersion(file));
        LocalDateTime now = LocalDateTime.now(clock);
        file.setVersion(next);
        file.setUpdatedAt(now);

        FileVersionEntity entry;
        try {
            FileEntity saved = recordWriter.save(file);
            entry = saveEntry(saved, next, request.getChangeType(), request.getChangeSummary(), context.getUserId(), now);
        } catch (ConflictException | RuntimeException e) {
            discardStoredContent(newStorageKey);
            throw e;
        }

        accessLogService.recordSuccess(fileId, context, AccessAction.VERSION_CREATE);
        log.info("Version {} created for file {} ({} -> {}, {})",
                next, fileId, previous, next, request.getChangeType());
        return toResponse(entry, next);
    }

    @Override
    @Transactional(readOnly = true)
    public VersionHistoryResponse listVersions(UUID fileId, int page, int size, AccessContext context)
            throws ItemNotFoundException, AccessDeniedException {

        FileEntity file = accessPolicy.loadReadable(fileId, context);
        int pageSize = Math.min(Math.max(size, 1), MAX_PAGE_SIZE);
        int pageNumber = Math.max(page, 0);

        Page<FileVersionEntity> versions = versionRepository.findByFileIdOrderByVersionDesc(
                fileId, PageRequest.of(pageNumber, pageSize));

        List<FileVersionResponse> items = versions.getContent().stream()
                .map(entry -> toResponse(entry, file.getVersion()))
                .toList();

        return VersionHistoryResponse.builder()
                .fileId(fileId)
                .currentVersion(file.getVersion())
                .versions(items)
                .page(pageNumber)
                .size(pageSize)
                .totalElements(versions.getTotalElements())
                .totalPages(versions.getTotalPages())
                .build();
    }

    @Override
    @Transactional(readOnly = true)
    public FileVersionResponse getVersion(UUID fileId, BigDecimal version, AccessContext context)
            throws ItemNotFoundException, AccessDeniedException {

        FileEntity file = accessPolicy.loadReadable(fileId, context);
        return toResponse(findEntry(fileId, version), file.getVersion());
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public VersionRestoreResponse restoreVersion(UUID fileId, RestoreVersionRequest request, AccessContext context)
            throws ItemNotFoundException, AccessDeniedException, FileValidationException, ConflictException {

        requestValidator.validate(request);
        FileEntity file = accessPolicy.loadWritable(fileId, context);
        if (file.isDeleted()) {
            throw new ConflictException("Cannot restore a version of a deleted file");
        }

        BigDecimal target = VersionBump.normalize(request.getTargetVersion());
        FileVersionEntity targetEntry = findEntry(fileId, target);
        BigDecimal previous = file.getVersion();
        if (target.compareTo(previous) == 0) {
            throw new ConflictException("File is already at version " + target);
        }

        boolean createBackup = request.getCreateBackup() != null
                ? request.getCreateBackup()
                : policyRegistry.policyFor(file.getCategory()).isAutoBackup();
        LocalDateTime now = LocalDateTime.now(clock);

        FileVersionEntity backup = null;
        if (createBackup) {
            BigDecimal backupVersion = VersionBump.PATCH.apply(highestRecordedVersion(file));
            backup = saveEntry(file, backupVersion, ChangeType.BACKUP,
                    "Backup of version " + previous + " before restoring version " + target,
                    context.getUserId(), now);
            log.info("Backup version {} recorded for file {} before restore", backupVersion, fileId);
        }

        VersionSnapshots.apply(targetEntry.getMetadataSnapshot(), file);
        file.setVersion(target);
        file.setUpdatedAt(now);
        recordWriter.save(file);

        accessLogService.recordSuccess(fileId, context, AccessAction.VERSION_RESTORE);
        log.info("File {} restored from version {} to version {}", fileId, previous, target);

        return VersionRestoreResponse.builder()
                .fileId(fileId)
                .previousVersion(previous)
                .restoredVersion(target)
                .backup(backup != null ? toResponse(backup, target) : null)
                .build();
    }

    @Override
    @Transactional(readOnly = true)
    public VersionDiffResponse compareVersions(UUID fileId, BigDecimal fromVersion, BigDecimal toVersion,
                                               AccessContext context)
            throws ItemNotFoundException, AccessDeniedException {

        accessPolicy.loadReadable(fileId, context);
        FileVersionEntity from = findEntry(fileId, fromVersion);
        FileVersionEntity to = findEntry(fileId, toVersion);

        return VersionDiffResponse.builder()
                .fileId(fileId)
                .fromVersion(from.getVersion())
                .toVersion(to.getVersion())
                .changes(diff(from.getMetadataSnapshot(), to.getMetadataSnapshot()))
                .build();
    }

    @Override
    public FileVersionEntity recordInitialVersion(FileEntity file, UUID actorId) {
        return versionRepository.save(FileVersionEntity.builder()
                .fileId(file.getFileId())
                .version(file.getVersion())
                .checksum(file.getChecksum())
                .fileSize(file.getFileSize())
                .storageKey(file.getStorageKey())
                .createdBy(actorId)
                .changeSummary("Initial upload")
                .changeType(ChangeType.CREATE)
                .metadataSnapshot(VersionSnapshots.capture(file))
                .createdAt(file.getUploadedAt() != null ? file.getUploadedAt() : LocalDateTime.now(clock))
                .build());
    }

    private String applyNewContent(FileEntity file, CreateVersionRequest request)
            throws FileValidationException, VirusScanException {

        byte[] content = request.getContent();
        String mimeType = request.getMimeType() != null ? MimeTypes.normalize(request.getMimeType()) : file.getMimeType();
        CategoryPolicy policy = policyRegistry.policyFor(file.getCategory());

        uploadValidator.validate(content, file.getOriginalName(), mimeType, content.length, policy)
                .throwIfRejected();

        VirusScanStatus scanStatus = VirusScanStatus.SKIPPED;
        if (policy.isVirusScanning()) {
            VirusScanResult scan = virusScanService.scanFileContent(content, file.getOriginalName());
            if (scan.isInfected()) {
                throw new FileValidationException(ValidationFailure.MALICIOUS_CONTENT, scan.getMessage());
            }
            scanStatus = scan.getStatus();
        }

        String storageKey = contentStore.store(content, file.getCategory(), file.getFileId(), file.getOriginalName());
        file.setStorageKey(storageKey);
        file.setChecksum(contentStore.checksum(content));
        file.setFileSize((long) content.length);
        file.setMimeType(mimeType);
        file.setScanStatus(scanStatus);
        if (policy.isExtractMetadata()) {
            file.setExtractedMetadata(metadataExtractor.extract(content, mimeType));
        }
        file.setThumbnailKey(storeThumbnail(content, mimeType, storageKey, policy));
        return storageKey;
    }

    // The previous revision keeps its own thumbnail for restores
    private String storeThumbnail(byte[] content, String mimeType, String storageKey, CategoryPolicy policy) {
        if (!policy.isGenerateThumbnails()) {
            return null;
        }
        try {
            return thumbnailGenerator.generate(content, mimeType)
                    .map(thumbnail -> contentStore.storeThumbnail(storageKey, thumbnail))
                    .orElse(null);
        } catch (StorageException e) {
            log.warn("Thumbnail for {} could not be stored: {}", storageKey, e.getMessage());
            return null;
        }
    }

    // Labels are never reused, so the base is the newest entry even when a restore moved the live version back
    private BigDecimal highestRecordedVersion(FileEntity file) {
        BigDecimal current = file.getVersion();
        return versionRepository.findTopByFileIdOrderByVersionDesc(file.getFileId())
                .map(FileVersionEntity::getVersion)
                .filter(highest -> highest.compareTo(current) > 0)
                .orElse(current);
    }

    private FileVersionEntity saveEntry(FileEntity file, BigDecimal version, ChangeType changeType,
                                        String changeSummary, UUID actorId, LocalDateTime now) throws ConflictException {
        try {
            return versionRepository.saveAndFlush(FileVersionEntity.builder()
                    .fileId(file.getFileId())
                    .version(version)
                    .checksum(file.getChecksum())
                    .fileSize(file.getFileSize())
                    .storageKey(file.getStorageKey())
                    .createdBy(actorId)
                    .changeSummary(changeSummary)
                    .changeType(changeType)
                    .metadataSnapshot(VersionSnapshots.capture(file))
                    .createdAt(now)
                    .build());
        } catch (DataIntegrityViolationException e) {
            throw new ConflictException("Version " + version + " already exists for file " + file.getFileId(), e);
        }
    }

    private FileVersionEntity findEntry(UUID fileId, BigDecimal version) throws ItemNotFoundException {
        if (version == null) {
            throw new ItemNotFoundException("Version not found");
        }
        BigDecimal normalized = VersionBump.normalize(version);
        return versionRepository.findByFileIdAndVersion(fileId, normalized)
                .orElseThrow(() -> new ItemNotFoundException("Version " + normalized + " not found"));
    }

    private void discardStoredContent(String storageKey) {
        if (storageKey == null) {
            return;
        }
        try {
            contentStore.delete(storageKey);
            contentStore.delete(contentStore.thumbnailKeyFor(storageKey));
        } catch (RuntimeException e) {
            log.warn("Could not remove orphaned content {}: {}", storageKey, e.getMessage());
        }
    }

    static List<VersionDiffResponse.FieldChange> diff(Map<String, Object> from, Map<String, Object> to) {
        Set<String> keys = new LinkedHashSet<>(from.keySet());
        keys.addAll(to.keySet());

        List<VersionDiffResponse.FieldChange> changes = new ArrayList<>();
        for (String key : keys) {
            Object oldValue = from.get(key);
            Object newValue = to.get(key);
            VersionDiffResponse.DiffType type;
            if (oldValue == null && newValue == null) {
                continue;
            } else if (oldValue == null) {
                type = VersionDiffResponse.DiffType.ADDED;
            } else if (newValue == null) {
                type = VersionDiffResponse.DiffType.REMOVED;
            } else if (!sameValue(oldValue, newValue)) {
                type = VersionDiffResponse.DiffType.CHANGED;
            } else {
                continue;
            }
            changes.add(VersionDiffResponse.FieldChange.builder()
                    .field(key)
                    .type(type)
                    .oldValue(oldValue)
                    .newValue(newValue)
                    .build());
        }
        return changes;
    }

    // JSON round-trips turn longs into ints, so numbers compare by value
    private static boolean sameValue(Object a, Object b) {
        if (a instanceof Number && b instanceof Number) {
            return new BigDecimal(a.toString()).compareTo(new BigDecimal(b.toString())) == 0;
        }
        return Objects.equals(a, b);
    }

    private FileVersionResponse toResponse(FileVersionEntity entry, BigDecimal liveVersion) {
        return FileVersionResponse.builder()
                .versionId(entry.getVersionId())
                .fileId(entry.getFileId())
                .version(entry.getVersion())
                .checksum(entry.getChecksum())
                .size(entry.getFileSize())
                .createdBy(entry.getCreatedBy())
                .changeSummary(entry.getChangeSummary())
                .changeType(entry.getChangeType())
                .metadataSnapshot(entry.getMetadataSnapshot())
                .current(liveVersion != null && entry.getVersion().compareTo(liveVersion) == 0)
                .createdAt(entry.getCreatedAt())
                .build();
    }
}
