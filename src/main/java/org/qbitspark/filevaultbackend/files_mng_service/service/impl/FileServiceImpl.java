package org.qbitspark.filevaultbackend.files_mng_service.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.qbitspark.filevaultbackend.audit_service.entity.FileAccessLogEntity;
import org.qbitspark.filevaultbackend.audit_service.enums.AccessAction;
import org.qbitspark.filevaultbackend.audit_service.payload.AccessLogResponse;
import org.qbitspark.filevaultbackend.audit_service.service.AccessLogService;
import org.qbitspark.filevaultbackend.files_mng_service.entity.FileEntity;
import org.qbitspark.filevaultbackend.files_mng_service.enums.FileCategory;
import org.qbitspark.filevaultbackend.files_mng_service.enums.FileVisibility;
import org.qbitspark.filevaultbackend.files_mng_service.enums.TagOperation;
import org.qbitspark.filevaultbackend.files_mng_service.enums.VirusScanStatus;
import org.qbitspark.filevaultbackend.files_mng_service.payload.FileDownload;
import org.qbitspark.filevaultbackend.files_mng_service.payload.FileListResponse;
import org.qbitspark.filevaultbackend.files_mng_service.payload.FileResponse;
import org.qbitspark.filevaultbackend.files_mng_service.payload.FileSearchCriteria;
import org.qbitspark.filevaultbackend.files_mng_service.payload.FileStreamChunk;
import org.qbitspark.filevaultbackend.files_mng_service.payload.UpdateFileRequest;
import org.qbitspark.filevaultbackend.files_mng_service.payload.UploadFileRequest;
import org.qbitspark.filevaultbackend.files_mng_service.repo.FileRepository;
import org.qbitspark.filevaultbackend.files_mng_service.service.FileAccessPolicy;
import org.qbitspark.filevaultbackend.files_mng_service.service.FilePurger;
import org.qbitspark.filevaultbackend.files_mng_service.service.FileRecordWriter;
import org.qbitspark.filevaultbackend.files_mng_service.service.FileService;
import org.qbitspark.filevaultbackend.files_mng_service.service.FileSpecifications;
import org.qbitspark.filevaultbackend.files_mng_service.service.MetadataExtractor;
import org.qbitspark.filevaultbackend.files_mng_service.service.ThumbnailGenerator;
import org.qbitspark.filevaultbackend.globe_utils.FileSizeFormatter;
import org.qbitspark.filevaultbackend.globe_utils.MimeTypes;
import org.qbitspark.filevaultbackend.globe_utils.RequestValidator;
import org.qbitspark.filevaultbackend.globeadvice.exceptions.AccessDeniedException;
import org.qbitspark.filevaultbackend.globeadvice.exceptions.ConflictException;
import org.qbitspark.filevaultbackend.globeadvice.exceptions.FileValidationException;
import org.qbitspark.filevaultbackend.globeadvice.exceptions.IntegrityException;
import org.qbitspark.filevaultbackend.globeadvice.exceptions.ItemNotFoundException;
import org.qbitspark.filevaultbackend.globeadvice.exceptions.StorageException;
import org.qbitspark.filevaultbackend.globeadvice.exceptions.VirusScanException;
import org.qbitspark.filevaultbackend.globesecurity.AccessContext;
import org.qbitspark.filevaultbackend.sharing_service.repo.ShareTokenRepository;
import org.qbitspark.filevaultbackend.storage_service.service.ContentStore;
import org.qbitspark.filevaultbackend.upload_validation_service.enums.ValidationFailure;
import org.qbitspark.filevaultbackend.upload_validation_service.payload.CategoryPolicy;
import org.qbitspark.filevaultbackend.upload_validation_service.service.CategoryPolicyRegistry;
import org.qbitspark.filevaultbackend.upload_validation_service.service.UploadValidator;
import org.qbitspark.filevaultbackend.versioning_service.enums.VersionBump;
import org.qbitspark.filevaultbackend.versioning_service.service.VersionService;
import org.qbitspark.filevaultbackend.virus_scanner_service.payload.VirusScanResult;
import org.qbitspark.filevaultbackend.virus_scanner_service.service.VirusScanService;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;

@Service
@RequiredArgsConstructor
@Slf4j
public class FileServiceImpl implements FileService {

    private static final int MAX_PAGE_SIZE = 100;
    private static final int MAX_TAGS = 50;
    private static final Pattern TAG_PATTERN = Pattern.compile("[A-Za-z0-9_-]{1,50}");
    private static final Set<String> STREAMABLE_TYPES = Set.of(
            "video/mp4", "video/webm", "audio/mp3", "audio/wav", "audio/ogg");

    private final FileRepository fileRepository;
    private final ShareTokenRepository shareTokenRepository;
    private final FileAccessPolicy accessPolicy;
    private final FileRecordWriter recordWriter;
    private final FilePurger filePurger;
    private final CategoryPolicyRegistry policyRegistry;
    private final UploadValidator uploadValidator;
    private final VirusScanService virusScanService;
    private final MetadataExtractor metadataExtractor;
    private final ThumbnailGenerator thumbnailGenerator;
    private final ContentStore contentStore;
    private final VersionService versionService;
    private final AccessLogService accessLogService;
    private final RequestValidator requestValidator;
    private final Clock clock;

    @Override
    @Transactional(rollbackFor = Exception.class)
    public FileResponse upload(UploadFileRequest request, AccessContext context)
            throws FileValidationException, AccessDeniedException, VirusScanException {

        accessPolicy.requireAuthenticated(context);
        try {
            requestValidator.validate(request);
            validateTags(request.getTags());
        } catch (FileValidationException e) {
            accessLogService.recordFailure(null, context, AccessAction.UPLOAD, e.getMessage());
            throw e;
        }

        byte[] content = request.getContent();
        String mimeType = MimeTypes.normalize(request.getMimeType());
        CategoryPolicy policy = policyRegistry.policyFor(request.getCategory());
        log.info("Upload requested: {} ({} bytes, {}) by user: {}",
                request.getOriginalName(), content.length, request.getCategory(), context.getUserId());

        VirusScanStatus scanStatus;
        try {
            uploadValidator.validate(content, request.getOriginalName(), mimeType, content.length, policy)
                    .throwIfRejected();
            scanStatus = scan(content, request.getOriginalName(), policy);
        } catch (FileValidationException | VirusScanException e) {
            accessLogService.recordFailure(null, context, AccessAction.UPLOAD, e.getMessage());
            throw e;
        }

        UUID fileId = UUID.randomUUID();
        String checksum = contentStore.checksum(content);
        String storageKey = contentStore.store(content, request.getCategory(), fileId, request.getOriginalName());
        Map<String, Object> metadata = policy.isExtractMetadata()
                ? metadataExtractor.extract(content, mimeType)
                : new HashMap<>();
        String thumbnailKey = storeThumbnail(content, mimeType, storageKey, policy);

        LocalDateTime now = LocalDateTime.now(clock);
        FileEntity file = FileEntity.builder()
                .fileId(fileId)
                .originalName(request.getOriginalName())
                .storageKey(storageKey)
                .mimeType(mimeType)
                .fileSize((long) content.length)
                .checksum(checksum)
                .thumbnailKey(thumbnailKey)
                .category(request.getCategory())
                .ownerId(context.getUserId())
                .visibility(request.getVisibility() != null ? request.getVisibility() : FileVisibility.PRIVATE)
                .tags(request.getTags() != null ? new HashSet<>(request.getTags()) : new HashSet<>())
                .description(request.getDescription())
                .version(VersionBump.INITIAL)
                .scanStatus(scanStatus)
                .extractedMetadata(metadata)
                .uploadedAt(now)
                .updatedAt(now)
                .expiresAt(request.getExpiresAt())
                .build();

        FileEntity saved = persistNewRecord(file, context);

        accessLogService.recordSuccess(fileId, context, AccessAction.UPLOAD);
        log.info("File uploaded: {} ({}) stored as {}", saved.getOriginalName(), fileId, storageKey);
        return toResponse(saved);
    }

    @Override
    public FileResponse getFile(UUID fileId, AccessContext context) throws ItemNotFoundException, AccessDeniedException {

        FileEntity file = accessPolicy.loadReadable(fileId, context);
        LocalDateTime now = LocalDateTime.now(clock);
        fileRepository.touchLastAccessed(fileId, now);
        // response copy only; the column is written by touchLastAccessed
        file.setLastAccessed(now);

        accessLogService.recordSuccess(fileId, context, AccessAction.VIEW);
        return toResponse(file);
    }

    @Override
    public FileDownload download(UUID fileId, AccessContext context) throws ItemNotFoundException, AccessDeniedException {

        FileEntity file = accessPolicy.loadReadable(fileId, context);

        byte[] content;
        try {
            content = contentStore.retrieve(file.getStorageKey(), file.getChecksum());
        } catch (IntegrityException e) {
            accessLogService.recordFailure(fileId, context, AccessAction.DOWNLOAD, "Integrity check failed");
            throw e;
        }

        fileRepository.recordDownload(fileId, LocalDateTime.now(clock));
        accessLogService.recordSuccess(fileId, context, AccessAction.DOWNLOAD);
        log.info("File download: {} ({}) by user: {}", file.getOriginalName(), fileId, userIdOf(context));

        return FileDownload.builder()
                .fileId(fileId)
                .fileName(file.getOriginalName())
                .mimeType(file.getMimeType())
                .size(content.length)
                .checksum(file.getChecksum())
                .content(content)
                .build();
    }

    @Override
    public FileStreamChunk stream(UUID fileId, Long start, Long end, AccessContext context)
            throws ItemNotFoundException, AccessDeniedException, FileValidationException {

        FileEntity file = accessPolicy.loadReadable(fileId, context);
        if (!STREAMABLE_TYPES.contains(MimeTypes.normalize(file.getMimeType()))) {
            throw new FileValidationException(ValidationFailure.NOT_STREAMABLE,
                    "File type " + file.getMimeType() + " is not streamable");
        }

        long totalSize = file.getFileSize();
        long first = start != null ? start : 0L;
        long last = end != null ? Math.min(end, totalSize - 1) : totalSize - 1;
        if (first < 0 || first >= totalSize || last < first) {
            throw new FileValidationException(ValidationFailure.INVALID_RANGE,
                    "Range " + first + "-" + (end != null ? end : "") + " not satisfiable for " + totalSize + " bytes");
        }

        byte[] content;
        try {
            content = contentStore.retrieve(file.getStorageKey(), file.getChecksum());
        } catch (IntegrityException e) {
            accessLogService.recordFailure(fileId, context, AccessAction.STREAM, "Integrity check failed");
            throw e;
        }

        LocalDateTime now = LocalDateTime.now(clock);
        fileRepository.touchLastAccessed(fileId, now);
        accessLogService.recordSuccess(fileId, context, AccessAction.STREAM);
        log.debug("Streaming bytes {}-{}/{} of file {}", first, last, totalSize, fileId);

        return FileStreamChunk.builder()
                .fileId(fileId)
                .mimeType(file.getMimeType())
                .start(first)
                .end(last)
                .totalSize(totalSize)
                .content(Arrays.copyOfRange(content, (int) first, (int) last + 1))
                .build();
    }

    @Override
    public FileDownload getThumbnail(UUID fileId, AccessContext context) throws ItemNotFoundException, AccessDeniedException {

        FileEntity file = accessPolicy.loadReadable(fileId, context);
        if (file.getThumbnailKey() == null) {
            throw new ItemNotFoundException("No thumbnail available for file " + fileId);
        }

        byte[] thumbnail;
        try {
            thumbnail = contentStore.retrieveThumbnail(file.getThumbnailKey());
        } catch (StorageException.ObjectNotFoundException e) {
            log.warn("Thumbnail {} of file {} is missing from storage", file.getThumbnailKey(), fileId);
            throw new ItemNotFoundException("No thumbnail available for file " + fileId);
        }

        accessLogService.recordSuccess(fileId, context, AccessAction.THUMBNAIL);
        return FileDownload.builder()
                .fileId(fileId)
                .fileName(thumbnailNameOf(file.getOriginalName()))
                .mimeType("image/jpeg")
                .size(thumbnail.length)
                .checksum(contentStore.checksum(thumbnail))
                .content(thumbnail)
                .build();
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public FileResponse updateFile(UUID fileId, UpdateFileRequest request, AccessContext context)
            throws ItemNotFoundException, AccessDeniedException, FileValidationException, ConflictException {

        requestValidator.validate(request);
        FileEntity file = accessPolicy.loadWritable(fileId, context);
        requireActive(file, "update");

        if (request.getOriginalName() != null) {
            uploadValidator.validateFileName(request.getOriginalName()).throwIfRejected();
            file.setOriginalName(request.getOriginalName());
        }
        if (request.getDescription() != null) {
            file.setDescription(request.getDescription());
        }
        if (request.getVisibility() != null) {
            file.setVisibility(request.getVisibility());
        }
        if (request.getTags() != null) {
            validateTags(request.getTags());
            file.setTags(new HashSet<>(request.getTags()));
        }
        if (request.isClearExpiry()) {
            file.setExpiresAt(null);
        } else if (request.getExpiresAt() != null) {
            file.setExpiresAt(request.getExpiresAt());
        }
        file.setUpdatedAt(LocalDateTime.now(clock));

        FileEntity saved = recordWriter.save(file);
        accessLogService.recordSuccess(fileId, context, AccessAction.UPDATE);
        log.info("File updated: {} ({})", saved.getOriginalName(), fileId);
        return toResponse(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public FileListResponse listFiles(FileSearchCriteria criteria, AccessContext context) {

        FileSearchCriteria search = criteria != null ? criteria : FileSearchCriteria.builder().build();
        boolean privileged = context != null && context.isPrivileged();
        int pageSize = Math.min(Math.max(search.getSize(), 1), MAX_PAGE_SIZE);
        int pageNumber = Math.max(search.getPage(), 0);

        Specification<FileEntity> spec = Specification.where(null);
        if (!privileged) {
            spec = spec.and(FileSpecifications.ownedByOrPublic(userIdOf(context)));
        }
        if (!(privileged && search.isIncludeDeleted())) {
            spec = spec.and(FileSpecifications.notDeleted());
        }
        if (search.getCategory() != null) {
            spec = spec.and(FileSpecifications.inCategory(search.getCategory()));
        }
        if (search.getVisibility() != null) {
            spec = spec.and(FileSpecifications.withVisibility(search.getVisibility()));
        }
        if (search.getTag() != null && !search.getTag().isBlank()) {
            spec = spec.and(FileSpecifications.taggedWith(search.getTag().trim()));
        }
        if (search.getQuery() != null && !search.getQuery().isBlank()) {
            spec = spec.and(FileSpecifications.matchesText(search.getQuery()));
        }

        Page<FileEntity> page = fileRepository.findAll(spec,
                PageRequest.of(pageNumber, pageSize, Sort.by(Sort.Direction.DESC, "uploadedAt")));

        return FileListResponse.builder()
                .files(page.getContent().stream().map(this::toResponse).toList())
                .pagination(FileListResponse.PaginationInfo.builder()
                        .page(pageNumber)
                        .size(pageSize)
                        .totalElements(page.getTotalElements())
                        .totalPages(page.getTotalPages())
                        .hasNext(page.hasNext())
                        .hasPrevious(page.hasPrevious())
                        .build())
                .build();
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public void softDeleteFile(UUID fileId, AccessContext context)
            throws ItemNotFoundException, AccessDeniedException, ConflictException {

        FileEntity file = accessPolicy.loadWritable(fileId, context);
        if (file.isDeleted()) {
            throw new ConflictException("File already deleted");
        }

        LocalDateTime now = LocalDateTime.now(clock);
        file.setDeleted(true);
        file.setDeletedAt(now);
        file.setDeletedBy(userIdOf(context));
        file.setUpdatedAt(now);
        recordWriter.save(file);

        int revoked = shareTokenRepository.deactivateAllForFile(fileId);
        accessLogService.recordSuccess(fileId, context, AccessAction.DELETE);
        log.info("File moved to trash: {} ({}), {} active shares deactivated", file.getOriginalName(), fileId, revoked);
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public FileResponse restoreDeletedFile(UUID fileId, AccessContext context)
            throws ItemNotFoundException, AccessDeniedException, ConflictException {

        FileEntity file = accessPolicy.loadWritable(fileId, context);
        if (!file.isDeleted()) {
            throw new ConflictException("File is not deleted");
        }

        file.setDeleted(false);
        file.setDeletedAt(null);
        file.setDeletedBy(null);
        file.setUpdatedAt(LocalDateTime.now(clock));
        FileEntity saved = recordWriter.save(file);

        accessLogService.recordSuccess(fileId, context, AccessAction.RESTORE);
        log.info("File restored from trash: {} ({})", saved.getOriginalName(), fileId);
        return toResponse(saved);
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public void purgeFile(UUID fileId, AccessContext context) throws ItemNotFoundException, AccessDeniedException {

        accessPolicy.requirePrivileged(context, "Permanent deletion");
        FileEntity file = accessPolicy.loadVisible(fileId, context);
        filePurger.purge(file);
        log.info("File permanently deleted by user {}: {}", userIdOf(context), fileId);
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public FileResponse applyTags(UUID fileId, TagOperation operation, Collection<String> tags, AccessContext context)
            throws ItemNotFoundException, AccessDeniedException, FileValidationException, ConflictException {

        if (operation == null) {
            throw new FileValidationException(ValidationFailure.INVALID_REQUEST, "Tag operation is required");
        }
        Collection<String> requested = tags != null ? tags : List.of();
        validateTagFormat(requested);

        FileEntity file = accessPolicy.loadWritable(fileId, context);
        requireActive(file, "tag");

        Set<String> result = new LinkedHashSet<>(file.getTags());
        switch (operation) {
            case ADD -> result.addAll(requested);
            case REMOVE -> result.removeAll(requested);
            case REPLACE -> {
                result.clear();
                result.addAll(requested);
            }
        }
        if (result.size() > MAX_TAGS) {
            throw new FileValidationException(ValidationFailure.INVALID_REQUEST,
                    "A file can carry at most " + MAX_TAGS + " tags");
        }

        file.setTags(new HashSet<>(result));
        file.setUpdatedAt(LocalDateTime.now(clock));
        FileEntity saved = recordWriter.save(file);

        accessLogService.recordSuccess(fileId, context, AccessAction.TAG);
        log.debug("Tags {} on file {}: {}", operation, fileId, result);
        return toResponse(saved);
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public FileResponse changeCategory(UUID fileId, FileCategory category, AccessContext context)
            throws ItemNotFoundException, AccessDeniedException, FileValidationException, ConflictException {

        if (category == null) {
            throw new FileValidationException(ValidationFailure.INVALID_REQUEST, "Target category is required");
        }
        FileEntity file = accessPolicy.loadWritable(fileId, context);
        requireActive(file, "move");
        if (file.getCategory() == category) {
            throw new ConflictException("File is already in category " + category);
        }
        requireAcceptedBy(file, category);

        FileCategory previous = file.getCategory();
        file.setCategory(category);
        file.setUpdatedAt(LocalDateTime.now(clock));
        FileEntity saved = recordWriter.save(file);

        accessLogService.recordSuccess(fileId, context, AccessAction.MOVE);
        log.info("File moved: {} ({}) {} -> {}", saved.getOriginalName(), fileId, previous, category);
        return toResponse(saved);
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public FileResponse copyFile(UUID fileId, FileCategory targetCategory, AccessContext context)
            throws ItemNotFoundException, AccessDeniedException, FileValidationException, ConflictException {

        accessPolicy.requireAuthenticated(context);
        FileEntity source = accessPolicy.loadReadable(fileId, context);
        requireActive(source, "copy");

        FileCategory category = targetCategory != null ? targetCategory : source.getCategory();
        requireAcceptedBy(source, category);

        byte[] content = contentStore.retrieve(source.getStorageKey(), source.getChecksum());

        UUID copyId = UUID.randomUUID();
        String storageKey = contentStore.store(content, category, copyId, source.getOriginalName());
        String thumbnailKey = storeThumbnail(content, source.getMimeType(), storageKey, policyRegistry.policyFor(category));
        LocalDateTime now = LocalDateTime.now(clock);
        FileEntity copy = FileEntity.builder()
                .fileId(copyId)
                .originalName(source.getOriginalName())
                .storageKey(storageKey)
                .mimeType(source.getMimeType())
                .fileSize(source.getFileSize())
                .checksum(source.getChecksum())
                .thumbnailKey(thumbnailKey)
                .category(category)
                .ownerId(context.getUserId())
                .visibility(FileVisibility.PRIVATE)
                .tags(new HashSet<>(source.getTags()))
                .description(source.getDescription())
                .version(VersionBump.INITIAL)
                .scanStatus(source.getScanStatus())
                .extractedMetadata(new HashMap<>(source.getExtractedMetadata()))
                .uploadedAt(now)
                .updatedAt(now)
                .build();

        FileEntity saved = persistNewRecord(copy, context);

        accessLogService.recordSuccess(fileId, context, AccessAction.COPY);
        log.info("File copied: {} ({}) -> {} in {}", source.getOriginalName(), fileId, copyId, category);
        return toResponse(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public AccessLogResponse getAccessLog(UUID fileId, int page, int size, AccessContext context)
            throws ItemNotFoundException, AccessDeniedException {

        FileEntity file = accessPolicy.loadWritable(fileId, context);
        int pageSize = Math.min(Math.max(size, 1), MAX_PAGE_SIZE);
        int pageNumber = Math.max(page, 0);

        Page<FileAccessLogEntity> entries = accessLogService.findForFile(file.getFileId(),
                PageRequest.of(pageNumber, pageSize));

        return AccessLogResponse.builder()
                .fileId(fileId)
                .entries(entries.getContent().stream()
                        .map(entry -> AccessLogResponse.Entry.builder()
                                .actorId(entry.getActorId())
                                .action(entry.getAction())
                                .outcome(entry.getOutcome())
                                .errorMessage(entry.getErrorMessage())
                                .ipAddress(entry.getIpAddress())
                                .userAgent(entry.getUserAgent())
                                .timestamp(entry.getTimestamp())
                                .build())
                        .toList())
                .currentPage(pageNumber)
                .pageSize(pageSize)
                .totalElements(entries.getTotalElements())
                .totalPages(entries.getTotalPages())
                .build();
    }

    // Bytes are already stored; they are removed again if the record cannot be written
    private FileEntity persistNewRecord(FileEntity file, AccessContext context) {
        try {
            FileEntity saved = fileRepository.saveAndFlush(file);
            versionService.recordInitialVersion(saved, context.getUserId());
            return saved;
        } catch (RuntimeException e) {
            log.error("Failed to save file record {}, removing stored content {}", file.getFileId(), file.getStorageKey(), e);
            try {
                contentStore.delete(file.getStorageKey());
                if (file.getThumbnailKey() != null) {
                    contentStore.delete(file.getThumbnailKey());
                }
            } catch (RuntimeException cleanupFailure) {
                e.addSuppressed(cleanupFailure);
            }
            throw e;
        }
    }

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

    private static String thumbnailNameOf(String originalName) {
        int dot = originalName.lastIndexOf('.');
        return (dot > 0 ? originalName.substring(0, dot) : originalName) + "_thumb.jpg";
    }

    private VirusScanStatus scan(byte[] content, String fileName, CategoryPolicy policy)
            throws FileValidationException, VirusScanException {
        if (!policy.isVirusScanning()) {
            return VirusScanStatus.SKIPPED;
        }
        VirusScanResult result = virusScanService.scanFileContent(content, fileName);
        if (result.isInfected()) {
            throw new FileValidationException(ValidationFailure.MALICIOUS_CONTENT, "File rejected: " + result.getMessage());
        }
        return result.getStatus();
    }

    private void requireAcceptedBy(FileEntity file, FileCategory category) throws FileValidationException {
        CategoryPolicy policy = policyRegistry.policyFor(category);
        if (!policy.allowsType(file.getMimeType())) {
            throw new FileValidationException(ValidationFailure.TYPE_NOT_ALLOWED,
                    "File type " + file.getMimeType() + " not allowed in category " + category);
        }
        if (file.getFileSize() > policy.getMaxSize()) {
            throw new FileValidationException(ValidationFailure.FILE_TOO_LARGE,
                    "File size exceeds limit of category " + category);
        }
    }

    private static void requireActive(FileEntity file, String operation) throws ConflictException {
        if (file.isDeleted()) {
            throw new ConflictException("Cannot " + operation + " deleted file");
        }
    }

    private static void validateTags(Collection<String> tags) throws FileValidationException {
        if (tags == null) {
            return;
        }
        validateTagFormat(tags);
        if (new HashSet<>(tags).size() > MAX_TAGS) {
            throw new FileValidationException(ValidationFailure.INVALID_REQUEST,
                    "A file can carry at most " + MAX_TAGS + " tags");
        }
    }

    private static void validateTagFormat(Collection<String> tags) throws FileValidationException {
        List<String> invalid = new ArrayList<>();
        for (String tag : tags) {
            if (tag == null || !TAG_PATTERN.matcher(tag).matches()) {
                invalid.add(String.valueOf(tag));
            }
        }
        if (!invalid.isEmpty()) {
            throw new FileValidationException(ValidationFailure.INVALID_REQUEST, "Invalid tags: " + invalid);
        }
    }

    private static UUID userIdOf(AccessContext context) {
        return context != null ? context.getUserId() : null;
    }

    private FileResponse toResponse(FileEntity file) {
        List<String> tags = new ArrayList<>(file.getTags());
        tags.sort(null);
        return FileResponse.builder()
                .id(file.getFileId())
                .name(file.getOriginalName())
                .mimeType(file.getMimeType())
                .size(file.getFileSize())
                .sizeFormatted(FileSizeFormatter.format(file.getFileSize()))
                .checksum(file.getChecksum())
                .category(file.getCategory())
                .ownerId(file.getOwnerId())
                .visibility(file.getVisibility())
                .tags(tags)
                .description(file.getDescription())
                .version(file.getVersion())
                .scanStatus(file.getScanStatus())
                .metadata(file.getExtractedMetadata())
                .thumbnailAvailable(file.getThumbnailKey() != null)
                .downloadCount(file.getDownloadCount() != null ? file.getDownloadCount() : 0L)
                .deleted(file.isDeleted())
                .deletedAt(file.getDeletedAt())
                .lastAccessed(file.getLastAccessed())
                .expiresAt(file.getExpiresAt())
                .uploadedAt(file.getUploadedAt())
                .updatedAt(file.getUpdatedAt())
                .build();
    }
}
