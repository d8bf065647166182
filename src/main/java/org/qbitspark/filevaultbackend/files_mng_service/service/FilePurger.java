package org.qbitspark.filevaultbackend.files_mng_service.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.qbitspark.filevaultbackend.audit_service.service.AccessLogService;
import org.qbitspark.filevaultbackend.files_mng_service.entity.FileEntity;
import org.qbitspark.filevaultbackend.files_mng_service.repo.FileRepository;
import org.qbitspark.filevaultbackend.sharing_service.repo.ShareTokenRepository;
import org.qbitspark.filevaultbackend.storage_service.service.ContentStore;
import org.qbitspark.filevaultbackend.versioning_service.repo.FileVersionRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

/**
 * Irreversibly removes a file: versions, shares, access logs and the record, then the bytes of
 * every stored revision and their thumbnails.
 * <p>
 * Bytes are only removed once the row deletes have committed. A rolled-back purge therefore
 * leaves the file fully readable; a failure after commit can at worst leave orphaned objects.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FilePurger {

    private final FileRepository fileRepository;
    private final FileVersionRepository versionRepository;
    private final ShareTokenRepository shareTokenRepository;
    private final AccessLogService accessLogService;
    private final ContentStore contentStore;

    @Transactional(rollbackFor = Exception.class)
    public void purge(FileEntity file) {
        UUID fileId = file.getFileId();

        Set<String> storageKeys = new LinkedHashSet<>();
        storageKeys.add(file.getStorageKey());
        storageKeys.addAll(versionRepository.findStorageKeysByFileId(fileId));

        Set<String> objectKeys = new LinkedHashSet<>(storageKeys);
        storageKeys.forEach(key -> objectKeys.add(contentStore.thumbnailKeyFor(key)));

        int versions = versionRepository.deleteByFileId(fileId);
        long shares = shareTokenRepository.deleteByFileId(fileId);
        accessLogService.deleteForFile(fileId);
        fileRepository.delete(file);

        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    deleteObjects(fileId, objectKeys);
                }
            });
        } else {
            deleteObjects(fileId, objectKeys);
        }

        log.info("File purged: {} ({}) - {} revisions, {} versions, {} shares removed",
                file.getOriginalName(), fileId, storageKeys.size(), versions, shares);
    }

    private void deleteObjects(UUID fileId, Set<String> objectKeys) {
        for (String key : objectKeys) {
            try {
                contentStore.delete(key);
            } catch (RuntimeException e) {
                log.warn("Purged file {} left object {} behind: {}", fileId, key, e.getMessage());
            }
        }
    }
}
