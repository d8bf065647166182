package org.qbitspark.filevaultbackend.maintenance_service.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.qbitspark.filevaultbackend.audit_service.enums.AccessAction;
import org.qbitspark.filevaultbackend.audit_service.service.AccessLogService;
import org.qbitspark.filevaultbackend.files_mng_service.config.FileVaultProperties;
import org.qbitspark.filevaultbackend.files_mng_service.entity.FileEntity;
import org.qbitspark.filevaultbackend.files_mng_service.repo.FileRepository;
import org.qbitspark.filevaultbackend.files_mng_service.service.FilePurger;
import org.qbitspark.filevaultbackend.files_mng_service.service.FileRecordWriter;
import org.qbitspark.filevaultbackend.files_mng_service.service.StorageStatsService;
import org.qbitspark.filevaultbackend.globeadvice.exceptions.ConflictException;
import org.qbitspark.filevaultbackend.globesecurity.AccessContext;
import org.qbitspark.filevaultbackend.maintenance_service.service.FileMaintenanceService;
import org.qbitspark.filevaultbackend.sharing_service.repo.ShareTokenRepository;
import org.qbitspark.filevaultbackend.sharing_service.service.ShareService;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class FileMaintenanceServiceImpl implements FileMaintenanceService {

    private final FileRepository fileRepository;
    private final ShareTokenRepository shareTokenRepository;
    private final ShareService shareService;
    private final FileRecordWriter recordWriter;
    private final FilePurger filePurger;
    private final StorageStatsService storageStatsService;
    private final AccessLogService accessLogService;
    private final FileVaultProperties properties;
    private final Clock clock;

    @Override
    public int deactivateExpiredShares() {
        return shareService.deactivateExpiredShares();
    }

    @Override
    public int softDeleteExpiredFiles() {
        LocalDateTime now = LocalDateTime.now(clock);
        List<FileEntity> expired = fileRepository.findByDeletedFalseAndExpiresAtBefore(now);

        int deleted = 0;
        for (FileEntity file : expired) {
            try {
                file.setDeleted(true);
                file.setDeletedAt(now);
                file.setDeletedBy(null);
                file.setUpdatedAt(now);
                recordWriter.save(file);

                shareTokenRepository.deactivateAllForFile(file.getFileId());
                accessLogService.recordSuccess(file.getFileId(), AccessContext.system(), AccessAction.DELETE);
                deleted++;
            } catch (ConflictException e) {
                // Picked up again on the next sweep if still expired
                log.warn("Skipped expiring file {}: {}", file.getFileId(), e.getMessage());
            } catch (RuntimeException e) {
                log.error("Failed to expire file {}: {}", file.getFileId(), e.getMessage(), e);
            }
        }

        if (deleted > 0) {
            log.info("Expiry sweep moved {} file(s) to trash", deleted);
        }
        return deleted;
    }

    @Override
    public int purgeRetainedDeletions() {
        LocalDateTime cutoff = LocalDateTime.now(clock).minusDays(properties.getRetentionDays());
        List<FileEntity> candidates = fileRepository.findByDeletedTrueAndDeletedAtBefore(cutoff);

        int purged = 0;
        for (FileEntity file : candidates) {
            try {
                filePurger.purge(file);
                purged++;
            } catch (RuntimeException e) {
                log.error("Failed to purge file {} ({}): {}",
                        file.getOriginalName(), file.getFileId(), e.getMessage(), e);
            }
        }

        if (!candidates.isEmpty()) {
            log.info("Retention sweep purged {} of {} file(s) deleted before {}", purged, candidates.size(), cutoff);
        }
        return purged;
    }

    @Override
    public int evictExpiredCacheEntries() {
        return storageStatsService.evictExpiredCacheEntries();
    }
}
