package org.qbitspark.filevaultbackend.files_mng_service.service.impl;

import lombok.extern.slf4j.Slf4j;
import org.qbitspark.filevaultbackend.files_mng_service.config.FileVaultProperties;
import org.qbitspark.filevaultbackend.files_mng_service.enums.FileCategory;
import org.qbitspark.filevaultbackend.files_mng_service.payload.StorageStatsResponse;
import org.qbitspark.filevaultbackend.files_mng_service.repo.FileRepository;
import org.qbitspark.filevaultbackend.files_mng_service.service.FileAccessPolicy;
import org.qbitspark.filevaultbackend.files_mng_service.service.StorageStatsService;
import org.qbitspark.filevaultbackend.globe_utils.FileSizeFormatter;
import org.qbitspark.filevaultbackend.globe_utils.TtlCache;
import org.qbitspark.filevaultbackend.globeadvice.exceptions.AccessDeniedException;
import org.qbitspark.filevaultbackend.globesecurity.AccessContext;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Service
@Slf4j
public class StorageStatsServiceImpl implements StorageStatsService {

    private static final String GLOBAL_STATS = "global";

    private final FileRepository fileRepository;
    private final FileAccessPolicy accessPolicy;
    private final Clock clock;
    private final TtlCache<String, StorageStatsResponse> statsCache;

    public StorageStatsServiceImpl(FileRepository fileRepository, FileAccessPolicy accessPolicy,
                                   FileVaultProperties properties, Clock clock) {
        this.fileRepository = fileRepository;
        this.accessPolicy = accessPolicy;
        this.clock = clock;
        this.statsCache = new TtlCache<>(properties.getStatsCacheTtl(), properties.getStatsCacheMaxEntries(), clock);
    }

    @Override
    @Transactional(readOnly = true)
    public StorageStatsResponse getStorageStats(AccessContext context) throws AccessDeniedException {
        accessPolicy.requirePrivileged(context, "Storage statistics");
        return statsCache.getOrCompute(GLOBAL_STATS, this::computeStats);
    }

    @Override
    public int evictExpiredCacheEntries() {
        return statsCache.evictExpired();
    }

    private StorageStatsResponse computeStats() {
        List<Object[]> rows = fileRepository.summarizeActiveFilesByCategory();

        Map<FileCategory, StorageStatsResponse.CategoryUsage> byCategory = new EnumMap<>(FileCategory.class);
        long activeFiles = 0;
        long totalBytes = 0;
        for (Object[] row : rows) {
            FileCategory category = (FileCategory) row[0];
            long count = ((Number) row[1]).longValue();
            long bytes = ((Number) row[2]).longValue();
            byCategory.put(category, StorageStatsResponse.CategoryUsage.builder()
                    .fileCount(count)
                    .totalBytes(bytes)
                    .build());
            activeFiles += count;
            totalBytes += bytes;
        }
        long deletedFiles = fileRepository.countByDeletedTrue();

        log.info("Storage statistics computed: {} active files, {} in trash, {}",
                activeFiles, deletedFiles, FileSizeFormatter.format(totalBytes));

        return StorageStatsResponse.builder()
                .activeFiles(activeFiles)
                .totalBytes(totalBytes)
                .totalSizeFormatted(FileSizeFormatter.format(totalBytes))
                .deletedFiles(deletedFiles)
                .byCategory(byCategory)
                .generatedAt(LocalDateTime.now(clock))
                .build();
    }
}
