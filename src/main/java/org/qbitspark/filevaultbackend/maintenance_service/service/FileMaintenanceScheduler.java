package org.qbitspark.filevaultbackend.maintenance_service.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(prefix = "app.maintenance", name = "enabled", havingValue = "true", matchIfMissing = true)
public class FileMaintenanceScheduler {

    private final FileMaintenanceService maintenanceService;

    @Scheduled(fixedDelayString = "${app.maintenance.share-sweep-interval-ms:300000}")
    public void deactivateExpiredShares() {
        maintenanceService.deactivateExpiredShares();
    }

    @Scheduled(fixedDelayString = "${app.maintenance.expiry-sweep-interval-ms:900000}")
    public void softDeleteExpiredFiles() {
        maintenanceService.softDeleteExpiredFiles();
    }

    @Scheduled(fixedDelayString = "${app.maintenance.purge-sweep-interval-ms:3600000}",
            initialDelayString = "${app.maintenance.purge-sweep-interval-ms:3600000}")
    public void purgeRetainedDeletions() {
        maintenanceService.purgeRetainedDeletions();
    }

    @Scheduled(fixedRateString = "${app.maintenance.cache-sweep-interval-ms:60000}")
    public void evictExpiredCacheEntries() {
        int removed = maintenanceService.evictExpiredCacheEntries();
        if (removed > 0) {
            log.debug("Cleaned up {} expired cache entries", removed);
        }
    }
}
