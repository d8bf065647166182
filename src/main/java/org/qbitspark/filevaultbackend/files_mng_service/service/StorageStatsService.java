package org.qbitspark.filevaultbackend.files_mng_service.service;

import org.qbitspark.filevaultbackend.files_mng_service.payload.StorageStatsResponse;
import org.qbitspark.filevaultbackend.globeadvice.exceptions.AccessDeniedException;
import org.qbitspark.filevaultbackend.globesecurity.AccessContext;

public interface StorageStatsService {

    StorageStatsResponse getStorageStats(AccessContext context) throws AccessDeniedException;

    /**
     * @return number of cached entries dropped
     */
    int evictExpiredCacheEntries();
}
