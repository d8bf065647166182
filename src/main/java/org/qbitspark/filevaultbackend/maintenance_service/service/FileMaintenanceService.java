package org.qbitspark.filevaultbackend.maintenance_service.service;

/**
 * Background sweeps. Each one only moves records toward a terminal state and returns
 * how many records it touched.
 */
public interface FileMaintenanceService {

    int deactivateExpiredShares();

    int softDeleteExpiredFiles();

    int purgeRetainedDeletions();

    int evictExpiredCacheEntries();
}
