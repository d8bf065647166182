package org.qbitspark.filevaultbackend.virus_scanner_service.service;

import org.qbitspark.filevaultbackend.globeadvice.exceptions.VirusScanException;
import org.qbitspark.filevaultbackend.virus_scanner_service.payload.VirusScanResult;

public interface VirusScanService {

    /**
     * Scans file content from byte array
     * @param fileContent The file content as byte array
     * @param fileName The original filename for logging
     * @return VirusScanResult with SKIPPED when scanning is disabled, FAILED when the daemon
     *         could not be reached and failures are tolerated
     * @throws VirusScanException if the daemon is unavailable and failOnUnavailable is set
     */
    VirusScanResult scanFileContent(byte[] fileContent, String fileName) throws VirusScanException;

    /**
     * Checks if ClamAV daemon is available
     * @return true if ClamAV is available, false otherwise
     */
    boolean isClamAvAvailable();
}
