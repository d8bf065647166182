package org.qbitspark.filevaultbackend.virus_scanner_service.service.impl;

import lombok.extern.slf4j.Slf4j;
import org.qbitspark.filevaultbackend.files_mng_service.enums.VirusScanStatus;
import org.qbitspark.filevaultbackend.globeadvice.exceptions.VirusScanException;
import org.qbitspark.filevaultbackend.virus_scanner_service.config.VirusScanConfig;
import org.qbitspark.filevaultbackend.virus_scanner_service.payload.VirusScanResult;
import org.qbitspark.filevaultbackend.virus_scanner_service.service.VirusScanService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import xyz.capybara.clamav.ClamavClient;
import xyz.capybara.clamav.commands.scan.result.ScanResult;

import java.io.ByteArrayInputStream;

@Service
@Slf4j
public class ClamAvVirusScanService implements VirusScanService {

    private final VirusScanConfig config;
    private final ClamavClient clamavClient;

    @Autowired
    public ClamAvVirusScanService(VirusScanConfig config) {
        this(config, new ClamavClient(config.getClamavHost(), config.getClamavPort()));
    }

    ClamAvVirusScanService(VirusScanConfig config, ClamavClient clamavClient) {
        this.config = config;
        this.clamavClient = clamavClient;
    }

    @Override
    public VirusScanResult scanFileContent(byte[] fileContent, String fileName) throws VirusScanException {
        if (!config.isEnabled()) {
            return VirusScanResult.builder()
                    .status(VirusScanStatus.SKIPPED)
                    .message("Virus scanning is disabled")
                    .fileName(fileName)
                    .scanDurationMs(0)
                    .build();
        }

        long startTime = System.currentTimeMillis();
        log.info("Starting virus scan for file: {}", fileName);

        int attempts = Math.max(1, config.getMaxRetries());
        Exception lastFailure = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                ScanResult scanResult = clamavClient.scan(new ByteArrayInputStream(fileContent));
                return toResult(scanResult, fileName, System.currentTimeMillis() - startTime);
            } catch (VirusScanException e) {
                throw e;
            } catch (Exception e) {
                lastFailure = e;
                log.warn("Virus scan attempt {}/{} failed for {}: {}", attempt, attempts, fileName, e.getMessage());
                if (attempt < attempts) {
                    pause();
                }
            }
        }

        long scanDuration = System.currentTimeMillis() - startTime;
        if (config.isFailOnUnavailable()) {
            throw new VirusScanException("ClamAV daemon is not available", lastFailure);
        }
        log.warn("Virus scan unavailable for {}, continuing without a verdict", fileName);
        return VirusScanResult.builder()
                .status(VirusScanStatus.FAILED)
                .message("Virus scan unavailable: " + (lastFailure != null ? lastFailure.getMessage() : "unknown"))
                .fileName(fileName)
                .scanDurationMs(scanDuration)
                .build();
    }

    @Override
    public boolean isClamAvAvailable() {
        try {
            clamavClient.ping();
            return true;
        } catch (Exception e) {
            log.warn("ClamAV daemon is not available: {}", e.getMessage());
            return false;
        }
    }

    private VirusScanResult toResult(ScanResult scanResult, String fileName, long scanDuration) throws VirusScanException {
        if (scanResult instanceof ScanResult.OK) {
            log.info("File scan completed - CLEAN: {} (took {}ms)", fileName, scanDuration);
            return VirusScanResult.builder()
                    .status(VirusScanStatus.CLEAN)
                    .message("File is clean")
                    .fileName(fileName)
                    .scanDurationMs(scanDuration)
                    .build();
        }
        if (scanResult instanceof ScanResult.VirusFound) {
            ScanResult.VirusFound virusFound = (ScanResult.VirusFound) scanResult;
            String virusName = virusFound.getFoundViruses().isEmpty()
                    ? "Unknown virus"
                    : virusFound.getFoundViruses().keySet().iterator().next();
            log.warn("VIRUS DETECTED in file: {} - Virus: {}", fileName, virusName);
            return VirusScanResult.builder()
                    .status(VirusScanStatus.INFECTED)
                    .virusName(virusName)
                    .message("Virus detected: " + virusName)
                    .fileName(fileName)
                    .scanDurationMs(scanDuration)
                    .build();
        }
        throw new VirusScanException("Unknown scan result type: " + scanResult.getClass().getSimpleName());
    }

    private void pause() {
        try {
            Thread.sleep(config.getRetryDelayMs());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
