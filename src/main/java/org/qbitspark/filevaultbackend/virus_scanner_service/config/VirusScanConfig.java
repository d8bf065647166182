package org.qbitspark.filevaultbackend.virus_scanner_service.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@Data
@ConfigurationProperties(prefix = "app.virus-scan")
public class VirusScanConfig {

    private boolean enabled;
    private String clamavHost = "localhost";
    private int clamavPort = 3310;
    private int timeoutMs = 30000;

    // false: record FAILED on the file and let the upload through
    private boolean failOnUnavailable = false;
    private int maxRetries = 3;
    private long retryDelayMs = 2000;
}
