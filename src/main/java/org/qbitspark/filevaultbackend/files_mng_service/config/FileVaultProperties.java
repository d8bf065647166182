package org.qbitspark.filevaultbackend.files_mng_service.config;

import lombok.Data;
import org.qbitspark.filevaultbackend.files_mng_service.enums.FileCategory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Data
@Configuration
@ConfigurationProperties(prefix = "app.files")
public class FileVaultProperties {

    // Days a soft-deleted file stays recoverable before the purge sweep removes it
    private int retentionDays = 30;

    private Duration statsCacheTtl = Duration.ofMinutes(5);
    private int statsCacheMaxEntries = 16;

    // Per-category overrides on top of the built-in upload policies
    private Map<FileCategory, CategoryOverride> categories = new HashMap<>();

    @Data
    public static class CategoryOverride {
        private Long maxSize;
        private List<String> allowedTypes;
        private Boolean virusScanning;
        private Boolean extractMetadata;
        private Boolean autoBackup;
        private Boolean generateThumbnails;
    }
}
