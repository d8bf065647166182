package org.qbitspark.filevaultbackend.files_mng_service.payload;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.qbitspark.filevaultbackend.files_mng_service.enums.FileCategory;

import java.time.LocalDateTime;
import java.util.Map;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class StorageStatsResponse {
    private long activeFiles;
    private long totalBytes;
    private String totalSizeFormatted;
    private long deletedFiles;
    private Map<FileCategory, CategoryUsage> byCategory;
    private LocalDateTime generatedAt;

    @Data
    @Builder
    @AllArgsConstructor
    @NoArgsConstructor
    public static class CategoryUsage {
        private long fileCount;
        private long totalBytes;
    }
}
