package org.qbitspark.filevaultbackend.files_mng_service.payload;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.qbitspark.filevaultbackend.files_mng_service.enums.FileCategory;
import org.qbitspark.filevaultbackend.files_mng_service.enums.FileVisibility;
import org.qbitspark.filevaultbackend.files_mng_service.enums.VirusScanStatus;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class FileResponse {
    private UUID id;
    private String name;
    private String mimeType;
    private Long size;
    private String sizeFormatted;
    private String checksum;
    private FileCategory category;
    private UUID ownerId;
    private FileVisibility visibility;
    private List<String> tags;
    private String description;
    private BigDecimal version;
    private VirusScanStatus scanStatus;
    private Map<String, Object> metadata;
    private boolean thumbnailAvailable;
    private long downloadCount;
    private boolean deleted;
    private LocalDateTime deletedAt;
    private LocalDateTime lastAccessed;
    private LocalDateTime expiresAt;
    private LocalDateTime uploadedAt;
    private LocalDateTime updatedAt;
}
