package org.qbitspark.filevaultbackend.versioning_service.payload;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.qbitspark.filevaultbackend.versioning_service.enums.ChangeType;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class FileVersionResponse {
    private UUID versionId;
    private UUID fileId;
    private BigDecimal version;
    private String checksum;
    private Long size;
    private UUID createdBy;
    private String changeSummary;
    private ChangeType changeType;
    private Map<String, Object> metadataSnapshot;
    private boolean current;
    private LocalDateTime createdAt;
}
