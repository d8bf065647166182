package org.qbitspark.filevaultbackend.versioning_service.payload;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class VersionRestoreResponse {
    private UUID fileId;
    private BigDecimal previousVersion;
    private BigDecimal restoredVersion;
    // null when no backup was taken
    private FileVersionResponse backup;
}
