package org.qbitspark.filevaultbackend.versioning_service.payload;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class RestoreVersionRequest {

    @NotNull(message = "Target version is required")
    @Positive(message = "Target version must be positive")
    private BigDecimal targetVersion;

    // null = follow the category's auto-backup setting
    private Boolean createBackup;
}
