package org.qbitspark.filevaultbackend.versioning_service.payload;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class VersionHistoryResponse {
    private UUID fileId;
    private BigDecimal currentVersion;
    private List<FileVersionResponse> versions;
    private int page;
    private int size;
    private long totalElements;
    private int totalPages;
}
