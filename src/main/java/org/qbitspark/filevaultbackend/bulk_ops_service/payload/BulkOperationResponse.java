package org.qbitspark.filevaultbackend.bulk_ops_service.payload;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.UUID;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class BulkOperationResponse {

    private String operation;
    private int totalRequested;
    private int successful;
    private int failed;

    // Details of successful operations
    private List<UUID> successfulIds;

    // Details of failed operations
    private List<FailedOperation> failures;

    private String summary;

    @Data
    @Builder
    @AllArgsConstructor
    @NoArgsConstructor
    public static class FailedOperation {
        private UUID fileId;
        private String reason;
        private String fileName;
    }
}
