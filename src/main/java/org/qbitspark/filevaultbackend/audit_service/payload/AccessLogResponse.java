package org.qbitspark.filevaultbackend.audit_service.payload;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.qbitspark.filevaultbackend.audit_service.enums.AccessAction;
import org.qbitspark.filevaultbackend.audit_service.enums.AccessOutcome;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccessLogResponse {

    private UUID fileId;
    private List<Entry> entries;
    private int currentPage;
    private int pageSize;
    private long totalElements;
    private int totalPages;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Entry {
        private UUID actorId;
        private AccessAction action;
        private AccessOutcome outcome;
        private String errorMessage;
        private String ipAddress;
        private String userAgent;
        private LocalDateTime timestamp;
    }
}
