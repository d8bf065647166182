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
public class VersionDiffResponse {

    private UUID fileId;
    private BigDecimal fromVersion;
    private BigDecimal toVersion;
    private List<FieldChange> changes;

    public boolean isIdentical() {
        return changes == null || changes.isEmpty();
    }

    public enum DiffType {
        ADDED,
        REMOVED,
        CHANGED
    }

    @Data
    @Builder
    @AllArgsConstructor
    @NoArgsConstructor
    public static class FieldChange {
        private String field;
        private DiffType type;
        private Object oldValue;
        private Object newValue;
    }
}
