package org.qbitspark.filevaultbackend.bulk_ops_service.payload;

import jakarta.validation.constraints.NotEmpty;
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
public class BulkDeleteRequest {

    @NotEmpty(message = "At least one file must be selected for deletion")
    private List<UUID> fileIds;

    // Purge immediately instead of moving to trash; administrators only
    private boolean permanent;
}
