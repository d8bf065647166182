package org.qbitspark.filevaultbackend.bulk_ops_service.payload;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.qbitspark.filevaultbackend.files_mng_service.enums.FileCategory;

import java.util.List;
import java.util.UUID;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class BulkMoveRequest {

    @NotEmpty(message = "At least one file must be selected to move")
    private List<UUID> fileIds;

    @NotNull(message = "Target category is required")
    private FileCategory targetCategory;
}
