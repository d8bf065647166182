package org.qbitspark.filevaultbackend.bulk_ops_service.payload;

import jakarta.validation.constraints.NotEmpty;
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
public class BulkCopyRequest {

    @NotEmpty(message = "At least one file must be selected to copy")
    private List<UUID> fileIds;

    private FileCategory targetCategory;  // null = keep each file's category
}
