package org.qbitspark.filevaultbackend.bulk_ops_service.payload;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.qbitspark.filevaultbackend.files_mng_service.enums.TagOperation;

import java.util.List;
import java.util.Set;
import java.util.UUID;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class BulkTagRequest {

    @NotEmpty(message = "At least one file must be selected for tagging")
    private List<UUID> fileIds;

    @NotNull(message = "Tag operation is required")
    private TagOperation operation;

    @NotNull(message = "Tags are required")
    private Set<String> tags;
}
