package org.qbitspark.filevaultbackend.files_mng_service.payload;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.qbitspark.filevaultbackend.files_mng_service.enums.FileCategory;
import org.qbitspark.filevaultbackend.files_mng_service.enums.FileVisibility;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class FileSearchCriteria {
    private FileCategory category;
    private String tag;
    private FileVisibility visibility;
    // Case-insensitive match on name or description
    private String query;
    // Honoured for privileged callers only
    private boolean includeDeleted;
    private int page;
    @Builder.Default
    private int size = 20;
}
