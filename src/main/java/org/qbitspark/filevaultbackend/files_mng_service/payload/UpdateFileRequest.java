package org.qbitspark.filevaultbackend.files_mng_service.payload;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.qbitspark.filevaultbackend.files_mng_service.enums.FileVisibility;

import java.time.LocalDateTime;
import java.util.Set;

/**
 * Partial update. Null fields are left unchanged.
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class UpdateFileRequest {

    private String originalName;

    @Size(max = 1000, message = "Description cannot exceed 1000 characters")
    private String description;

    private FileVisibility visibility;

    @Size(max = 50, message = "A file can carry at most 50 tags")
    private Set<String> tags;

    private LocalDateTime expiresAt;

    // Removes an existing expiry date; expiresAt is ignored when set
    private boolean clearExpiry;
}
