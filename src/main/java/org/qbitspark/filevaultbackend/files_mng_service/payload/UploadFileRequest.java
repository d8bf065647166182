package org.qbitspark.filevaultbackend.files_mng_service.payload;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.qbitspark.filevaultbackend.files_mng_service.enums.FileCategory;
import org.qbitspark.filevaultbackend.files_mng_service.enums.FileVisibility;

import java.time.LocalDateTime;
import java.util.Set;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class UploadFileRequest {

    @NotNull(message = "File content is required")
    private byte[] content;

    @NotBlank(message = "File name is required")
    private String originalName;

    @NotBlank(message = "MIME type is required")
    private String mimeType;

    @NotNull(message = "Category is required")
    private FileCategory category;

    private FileVisibility visibility;  // null = PRIVATE

    @Size(max = 50, message = "A file can carry at most 50 tags")
    private Set<String> tags;

    @Size(max = 1000, message = "Description cannot exceed 1000 characters")
    private String description;

    private LocalDateTime expiresAt;
}
