package org.qbitspark.filevaultbackend.versioning_service.payload;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.qbitspark.filevaultbackend.versioning_service.enums.ChangeType;
import org.qbitspark.filevaultbackend.versioning_service.enums.VersionBump;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class CreateVersionRequest {

    @NotBlank(message = "Change summary is required")
    @Size(max = 500, message = "Change summary cannot exceed 500 characters")
    private String changeSummary;

    @NotNull(message = "Change type is required")
    private ChangeType changeType;

    @NotNull(message = "Version bump is required")
    private VersionBump bump;

    // Optional new revision of the bytes
    private byte[] content;

    // Defaults to the current MIME type when new content is supplied
    private String mimeType;
}
