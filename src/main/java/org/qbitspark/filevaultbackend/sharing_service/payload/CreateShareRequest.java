package org.qbitspark.filevaultbackend.sharing_service.payload;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Set;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class CreateShareRequest {

    // null = never expires
    private LocalDateTime expiresAt;

    @Min(value = 1, message = "Max downloads must be at least 1")
    private Integer maxDownloads;

    @Size(min = 1, max = 128, message = "Password must be between 1 and 128 characters")
    private String password;

    private Set<String> allowedDomains;

    private boolean requireAuth;
}
