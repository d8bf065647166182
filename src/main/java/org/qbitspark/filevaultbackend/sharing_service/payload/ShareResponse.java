package org.qbitspark.filevaultbackend.sharing_service.payload;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class ShareResponse {
    private UUID shareId;
    private UUID fileId;
    private UUID issuerId;
    private String token;
    private LocalDateTime expiresAt;
    private Integer maxDownloads;
    private int downloadCount;
    private Integer remainingDownloads;
    private boolean passwordProtected;
    private List<String> allowedDomains;
    private boolean requireAuth;
    private boolean active;
    private LocalDateTime createdAt;
    private LocalDateTime lastAccessedAt;
}
