package org.qbitspark.filevaultbackend.sharing_service.payload;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class ShareAccessResponse {
    private UUID shareId;
    private UUID fileId;
    private String fileName;
    private String mimeType;
    private Long size;
    // null = unlimited
    private Integer remainingDownloads;
    private LocalDateTime expiresAt;
}
