package org.qbitspark.filevaultbackend.sharing_service.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

@Entity
@Table(name = "file_shares", indexes = {
        @Index(name = "idx_file_shares_file", columnList = "file_id")
})
@Getter
@Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class ShareTokenEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.AUTO)
    private UUID shareId;

    @Column(name = "file_id", nullable = false)
    private UUID fileId;

    @Column(nullable = false)
    private UUID issuerId;

    @Column(nullable = false, unique = true, length = 64)
    private String token;

    private LocalDateTime expiresAt;

    // null = unlimited
    private Integer maxDownloads;

    @Column(nullable = false)
    @Builder.Default
    private Integer downloadCount = 0;

    // BCrypt hash, never the plain password
    private String passwordHash;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "file_share_domains", joinColumns = @JoinColumn(name = "share_id"))
    @Column(name = "domain")
    @Builder.Default
    private Set<String> allowedDomains = new HashSet<>();

    @Column(nullable = false)
    private boolean requireAuth;

    @Column(nullable = false)
    @Builder.Default
    private boolean active = true;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    private LocalDateTime lastAccessedAt;

    public boolean isExpiredAt(LocalDateTime now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    public boolean isLimitReached() {
        return maxDownloads != null && downloadCount >= maxDownloads;
    }

    public boolean hasPassword() {
        return passwordHash != null;
    }
}
