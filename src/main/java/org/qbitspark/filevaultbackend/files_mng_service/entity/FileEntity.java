package org.qbitspark.filevaultbackend.files_mng_service.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.qbitspark.filevaultbackend.files_mng_service.enums.FileCategory;
import org.qbitspark.filevaultbackend.files_mng_service.enums.FileVisibility;
import org.qbitspark.filevaultbackend.files_mng_service.enums.VirusScanStatus;
import org.qbitspark.filevaultbackend.globe_utils.JsonMapConverter;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

@Entity
@Table(name = "file_records", indexes = {
        @Index(name = "idx_file_records_owner", columnList = "owner_id"),
        @Index(name = "idx_file_records_category", columnList = "category")
})
@Getter
@Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class FileEntity {

    @Id
    private UUID fileId;

    @Column(nullable = false)
    private String originalName;

    @Column(nullable = false, unique = true)
    private String storageKey;

    @Column(nullable = false)
    private String mimeType;

    @Column(nullable = false)
    private Long fileSize;

    @Column(nullable = false, length = 64)
    private String checksum;

    // null when the category renders no thumbnails or the content is not a decodable image
    private String thumbnailKey;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private FileCategory category;

    @Column(name = "owner_id", nullable = false)
    private UUID ownerId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private FileVisibility visibility = FileVisibility.PRIVATE;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "file_record_tags", joinColumns = @JoinColumn(name = "file_id"))
    @Column(name = "tag", length = 50)
    @Builder.Default
    private Set<String> tags = new HashSet<>();

    @Column(length = 1000)
    private String description;

    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal version;

    @Enumerated(EnumType.STRING)
    @Builder.Default
    private VirusScanStatus scanStatus = VirusScanStatus.PENDING;

    @Convert(converter = JsonMapConverter.class)
    @Column(columnDefinition = "text")
    @Builder.Default
    private Map<String, Object> extractedMetadata = new HashMap<>();

    @Column(nullable = false)
    private LocalDateTime uploadedAt;

    @Column(nullable = false)
    private LocalDateTime updatedAt;

    @Column(name = "is_deleted", nullable = false)
    @Builder.Default
    private Boolean deleted = false;

    @Column(name = "deleted_at")
    private LocalDateTime deletedAt;

    // null when the system deleted the file (expiry sweep)
    @Column(name = "deleted_by")
    private UUID deletedBy;

    // Written only by the counter statements in FileRepository, never by an entity flush
    @Column(nullable = false, updatable = false)
    @Builder.Default
    private Long downloadCount = 0L;

    @Column(updatable = false)
    private LocalDateTime lastAccessed;

    private LocalDateTime expiresAt;

    @Version
    private Long lockVersion;

    public boolean isOwnedBy(UUID userId) {
        return userId != null && userId.equals(ownerId);
    }

    public boolean isPublic() {
        return visibility == FileVisibility.PUBLIC;
    }

    public boolean isDeleted() {
        return Boolean.TRUE.equals(deleted);
    }
}
