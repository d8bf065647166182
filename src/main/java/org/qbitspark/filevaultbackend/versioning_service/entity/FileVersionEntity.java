package org.qbitspark.filevaultbackend.versioning_service.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.qbitspark.filevaultbackend.globe_utils.JsonMapConverter;
import org.qbitspark.filevaultbackend.versioning_service.enums.ChangeType;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

// Immutable once written
@Entity
@Table(name = "file_versions", uniqueConstraints = {
        @UniqueConstraint(name = "uk_file_versions_file_version", columnNames = {"file_id", "version"})
})
@Getter
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class FileVersionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.AUTO)
    private UUID versionId;

    @Column(name = "file_id", nullable = false)
    private UUID fileId;

    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal version;

    @Column(nullable = false, length = 64)
    private String checksum;

    @Column(nullable = false)
    private Long fileSize;

    // Bytes of this revision, kept until the file is purged
    @Column(nullable = false)
    private String storageKey;

    private UUID createdBy;

    @Column(nullable = false, length = 500)
    private String changeSummary;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ChangeType changeType;

    @Convert(converter = JsonMapConverter.class)
    @Column(columnDefinition = "text")
    @Builder.Default
    private Map<String, Object> metadataSnapshot = new LinkedHashMap<>();

    @Column(nullable = false)
    private LocalDateTime createdAt;
}
