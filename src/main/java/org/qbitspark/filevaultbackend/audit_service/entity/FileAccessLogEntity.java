package org.qbitspark.filevaultbackend.audit_service.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.qbitspark.filevaultbackend.audit_service.enums.AccessAction;
import org.qbitspark.filevaultbackend.audit_service.enums.AccessOutcome;

import java.time.LocalDateTime;
import java.util.UUID;

// Append-only; no setters on purpose
@Entity
@Table(name = "file_access_logs", indexes = {
        @Index(name = "idx_access_logs_file", columnList = "file_id, timestamp")
})
@Getter
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class FileAccessLogEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.AUTO)
    private UUID logId;

    // null for uploads rejected before a record existed
    @Column(name = "file_id")
    private UUID fileId;

    // null for anonymous share access
    private UUID actorId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private AccessAction action;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private AccessOutcome outcome;

    @Column(length = 1000)
    private String errorMessage;

    private String ipAddress;

    @Column(length = 512)
    private String userAgent;

    @Column(nullable = false)
    private LocalDateTime timestamp;
}
