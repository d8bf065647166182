package org.qbitspark.filevaultbackend.audit_service.service;

import org.qbitspark.filevaultbackend.audit_service.entity.FileAccessLogEntity;
import org.qbitspark.filevaultbackend.audit_service.enums.AccessAction;
import org.qbitspark.filevaultbackend.globesecurity.AccessContext;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

import java.util.UUID;

/**
 * Best-effort audit sink. Recording never throws.
 */
public interface AccessLogService {

    void recordSuccess(UUID fileId, AccessContext context, AccessAction action);

    void recordFailure(UUID fileId, AccessContext context, AccessAction action, String errorMessage);

    Page<FileAccessLogEntity> findForFile(UUID fileId, Pageable pageable);

    void deleteForFile(UUID fileId);
}
