package org.qbitspark.filevaultbackend.audit_service.service.impl;

import lombok.extern.slf4j.Slf4j;
import org.qbitspark.filevaultbackend.audit_service.entity.FileAccessLogEntity;
import org.qbitspark.filevaultbackend.audit_service.enums.AccessAction;
import org.qbitspark.filevaultbackend.audit_service.enums.AccessOutcome;
import org.qbitspark.filevaultbackend.audit_service.repo.FileAccessLogRepository;
import org.qbitspark.filevaultbackend.audit_service.service.AccessLogService;
import org.qbitspark.filevaultbackend.globesecurity.AccessContext;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.UUID;

@Service
@Slf4j
public class AccessLogServiceImpl implements AccessLogService {

    private static final int MAX_ERROR_LENGTH = 1000;

    private final FileAccessLogRepository accessLogRepository;
    private final Clock clock;
    private final TransactionTemplate auditTransaction;

    public AccessLogServiceImpl(FileAccessLogRepository accessLogRepository, Clock clock,
                                PlatformTransactionManager transactionManager) {
        this.accessLogRepository = accessLogRepository;
        this.clock = clock;
        // Own transaction: a failed insert must not mark the caller's transaction rollback-only
        this.auditTransaction = new TransactionTemplate(transactionManager);
        this.auditTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    @Override
    public void recordSuccess(UUID fileId, AccessContext context, AccessAction action) {
        record(fileId, context, action, AccessOutcome.SUCCESS, null);
    }

    @Override
    public void recordFailure(UUID fileId, AccessContext context, AccessAction action, String errorMessage) {
        record(fileId, context, action, AccessOutcome.FAILURE, errorMessage);
    }

    @Override
    @Transactional(readOnly = true)
    public Page<FileAccessLogEntity> findForFile(UUID fileId, Pageable pageable) {
        return accessLogRepository.findByFileIdOrderByTimestampDesc(fileId, pageable);
    }

    @Override
    @Transactional
    public void deleteForFile(UUID fileId) {
        int removed = accessLogRepository.deleteByFileId(fileId);
        log.debug("Removed {} access log entries for file {}", removed, fileId);
    }

    private void record(UUID fileId, AccessContext context, AccessAction action,
                        AccessOutcome outcome, String errorMessage) {
        try {
            FileAccessLogEntity entry = FileAccessLogEntity.builder()
                    .fileId(fileId)
                    .actorId(context != null ? context.getUserId() : null)
                    .action(action)
                    .outcome(outcome)
                    .errorMessage(truncate(errorMessage))
                    .ipAddress(context != null ? context.getIpAddress() : null)
                    .userAgent(context != null ? context.getUserAgent() : null)
                    .timestamp(LocalDateTime.now(clock))
                    .build();
            auditTransaction.executeWithoutResult(status -> accessLogRepository.save(entry));
        } catch (RuntimeException e) {
            log.warn("Failed to record {} {} for file {}: {}", action, outcome, fileId, e.getMessage());
        }
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= MAX_ERROR_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_ERROR_LENGTH);
    }
}
