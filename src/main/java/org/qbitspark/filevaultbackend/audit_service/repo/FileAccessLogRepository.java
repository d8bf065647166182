package org.qbitspark.filevaultbackend.audit_service.repo;

import org.qbitspark.filevaultbackend.audit_service.entity.FileAccessLogEntity;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface FileAccessLogRepository extends JpaRepository<FileAccessLogEntity, UUID> {

    Page<FileAccessLogEntity> findByFileIdOrderByTimestampDesc(UUID fileId, Pageable pageable);

    @Modifying
    @Query("delete from FileAccessLogEntity l where l.fileId = :fileId")
    int deleteByFileId(@Param("fileId") UUID fileId);
}
