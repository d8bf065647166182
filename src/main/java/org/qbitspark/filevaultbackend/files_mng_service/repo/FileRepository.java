package org.qbitspark.filevaultbackend.files_mng_service.repo;

import org.qbitspark.filevaultbackend.files_mng_service.entity.FileEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Repository
public interface FileRepository extends JpaRepository<FileEntity, UUID>, JpaSpecificationExecutor<FileEntity> {

    // Soft-deleted files whose retention window has passed
    List<FileEntity> findByDeletedTrueAndDeletedAtBefore(LocalDateTime cutoff);

    // Live files whose own expiry date has passed
    List<FileEntity> findByDeletedFalseAndExpiresAtBefore(LocalDateTime now);

    long countByDeletedTrue();

    // Single statement so concurrent downloads never lose an increment
    @Modifying
    @Transactional
    @Query("update FileEntity f set f.downloadCount = f.downloadCount + 1, f.lastAccessed = :now where f.fileId = :fileId")
    int recordDownload(@Param("fileId") UUID fileId, @Param("now") LocalDateTime now);

    @Modifying
    @Transactional
    @Query("update FileEntity f set f.lastAccessed = :now where f.fileId = :fileId")
    int touchLastAccessed(@Param("fileId") UUID fileId, @Param("now") LocalDateTime now);

    // Rows of [category, count, total bytes] over live files
    @Query("select f.category, count(f), coalesce(sum(f.fileSize), 0) from FileEntity f " +
            "where f.deleted = false group by f.category")
    List<Object[]> summarizeActiveFilesByCategory();
}
