package org.qbitspark.filevaultbackend.versioning_service.repo;

import org.qbitspark.filevaultbackend.versioning_service.entity.FileVersionEntity;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface FileVersionRepository extends JpaRepository<FileVersionEntity, UUID> {

    Optional<FileVersionEntity> findByFileIdAndVersion(UUID fileId, BigDecimal version);

    // Highest label ever recorded, which can be above the live version after a restore
    Optional<FileVersionEntity> findTopByFileIdOrderByVersionDesc(UUID fileId);

    Page<FileVersionEntity> findByFileIdOrderByVersionDesc(UUID fileId, Pageable pageable);

    @Query("select distinct v.storageKey from FileVersionEntity v where v.fileId = :fileId")
    List<String> findStorageKeysByFileId(@Param("fileId") UUID fileId);

    @Modifying
    @Query("delete from FileVersionEntity v where v.fileId = :fileId")
    int deleteByFileId(@Param("fileId") UUID fileId);
}
