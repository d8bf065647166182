package org.qbitspark.filevaultbackend.sharing_service.repo;

import org.qbitspark.filevaultbackend.sharing_service.entity.ShareTokenEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ShareTokenRepository extends JpaRepository<ShareTokenEntity, UUID> {

    Optional<ShareTokenEntity> findByToken(String token);

    List<ShareTokenEntity> findByFileIdOrderByCreatedAtDesc(UUID fileId);

    /**
     * Consumes one download if the share is still usable. The conditions live in the statement
     * so two concurrent consumers can never both pass the cap.
     *
     * @return 1 when a download was consumed, 0 otherwise
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("update ShareTokenEntity s set s.downloadCount = s.downloadCount + 1, s.lastAccessedAt = :now " +
            "where s.shareId = :shareId and s.active = true " +
            "and (s.maxDownloads is null or s.downloadCount < s.maxDownloads) " +
            "and (s.expiresAt is null or s.expiresAt > :now)")
    int incrementDownloadCount(@Param("shareId") UUID shareId, @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("update ShareTokenEntity s set s.active = false where s.shareId = :shareId and s.active = true " +
            "and s.maxDownloads is not null and s.downloadCount >= s.maxDownloads")
    int deactivateIfExhausted(@Param("shareId") UUID shareId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("update ShareTokenEntity s set s.active = false where s.shareId = :shareId and s.active = true")
    int deactivate(@Param("shareId") UUID shareId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("update ShareTokenEntity s set s.active = false where s.fileId = :fileId and s.active = true")
    int deactivateAllForFile(@Param("fileId") UUID fileId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("update ShareTokenEntity s set s.active = false where s.active = true " +
            "and s.expiresAt is not null and s.expiresAt <= :now")
    int deactivateExpired(@Param("now") LocalDateTime now);

    // Derived delete so the domain collection rows go with each share
    @Transactional
    long deleteByFileId(UUID fileId);
}
