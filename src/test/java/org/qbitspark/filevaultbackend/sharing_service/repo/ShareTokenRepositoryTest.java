package org.qbitspark.filevaultbackend.sharing_service.repo;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.qbitspark.filevaultbackend.sharing_service.entity.ShareTokenEntity;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@DisplayName("ShareTokenRepository")
class ShareTokenRepositoryTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 3, 5, 9, 30);

    @Autowired
    private ShareTokenRepository shareTokenRepository;

    @AfterEach
    void cleanUp() {
        shareTokenRepository.deleteAll();
    }

    private ShareTokenEntity persistShare(Integer maxDownloads, LocalDateTime expiresAt) {
        return shareTokenRepository.saveAndFlush(ShareTokenEntity.builder()
                .fileId(UUID.randomUUID())
                .issuerId(UUID.randomUUID())
                .token(UUID.randomUUID().toString().replace("-", ""))
                .maxDownloads(maxDownloads)
                .expiresAt(expiresAt)
                .createdAt(NOW.minusDays(1))
                .build());
    }

    private ShareTokenEntity reload(ShareTokenEntity share) {
        return shareTokenRepository.findById(share.getShareId()).orElseThrow();
    }

    @Nested
    @DisplayName("incrementDownloadCount")
    class IncrementDownloadCount {

        @Test
        @DisplayName("consumes downloads up to the cap and no further")
        void stopsAtCap() {
            ShareTokenEntity share = persistShare(2, null);

            assertThat(shareTokenRepository.incrementDownloadCount(share.getShareId(), NOW)).isEqualTo(1);
            assertThat(shareTokenRepository.incrementDownloadCount(share.getShareId(), NOW)).isEqualTo(1);
            assertThat(shareTokenRepository.incrementDownloadCount(share.getShareId(), NOW)).isZero();

            ShareTokenEntity reloaded = reload(share);
            assertThat(reloaded.getDownloadCount()).isEqualTo(2);
            assertThat(reloaded.getLastAccessedAt()).isEqualTo(NOW);
        }

        @Test
        @DisplayName("unlimited shares keep counting")
        void unlimited() {
            ShareTokenEntity share = persistShare(null, null);

            for (int i = 0; i < 5; i++) {
                assertThat(shareTokenRepository.incrementDownloadCount(share.getShareId(), NOW)).isEqualTo(1);
            }

            assertThat(reload(share).getDownloadCount()).isEqualTo(5);
        }

        @Test
        @DisplayName("expired or inactive shares are not consumed")
        void expiredOrInactive() {
            ShareTokenEntity expired = persistShare(null, NOW);
            ShareTokenEntity revoked = persistShare(null, null);
            shareTokenRepository.deactivate(revoked.getShareId());

            assertThat(shareTokenRepository.incrementDownloadCount(expired.getShareId(), NOW)).isZero();
            assertThat(shareTokenRepository.incrementDownloadCount(revoked.getShareId(), NOW)).isZero();
            assertThat(reload(expired).getDownloadCount()).isZero();
            assertThat(reload(revoked).getDownloadCount()).isZero();
        }
    }

    @Nested
    @DisplayName("deactivation")
    class Deactivation {

        @Test
        @DisplayName("deactivateIfExhausted only switches off shares at their cap")
        void deactivateIfExhausted() {
            ShareTokenEntity share = persistShare(1, null);

            assertThat(shareTokenRepository.deactivateIfExhausted(share.getShareId())).isZero();
            assertThat(reload(share).isActive()).isTrue();

            shareTokenRepository.incrementDownloadCount(share.getShareId(), NOW);

            assertThat(shareTokenRepository.deactivateIfExhausted(share.getShareId())).isEqualTo(1);
            assertThat(reload(share).isActive()).isFalse();
        }

        @Test
        @DisplayName("deactivateIfExhausted never touches unlimited shares")
        void unlimitedNeverExhausted() {
            ShareTokenEntity share = persistShare(null, null);
            shareTokenRepository.incrementDownloadCount(share.getShareId(), NOW);

            assertThat(shareTokenRepository.deactivateIfExhausted(share.getShareId())).isZero();
            assertThat(reload(share).isActive()).isTrue();
        }

        @Test
        @DisplayName("deactivateExpired switches off shares expiring at or before now")
        void deactivateExpired() {
            ShareTokenEntity past = persistShare(null, NOW.minusHours(1));
            ShareTokenEntity boundary = persistShare(null, NOW);
            ShareTokenEntity future = persistShare(null, NOW.plusHours(1));
            ShareTokenEntity open = persistShare(null, null);

            assertThat(shareTokenRepository.deactivateExpired(NOW)).isEqualTo(2);

            assertThat(reload(past).isActive()).isFalse();
            assertThat(reload(boundary).isActive()).isFalse();
            assertThat(reload(future).isActive()).isTrue();
            assertThat(reload(open).isActive()).isTrue();

            // already inactive rows are not counted again
            assertThat(shareTokenRepository.deactivateExpired(NOW)).isZero();
        }

        @Test
        @DisplayName("deleteByFileId removes every share of the file")
        void deleteByFileId() {
            ShareTokenEntity share = persistShare(3, null);
            share.getAllowedDomains().add("club.example");
            shareTokenRepository.saveAndFlush(share);
            ShareTokenEntity other = persistShare(3, null);

            assertThat(shareTokenRepository.deleteByFileId(share.getFileId())).isEqualTo(1);

            assertThat(shareTokenRepository.findById(share.getShareId())).isEmpty();
            assertThat(shareTokenRepository.findById(other.getShareId())).isPresent();
        }
    }
}
