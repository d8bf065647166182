package org.qbitspark.filevaultbackend.versioning_service.repo;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.qbitspark.filevaultbackend.versioning_service.entity.FileVersionEntity;
import org.qbitspark.filevaultbackend.versioning_service.enums.ChangeType;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@DisplayName("FileVersionRepository")
class FileVersionRepositoryTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 3, 5, 9, 30);

    @Autowired
    private FileVersionRepository versionRepository;

    @AfterEach
    void cleanUp() {
        versionRepository.deleteAll();
    }

    private static FileVersionEntity entry(UUID fileId, String version, String storageKey) {
        return FileVersionEntity.builder()
                .fileId(fileId)
                .version(new BigDecimal(version))
                .checksum("a".repeat(64))
                .fileSize(2048L)
                .storageKey(storageKey)
                .changeSummary("Version " + version)
                .changeType(ChangeType.UPDATE)
                .createdAt(NOW)
                .build();
    }

    @Test
    @DisplayName("a second entry with the same label for the same file is rejected")
    void duplicateLabelRejected() {
        UUID fileId = UUID.randomUUID();
        versionRepository.saveAndFlush(entry(fileId, "1.10", "document/a.pdf"));

        assertThatThrownBy(() -> versionRepository.saveAndFlush(entry(fileId, "1.10", "document/b.pdf")))
                .isInstanceOf(DataIntegrityViolationException.class);

        assertThat(versionRepository.findByFileIdOrderByVersionDesc(fileId, PageRequest.of(0, 10)))
                .extracting(FileVersionEntity::getStorageKey)
                .containsExactly("document/a.pdf");
    }

    @Test
    @DisplayName("the same label is allowed on different files")
    void sameLabelOtherFile() {
        versionRepository.saveAndFlush(entry(UUID.randomUUID(), "1.00", "document/a.pdf"));
        versionRepository.saveAndFlush(entry(UUID.randomUUID(), "1.00", "document/b.pdf"));

        assertThat(versionRepository.count()).isEqualTo(2);
    }

    @Test
    @DisplayName("finds the newest label and the distinct revisions of a file")
    void newestAndStorageKeys() {
        UUID fileId = UUID.randomUUID();
        versionRepository.saveAndFlush(entry(fileId, "1.00", "document/a.pdf"));
        versionRepository.saveAndFlush(entry(fileId, "1.10", "document/a.pdf"));
        versionRepository.saveAndFlush(entry(fileId, "2.00", "document/b.pdf"));

        assertThat(versionRepository.findTopByFileIdOrderByVersionDesc(fileId).orElseThrow().getVersion())
                .isEqualByComparingTo("2.00");
        assertThat(versionRepository.findByFileIdAndVersion(fileId, new BigDecimal("1.10"))).isPresent();
        assertThat(versionRepository.findStorageKeysByFileId(fileId))
                .containsExactlyInAnyOrder("document/a.pdf", "document/b.pdf");
    }
}
