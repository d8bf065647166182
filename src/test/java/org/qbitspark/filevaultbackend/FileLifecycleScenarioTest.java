package org.qbitspark.filevaultbackend;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.qbitspark.filevaultbackend.files_mng_service.enums.FileCategory;
import org.qbitspark.filevaultbackend.files_mng_service.payload.FileDownload;
import org.qbitspark.filevaultbackend.files_mng_service.payload.FileResponse;
import org.qbitspark.filevaultbackend.files_mng_service.payload.UploadFileRequest;
import org.qbitspark.filevaultbackend.globeadvice.exceptions.FileValidationException;
import org.qbitspark.filevaultbackend.globeadvice.exceptions.ShareLimitReachedException;
import org.qbitspark.filevaultbackend.globesecurity.AccessContext;
import org.qbitspark.filevaultbackend.sharing_service.payload.CreateShareRequest;
import org.qbitspark.filevaultbackend.sharing_service.payload.ShareResponse;
import org.qbitspark.filevaultbackend.support.FileVaultFixture;
import org.qbitspark.filevaultbackend.support.TestImages;
import org.qbitspark.filevaultbackend.upload_validation_service.enums.ValidationFailure;
import org.qbitspark.filevaultbackend.versioning_service.entity.FileVersionEntity;
import org.qbitspark.filevaultbackend.versioning_service.enums.ChangeType;
import org.qbitspark.filevaultbackend.versioning_service.enums.VersionBump;
import org.qbitspark.filevaultbackend.versioning_service.payload.CreateVersionRequest;
import org.qbitspark.filevaultbackend.versioning_service.payload.RestoreVersionRequest;
import org.qbitspark.filevaultbackend.versioning_service.payload.VersionDiffResponse;
import org.qbitspark.filevaultbackend.versioning_service.payload.VersionRestoreResponse;

import java.math.BigDecimal;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * A player photo going through upload, revision, restore, sharing and purge against the
 * real services.
 */
@DisplayName("File lifecycle")
class FileLifecycleScenarioTest {

    private final FileVaultFixture fixture = new FileVaultFixture();
    private final UUID coachId = UUID.randomUUID();
    private final AccessContext coach = AccessContext.user(coachId);

    @Test
    @DisplayName("upload, revise, restore with backup, share and purge a player photo")
    void playerPhotoLifecycle() throws Exception {
        byte[] original = TestImages.jpegPaddedTo(64, 48, 2 * 1024 * 1024);
        byte[] cropped = TestImages.jpeg(128, 96);

        FileResponse uploaded = fixture.fileService.upload(UploadFileRequest.builder()
                .content(original)
                .originalName("striker.jpg")
                .mimeType("image/jpeg")
                .category(FileCategory.PLAYER_PHOTO)
                .build(), coach);
        UUID fileId = uploaded.getId();

        assertThat(uploaded.getVersion()).isEqualByComparingTo("1.00");
        assertThat(uploaded.getMetadata()).containsEntry("width", 64).containsEntry("height", 48);

        fixture.versionService.createVersion(fileId, CreateVersionRequest.builder()
                .changeSummary("Cropped to the face")
                .changeType(ChangeType.UPDATE)
                .bump(VersionBump.MINOR)
                .content(cropped)
                .build(), coach);
        assertThat(fixture.files.get(fileId).getVersion()).isEqualByComparingTo("1.10");

        VersionRestoreResponse restored = fixture.versionService.restoreVersion(fileId, RestoreVersionRequest.builder()
                .targetVersion(new BigDecimal("1.00"))
                .createBackup(true)
                .build(), coach);

        assertThat(restored.getBackup().getVersion()).isEqualByComparingTo("1.11");
        assertThat(fixture.files.get(fileId).getVersion()).isEqualByComparingTo("1.00");
        assertThat(fixture.versionsOf(fileId))
                .extracting(FileVersionEntity::getChangeType)
                .containsExactly(ChangeType.CREATE, ChangeType.UPDATE, ChangeType.BACKUP);
        assertThat(fixture.fileService.download(fileId, coach).getContent()).isEqualTo(original);

        VersionDiffResponse diff = fixture.versionService.compareVersions(fileId,
                new BigDecimal("1.00"), new BigDecimal("1.11"), coach);
        assertThat(diff.getChanges())
                .extracting(VersionDiffResponse.FieldChange::getField)
                .contains("checksum", "fileSize", "storageKey");

        ShareResponse share = fixture.shareService.createShare(fileId, CreateShareRequest.builder()
                .maxDownloads(1)
                .password("matchday")
                .build(), coach);
        AccessContext fan = AccessContext.anonymous("https://club.example");

        FileDownload shared = fixture.shareService.downloadViaShare(share.getToken(), "matchday", fan);
        assertThat(shared.getContent()).isEqualTo(original);
        assertThatThrownBy(() -> fixture.shareService.downloadViaShare(share.getToken(), "matchday", fan))
                .isInstanceOf(ShareLimitReachedException.class);
        assertThat(fixture.files.get(fileId).getDownloadCount()).isEqualTo(2L);

        fixture.fileService.purgeFile(fileId, AccessContext.admin(UUID.randomUUID()));

        assertThat(fixture.files).isEmpty();
        assertThat(fixture.versions).isEmpty();
        assertThat(fixture.shares).isEmpty();
        assertThat(fixture.storage.keys()).isEmpty();
    }

    @Test
    @DisplayName("a photo above the category limit is rejected before anything is stored")
    void oversizedPhoto() {
        byte[] huge = TestImages.jpegPaddedTo(64, 48, 10 * 1024 * 1024 + 1);

        assertThatThrownBy(() -> fixture.fileService.upload(UploadFileRequest.builder()
                .content(huge)
                .originalName("panorama.jpg")
                .mimeType("image/jpeg")
                .category(FileCategory.PLAYER_PHOTO)
                .build(), coach))
                .isInstanceOf(FileValidationException.class)
                .hasMessageContaining("10MB")
                .extracting("failure").isEqualTo(ValidationFailure.FILE_TOO_LARGE);
        assertThat(fixture.storage.keys()).isEmpty();
    }
}
