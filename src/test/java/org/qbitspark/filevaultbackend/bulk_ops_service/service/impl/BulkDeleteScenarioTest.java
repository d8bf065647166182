package org.qbitspark.filevaultbackend.bulk_ops_service.service.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.qbitspark.filevaultbackend.bulk_ops_service.payload.BulkDeleteRequest;
import org.qbitspark.filevaultbackend.bulk_ops_service.payload.BulkOperationResponse;
import org.qbitspark.filevaultbackend.files_mng_service.enums.FileCategory;
import org.qbitspark.filevaultbackend.files_mng_service.enums.FileVisibility;
import org.qbitspark.filevaultbackend.files_mng_service.payload.UploadFileRequest;
import org.qbitspark.filevaultbackend.globesecurity.AccessContext;
import org.qbitspark.filevaultbackend.support.FileVaultFixture;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Bulk deletion over the real file service, checking the stored records rather than calls.
 */
@DisplayName("Bulk delete over mixed selections")
class BulkDeleteScenarioTest {

    private static final byte[] PDF = "%PDF-1.7\nsquad list\n".getBytes(StandardCharsets.US_ASCII);

    private final UUID ownerId = UUID.randomUUID();
    private final AccessContext owner = AccessContext.user(ownerId);
    private final AccessContext rival = AccessContext.user(UUID.randomUUID());

    private FileVaultFixture fixture;
    private BulkOperationServiceImpl bulkService;

    @BeforeEach
    void setUp() {
        fixture = new FileVaultFixture();
        bulkService = new BulkOperationServiceImpl(fixture.fileService, fixture.fileRepository,
                fixture.accessPolicy, fixture.requestValidator);
    }

    private UUID upload(String name, FileVisibility visibility, AccessContext context) throws Exception {
        return fixture.fileService.upload(UploadFileRequest.builder()
                .content(PDF)
                .originalName(name)
                .mimeType("application/pdf")
                .category(FileCategory.DOCUMENT)
                .visibility(visibility)
                .build(), context).getId();
    }

    @Test
    @DisplayName("soft-deletes exactly the caller's files and leaves the rest untouched")
    void deletesOnlyValidIds() throws Exception {
        UUID mine = upload("lineup.pdf", FileVisibility.PRIVATE, owner);
        UUID alsoMine = upload("tactics.pdf", FileVisibility.PRIVATE, owner);
        UUID theirs = upload("scouting.pdf", FileVisibility.PRIVATE, rival);
        UUID theirsPublic = upload("fixtures.pdf", FileVisibility.PUBLIC, rival);
        UUID unknown = UUID.randomUUID();

        BulkOperationResponse response = bulkService.bulkDelete(BulkDeleteRequest.builder()
                .fileIds(List.of(mine, theirs, unknown, theirsPublic, alsoMine))
                .build(), owner);

        assertThat(response.getSuccessfulIds()).containsExactly(mine, alsoMine);
        assertThat(response.getFailures())
                .extracting("fileId", "fileName")
                .containsExactly(
                        tuple(theirs, "Unknown file"),
                        tuple(unknown, "Unknown file"),
                        tuple(theirsPublic, "fixtures.pdf"));

        assertThat(fixture.files.get(mine).isDeleted()).isTrue();
        assertThat(fixture.files.get(mine).getDeletedBy()).isEqualTo(ownerId);
        assertThat(fixture.files.get(alsoMine).isDeleted()).isTrue();
        assertThat(fixture.files.get(theirs).isDeleted()).isFalse();
        assertThat(fixture.files.get(theirsPublic).isDeleted()).isFalse();
        assertThat(fixture.files).doesNotContainKey(unknown).hasSize(4);
    }

    @Test
    @DisplayName("a second pass reports the already deleted files and changes nothing")
    void repeatedDelete() throws Exception {
        UUID mine = upload("lineup.pdf", FileVisibility.PRIVATE, owner);
        bulkService.bulkDelete(BulkDeleteRequest.builder().fileIds(List.of(mine)).build(), owner);

        BulkOperationResponse again = bulkService.bulkDelete(BulkDeleteRequest.builder()
                .fileIds(List.of(mine))
                .build(), owner);

        assertThat(again.getSuccessful()).isZero();
        assertThat(again.getFailed()).isEqualTo(1);
        assertThat(fixture.files.get(mine).isDeleted()).isTrue();
    }
}
