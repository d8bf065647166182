package org.qbitspark.filevaultbackend.bulk_ops_service.service.impl;

import jakarta.validation.Validation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.qbitspark.filevaultbackend.bulk_ops_service.payload.BulkCopyRequest;
import org.qbitspark.filevaultbackend.bulk_ops_service.payload.BulkDeleteRequest;
import org.qbitspark.filevaultbackend.bulk_ops_service.payload.BulkMoveRequest;
import org.qbitspark.filevaultbackend.bulk_ops_service.payload.BulkOperationResponse;
import org.qbitspark.filevaultbackend.bulk_ops_service.payload.BulkTagRequest;
import org.qbitspark.filevaultbackend.files_mng_service.entity.FileEntity;
import org.qbitspark.filevaultbackend.files_mng_service.enums.FileCategory;
import org.qbitspark.filevaultbackend.files_mng_service.enums.TagOperation;
import org.qbitspark.filevaultbackend.files_mng_service.repo.FileRepository;
import org.qbitspark.filevaultbackend.files_mng_service.service.FileAccessPolicy;
import org.qbitspark.filevaultbackend.files_mng_service.service.FileService;
import org.qbitspark.filevaultbackend.globe_utils.RequestValidator;
import org.qbitspark.filevaultbackend.globeadvice.exceptions.ConflictException;
import org.qbitspark.filevaultbackend.globeadvice.exceptions.FileValidationException;
import org.qbitspark.filevaultbackend.globeadvice.exceptions.ItemNotFoundException;
import org.qbitspark.filevaultbackend.globesecurity.AccessContext;
import org.qbitspark.filevaultbackend.support.FileEntityTestBuilder;
import org.qbitspark.filevaultbackend.upload_validation_service.enums.ValidationFailure;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("BulkOperationServiceImpl")
class BulkOperationServiceImplTest {

    @Mock
    private FileService fileService;

    @Mock
    private FileRepository fileRepository;

    private BulkOperationServiceImpl bulkService;

    private final UUID userId = UUID.randomUUID();
    private final AccessContext user = AccessContext.user(userId);
    private final AccessContext admin = AccessContext.admin(UUID.randomUUID());

    private final UUID first = UUID.randomUUID();
    private final UUID second = UUID.randomUUID();
    private final UUID third = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        bulkService = new BulkOperationServiceImpl(fileService, fileRepository, new FileAccessPolicy(fileRepository),
                new RequestValidator(Validation.buildDefaultValidatorFactory().getValidator()));
    }

    @Nested
    @DisplayName("batch validation")
    class BatchValidation {

        @Test
        @DisplayName("duplicate and null ids are processed once")
        void deduplicates() throws Exception {
            BulkOperationResponse response = bulkService.bulkDelete(BulkDeleteRequest.builder()
                    .fileIds(Arrays.asList(first, second, first, null))
                    .build(), user);

            assertThat(response.getTotalRequested()).isEqualTo(2);
            assertThat(response.getSuccessfulIds()).containsExactly(first, second);
            verify(fileService, times(1)).softDeleteFile(first, user);
        }

        @Test
        @DisplayName("an empty selection is rejected")
        void emptySelection() {
            assertThatThrownBy(() -> bulkService.bulkDelete(BulkDeleteRequest.builder()
                    .fileIds(List.of())
                    .build(), user))
                    .isInstanceOf(FileValidationException.class)
                    .extracting("failure").isEqualTo(ValidationFailure.INVALID_REQUEST);
            assertThatThrownBy(() -> bulkService.bulkDelete(BulkDeleteRequest.builder()
                    .fileIds(Arrays.asList(null, null))
                    .build(), user))
                    .isInstanceOf(FileValidationException.class)
                    .hasMessageContaining("At least one file");
            verifyNoInteractions(fileService);
        }

        @Test
        @DisplayName("batches above 100 files are rejected before any work is done")
        void tooMany() {
            List<UUID> ids = IntStream.range(0, 101).mapToObj(i -> UUID.randomUUID()).collect(Collectors.toList());

            assertThatThrownBy(() -> bulkService.bulkMove(BulkMoveRequest.builder()
                    .fileIds(ids)
                    .targetCategory(FileCategory.REPORT)
                    .build(), user))
                    .isInstanceOf(FileValidationException.class)
                    .hasMessageContaining("100");
            verifyNoInteractions(fileService);
        }

        @Test
        @DisplayName("exactly 100 files are accepted")
        void atLimit() throws Exception {
            List<UUID> ids = new ArrayList<>();
            IntStream.range(0, 100).forEach(i -> ids.add(UUID.randomUUID()));

            BulkOperationResponse response = bulkService.bulkTag(BulkTagRequest.builder()
                    .fileIds(ids)
                    .operation(TagOperation.ADD)
                    .tags(Set.of("season-2024"))
                    .build(), user);

            assertThat(response.getSuccessful()).isEqualTo(100);
        }

        @Test
        @DisplayName("a move needs a target category")
        void moveNeedsTarget() {
            assertThatThrownBy(() -> bulkService.bulkMove(BulkMoveRequest.builder()
                    .fileIds(List.of(first))
                    .build(), user))
                    .isInstanceOf(FileValidationException.class);
            verifyNoInteractions(fileService);
        }
    }

    @Nested
    @DisplayName("per-item outcomes")
    class Outcomes {

        @Test
        @DisplayName("failures are collected while the rest of the batch continues")
        void partialFailure() throws Exception {
            FileEntity visible = FileEntityTestBuilder.aFile(userId).fileId(second).originalName("lineup.json").build();
            when(fileRepository.findById(second)).thenReturn(Optional.of(visible));
            // first succeeds, so these two stubs see a non-matching call before they are used
            lenient().doThrow(new ConflictException("Cannot move deleted file"))
                    .when(fileService).changeCategory(second, FileCategory.FORMATION, user);
            lenient().doThrow(new ItemNotFoundException("File not found"))
                    .when(fileService).changeCategory(third, FileCategory.FORMATION, user);

            BulkOperationResponse response = bulkService.bulkMove(BulkMoveRequest.builder()
                    .fileIds(List.of(first, second, third))
                    .targetCategory(FileCategory.FORMATION)
                    .build(), user);

            assertThat(response.getOperation()).isEqualTo("move");
            assertThat(response.getSuccessful()).isEqualTo(1);
            assertThat(response.getFailed()).isEqualTo(2);
            assertThat(response.getSuccessfulIds()).containsExactly(first);
            assertThat(response.getFailures())
                    .extracting(BulkOperationResponse.FailedOperation::getFileId,
                            BulkOperationResponse.FailedOperation::getFileName,
                            BulkOperationResponse.FailedOperation::getReason)
                    .containsExactly(
                            tuple(second, "lineup.json", "Cannot move deleted file"),
                            tuple(third, "Unknown file", "File not found"));
            assertThat(response.getSummary()).isEqualTo("Bulk move succeeded for 1 file(s), 2 failed");
        }

        @Test
        @DisplayName("names of files the caller cannot read are not disclosed")
        void hidesForeignNames() throws Exception {
            FileEntity foreign = FileEntityTestBuilder.aFile(UUID.randomUUID()).fileId(first).originalName("secret.pdf").build();
            when(fileRepository.findById(first)).thenReturn(Optional.of(foreign));
            doThrow(new ConflictException("File already deleted")).when(fileService).softDeleteFile(first, user);

            BulkOperationResponse response = bulkService.bulkDelete(BulkDeleteRequest.builder()
                    .fileIds(List.of(first))
                    .build(), user);

            assertThat(response.getFailures()).singleElement()
                    .extracting(BulkOperationResponse.FailedOperation::getFileName).isEqualTo("Unknown file");
            assertThat(response.getSummary()).isEqualTo("Bulk delete failed for all 1 file(s)");
        }

        @Test
        @DisplayName("permanent deletion needs administrator privileges for every item")
        void permanentDelete() throws Exception {
            BulkOperationResponse denied = bulkService.bulkDelete(BulkDeleteRequest.builder()
                    .fileIds(List.of(first, second))
                    .permanent(true)
                    .build(), user);

            assertThat(denied.getFailed()).isEqualTo(2);
            assertThat(denied.getFailures()).allSatisfy(failure ->
                    assertThat(failure.getReason()).contains("requires administrator privileges"));
            verify(fileService, never()).purgeFile(any(), any());

            BulkOperationResponse purged = bulkService.bulkDelete(BulkDeleteRequest.builder()
                    .fileIds(List.of(first, second))
                    .permanent(true)
                    .build(), admin);

            assertThat(purged.getSummary()).isEqualTo("Bulk delete succeeded for 2 file(s)");
            verify(fileService).purgeFile(first, admin);
            verify(fileService).purgeFile(second, admin);
            verify(fileService, never()).softDeleteFile(any(), any());
        }

        @Test
        @DisplayName("copies keep each file's category unless a target is given")
        void copy() throws Exception {
            bulkService.bulkCopy(BulkCopyRequest.builder().fileIds(List.of(first)).build(), user);
            bulkService.bulkCopy(BulkCopyRequest.builder()
                    .fileIds(List.of(second))
                    .targetCategory(FileCategory.ARCHIVE)
                    .build(), user);

            verify(fileService).copyFile(first, null, user);
            verify(fileService).copyFile(second, FileCategory.ARCHIVE, user);
        }

        @Test
        @DisplayName("tag operations are forwarded unchanged")
        void tag() throws Exception {
            Set<String> tags = Set.of("archived");

            BulkOperationResponse response = bulkService.bulkTag(BulkTagRequest.builder()
                    .fileIds(List.of(first, second))
                    .operation(TagOperation.REMOVE)
                    .tags(tags)
                    .build(), user);

            assertThat(response.getOperation()).isEqualTo("tag");
            verify(fileService).applyTags(first, TagOperation.REMOVE, tags, user);
            verify(fileService).applyTags(second, TagOperation.REMOVE, tags, user);
        }
    }
}
