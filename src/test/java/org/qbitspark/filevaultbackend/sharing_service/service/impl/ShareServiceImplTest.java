package org.qbitspark.filevaultbackend.sharing_service.service.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.qbitspark.filevaultbackend.audit_service.enums.AccessAction;
import org.qbitspark.filevaultbackend.files_mng_service.enums.FileCategory;
import org.qbitspark.filevaultbackend.files_mng_service.payload.FileDownload;
import org.qbitspark.filevaultbackend.files_mng_service.payload.UploadFileRequest;
import org.qbitspark.filevaultbackend.globeadvice.exceptions.AccessDeniedException;
import org.qbitspark.filevaultbackend.globeadvice.exceptions.ConflictException;
import org.qbitspark.filevaultbackend.globeadvice.exceptions.FileValidationException;
import org.qbitspark.filevaultbackend.globeadvice.exceptions.IntegrityException;
import org.qbitspark.filevaultbackend.globeadvice.exceptions.ItemNotFoundException;
import org.qbitspark.filevaultbackend.globeadvice.exceptions.ShareExpiredException;
import org.qbitspark.filevaultbackend.globeadvice.exceptions.ShareLimitReachedException;
import org.qbitspark.filevaultbackend.globeadvice.exceptions.UnauthorizedAccessException;
import org.qbitspark.filevaultbackend.globesecurity.AccessContext;
import org.qbitspark.filevaultbackend.sharing_service.entity.ShareTokenEntity;
import org.qbitspark.filevaultbackend.sharing_service.payload.CreateShareRequest;
import org.qbitspark.filevaultbackend.sharing_service.payload.ShareAccessResponse;
import org.qbitspark.filevaultbackend.sharing_service.payload.ShareResponse;
import org.qbitspark.filevaultbackend.support.FileVaultFixture;
import org.qbitspark.filevaultbackend.upload_validation_service.enums.ValidationFailure;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@DisplayName("ShareServiceImpl")
class ShareServiceImplTest {

    private static final byte[] PDF = "%PDF-1.5\nquarterly numbers\n".getBytes(StandardCharsets.US_ASCII);

    private final UUID ownerId = UUID.randomUUID();
    private final AccessContext owner = AccessContext.user(ownerId);
    private final AccessContext visitor = AccessContext.anonymous(null);

    private FileVaultFixture fixture;
    private ShareServiceImpl shareService;
    private UUID fileId;

    @BeforeEach
    void setUp() throws Exception {
        fixture = new FileVaultFixture();
        shareService = fixture.shareService;
        fileId = fixture.fileService.upload(UploadFileRequest.builder()
                .content(PDF)
                .originalName("q3.pdf")
                .mimeType("application/pdf")
                .category(FileCategory.REPORT)
                .build(), owner).getId();
    }

    private ShareResponse share(CreateShareRequest request) throws Exception {
        return shareService.createShare(fileId, request, owner);
    }

    private ShareTokenEntity stored(ShareResponse share) {
        return fixture.shares.get(share.getShareId());
    }

    @Nested
    @DisplayName("createShare")
    class Create {

        @Test
        @DisplayName("issues an opaque token and stores only the password hash")
        void createsShare() throws Exception {
            ShareResponse share = share(CreateShareRequest.builder()
                    .password("s3cret")
                    .maxDownloads(3)
                    .expiresAt(fixture.now().plusDays(1))
                    .allowedDomains(Set.of(" Example.COM ", "partner.org"))
                    .build());

            assertThat(share.getToken()).hasSize(43).matches("[A-Za-z0-9_-]+");
            assertThat(share.isPasswordProtected()).isTrue();
            assertThat(share.getRemainingDownloads()).isEqualTo(3);
            assertThat(share.getAllowedDomains()).containsExactly("example.com", "partner.org");
            assertThat(share.getIssuerId()).isEqualTo(ownerId);
            assertThat(stored(share).getPasswordHash())
                    .isNotEqualTo("s3cret")
                    .satisfies(hash -> assertThat(fixture.passwordEncoder.matches("s3cret", hash)).isTrue());
            verify(fixture.accessLogService).recordSuccess(fileId, owner, AccessAction.SHARE_CREATE);
        }

        @Test
        @DisplayName("every share gets a distinct token")
        void distinctTokens() throws Exception {
            assertThat(share(CreateShareRequest.builder().build()).getToken())
                    .isNotEqualTo(share(CreateShareRequest.builder().build()).getToken());
        }

        @Test
        @DisplayName("expiry must lie in the future")
        void pastExpiry() {
            assertThatThrownBy(() -> share(CreateShareRequest.builder().expiresAt(fixture.now()).build()))
                    .isInstanceOf(FileValidationException.class)
                    .extracting("failure").isEqualTo(ValidationFailure.INVALID_REQUEST);
        }

        @Test
        @DisplayName("a download cap must be positive")
        void zeroCap() {
            assertThatThrownBy(() -> share(CreateShareRequest.builder().maxDownloads(0).build()))
                    .isInstanceOf(FileValidationException.class)
                    .hasMessageContaining("Max downloads must be at least 1");
        }

        @Test
        @DisplayName("only the owner can share a file")
        void ownerOnly() {
            assertThatThrownBy(() -> shareService.createShare(fileId, CreateShareRequest.builder().build(),
                    AccessContext.user(UUID.randomUUID())))
                    .isInstanceOf(AccessDeniedException.class);
        }

        @Test
        @DisplayName("deleted files cannot be shared")
        void deletedFile() throws Exception {
            fixture.fileService.softDeleteFile(fileId, owner);

            assertThatThrownBy(() -> shareService.createShare(fileId, CreateShareRequest.builder().build(),
                    AccessContext.admin(UUID.randomUUID())))
                    .isInstanceOf(ConflictException.class);
        }
    }

    @Nested
    @DisplayName("access checks")
    class AccessChecks {

        @Test
        @DisplayName("valid shares describe the file without consuming a download")
        void validShare() throws Exception {
            ShareResponse share = share(CreateShareRequest.builder().maxDownloads(2).build());

            ShareAccessResponse access = shareService.validateShare(share.getToken(), null, visitor);

            assertThat(access.getFileId()).isEqualTo(fileId);
            assertThat(access.getFileName()).isEqualTo("q3.pdf");
            assertThat(access.getSize()).isEqualTo((long) PDF.length);
            assertThat(access.getRemainingDownloads()).isEqualTo(2);
            assertThat(stored(share).getDownloadCount()).isZero();
        }

        @Test
        @DisplayName("unknown or blank tokens are not found")
        void unknownToken() {
            assertThatThrownBy(() -> shareService.validateShare("no-such-token", null, visitor))
                    .isInstanceOf(ItemNotFoundException.class);
            assertThatThrownBy(() -> shareService.validateShare(" ", null, visitor))
                    .isInstanceOf(ItemNotFoundException.class);
        }

        @Test
        @DisplayName("expired shares are deactivated and keep reporting expiry")
        void expired() throws Exception {
            ShareResponse share = share(CreateShareRequest.builder().expiresAt(fixture.now().plusHours(1)).build());
            fixture.clock.advance(Duration.ofHours(1));

            assertThatThrownBy(() -> shareService.validateShare(share.getToken(), null, visitor))
                    .isInstanceOf(ShareExpiredException.class);
            assertThat(stored(share).isActive()).isFalse();
            assertThatThrownBy(() -> shareService.validateShare(share.getToken(), null, visitor))
                    .isInstanceOf(ShareExpiredException.class);
        }

        @Test
        @DisplayName("revoked shares are not found")
        void revoked() throws Exception {
            ShareResponse share = share(CreateShareRequest.builder().build());
            shareService.revokeShare(share.getShareId(), owner);

            assertThatThrownBy(() -> shareService.validateShare(share.getToken(), null, visitor))
                    .isInstanceOf(ItemNotFoundException.class);
        }

        @Test
        @DisplayName("domain restrictions accept the domain and its subdomains only")
        void domains() throws Exception {
            ShareResponse share = share(CreateShareRequest.builder().allowedDomains(Set.of("example.com")).build());

            assertThat(shareService.validateShare(share.getToken(), null,
                    AccessContext.anonymous("https://cdn.example.com/page")).getFileId()).isEqualTo(fileId);
            assertThat(shareService.validateShare(share.getToken(), null,
                    AccessContext.anonymous("example.com")).getFileId()).isEqualTo(fileId);
            assertThatThrownBy(() -> shareService.validateShare(share.getToken(), null,
                    AccessContext.anonymous("https://notexample.com")))
                    .isInstanceOf(AccessDeniedException.class);
            assertThatThrownBy(() -> shareService.validateShare(share.getToken(), null, visitor))
                    .isInstanceOf(AccessDeniedException.class);
        }

        @Test
        @DisplayName("authenticated-only shares reject anonymous callers")
        void requireAuth() throws Exception {
            ShareResponse share = share(CreateShareRequest.builder().requireAuth(true).build());

            assertThatThrownBy(() -> shareService.validateShare(share.getToken(), null, visitor))
                    .isInstanceOf(UnauthorizedAccessException.class);
            assertThat(shareService.validateShare(share.getToken(), null, AccessContext.user(UUID.randomUUID()))
                    .getFileId()).isEqualTo(fileId);
        }

        @Test
        @DisplayName("password-protected shares need the right password")
        void password() throws Exception {
            ShareResponse share = share(CreateShareRequest.builder().password("open sesame").build());

            assertThatThrownBy(() -> shareService.validateShare(share.getToken(), null, visitor))
                    .isInstanceOf(UnauthorizedAccessException.class)
                    .hasMessageContaining("Password required");
            assertThatThrownBy(() -> shareService.validateShare(share.getToken(), "guess", visitor))
                    .isInstanceOf(UnauthorizedAccessException.class)
                    .hasMessageContaining("Invalid share password");
            assertThat(shareService.validateShare(share.getToken(), "open sesame", visitor).getFileId())
                    .isEqualTo(fileId);
        }

        @Test
        @DisplayName("shares of a deleted file stop working")
        void deletedFile() throws Exception {
            ShareResponse share = share(CreateShareRequest.builder().build());
            fixture.fileService.softDeleteFile(fileId, owner);

            assertThatThrownBy(() -> shareService.validateShare(share.getToken(), null, visitor))
                    .isInstanceOf(ItemNotFoundException.class);
        }

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({
                "https://Example.com:8443/path, example.com",
                "http://cdn.example.com,        cdn.example.com",
                "example.com/landing,           example.com",
                "example.com:443,               example.com",
                "'   ',                         ",
        })
        @DisplayName("origins are reduced to their lower-case host")
        void hostOf(String origin, String host) {
            assertThat(ShareServiceImpl.hostOf(origin)).isEqualTo(host);
        }
    }

    @Nested
    @DisplayName("downloadViaShare")
    class Download {

        @Test
        @DisplayName("returns verified bytes and counts the download on share and file")
        void downloads() throws Exception {
            ShareResponse share = share(CreateShareRequest.builder().maxDownloads(5).build());

            FileDownload download = shareService.downloadViaShare(share.getToken(), null, visitor);

            assertThat(download.getContent()).isEqualTo(PDF);
            assertThat(download.getFileName()).isEqualTo("q3.pdf");
            assertThat(stored(share).getDownloadCount()).isEqualTo(1);
            assertThat(stored(share).getLastAccessedAt()).isEqualTo(fixture.now());
            assertThat(fixture.files.get(fileId).getDownloadCount()).isEqualTo(1L);
            verify(fixture.accessLogService).recordSuccess(fileId, visitor, AccessAction.SHARE_DOWNLOAD);
        }

        @Test
        @DisplayName("the last allowed download deactivates the share")
        void lastDownload() throws Exception {
            ShareResponse share = share(CreateShareRequest.builder().maxDownloads(1).build());

            shareService.downloadViaShare(share.getToken(), null, visitor);

            assertThat(stored(share).isActive()).isFalse();
            assertThatThrownBy(() -> shareService.downloadViaShare(share.getToken(), null, visitor))
                    .isInstanceOf(ShareLimitReachedException.class);
            assertThat(stored(share).getDownloadCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("tampered content is refused without consuming a download")
        void tampered() throws Exception {
            ShareResponse share = share(CreateShareRequest.builder().maxDownloads(1).build());
            fixture.storage.corrupt(fixture.files.get(fileId).getStorageKey());

            assertThatThrownBy(() -> shareService.downloadViaShare(share.getToken(), null, visitor))
                    .isInstanceOf(IntegrityException.class);
            assertThat(stored(share).getDownloadCount()).isZero();
            assertThat(stored(share).isActive()).isTrue();
        }

        @Test
        @DisplayName("concurrent downloads never exceed the cap")
        void concurrentDownloads() throws Exception {
            ShareResponse share = share(CreateShareRequest.builder().maxDownloads(1).build());
            int callers = 8;
            ExecutorService executor = Executors.newFixedThreadPool(callers);
            CountDownLatch start = new CountDownLatch(1);
            try {
                List<Future<FileDownload>> results = new ArrayList<>();
                for (int i = 0; i < callers; i++) {
                    Callable<FileDownload> attempt = () -> {
                        start.await();
                        return shareService.downloadViaShare(share.getToken(), null, visitor);
                    };
                    results.add(executor.submit(attempt));
                }
                start.countDown();

                int succeeded = 0;
                int limited = 0;
                for (Future<FileDownload> result : results) {
                    try {
                        result.get(10, TimeUnit.SECONDS);
                        succeeded++;
                    } catch (ExecutionException e) {
                        assertThat(e.getCause()).isInstanceOf(ShareLimitReachedException.class);
                        limited++;
                    }
                }

                assertThat(succeeded).isEqualTo(1);
                assertThat(limited).isEqualTo(callers - 1);
                assertThat(stored(share).getDownloadCount()).isEqualTo(1);
            } finally {
                executor.shutdownNow();
            }
        }
    }

    @Nested
    @DisplayName("management")
    class Management {

        @Test
        @DisplayName("lists the shares of a file newest first")
        void listShares() throws Exception {
            ShareResponse first = share(CreateShareRequest.builder().build());
            fixture.clock.advance(Duration.ofMinutes(1));
            ShareResponse second = share(CreateShareRequest.builder().build());

            assertThat(shareService.listShares(fileId, owner))
                    .extracting(ShareResponse::getShareId)
                    .containsExactly(second.getShareId(), first.getShareId());
            assertThatThrownBy(() -> shareService.listShares(fileId, AccessContext.user(UUID.randomUUID())))
                    .isInstanceOf(AccessDeniedException.class);
        }

        @Test
        @DisplayName("revoking twice is harmless and audited once")
        void revokeIsIdempotent() throws Exception {
            ShareResponse share = share(CreateShareRequest.builder().build());

            shareService.revokeShare(share.getShareId(), owner);
            shareService.revokeShare(share.getShareId(), owner);

            assertThat(stored(share).isActive()).isFalse();
            verify(fixture.accessLogService, times(1)).recordSuccess(fileId, owner, AccessAction.SHARE_REVOKE);
        }

        @Test
        @DisplayName("only the file owner can revoke")
        void revokeOwnerOnly() throws Exception {
            ShareResponse share = share(CreateShareRequest.builder().build());

            assertThatThrownBy(() -> shareService.revokeShare(share.getShareId(), AccessContext.user(UUID.randomUUID())))
                    .isInstanceOf(AccessDeniedException.class);
            assertThatThrownBy(() -> shareService.revokeShare(UUID.randomUUID(), owner))
                    .isInstanceOf(ItemNotFoundException.class);
        }

        @Test
        @DisplayName("the sweep deactivates only expired shares")
        void sweep() throws Exception {
            ShareResponse soon = share(CreateShareRequest.builder().expiresAt(fixture.now().plusMinutes(5)).build());
            ShareResponse later = share(CreateShareRequest.builder().expiresAt(fixture.now().plusDays(5)).build());
            ShareResponse never = share(CreateShareRequest.builder().build());
            fixture.clock.advance(Duration.ofHours(1));

            assertThat(shareService.deactivateExpiredShares()).isEqualTo(1);
            assertThat(stored(soon).isActive()).isFalse();
            assertThat(stored(later).isActive()).isTrue();
            assertThat(stored(never).isActive()).isTrue();
        }
    }
}
