package org.qbitspark.filevaultbackend.sharing_service.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.qbitspark.filevaultbackend.audit_service.enums.AccessAction;
import org.qbitspark.filevaultbackend.audit_service.service.AccessLogService;
import org.qbitspark.filevaultbackend.files_mng_service.entity.FileEntity;
import org.qbitspark.filevaultbackend.files_mng_service.payload.FileDownload;
import org.qbitspark.filevaultbackend.files_mng_service.repo.FileRepository;
import org.qbitspark.filevaultbackend.files_mng_service.service.FileAccessPolicy;
import org.qbitspark.filevaultbackend.globe_utils.RequestValidator;
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
import org.qbitspark.filevaultbackend.sharing_service.repo.ShareTokenRepository;
import org.qbitspark.filevaultbackend.sharing_service.service.ShareService;
import org.qbitspark.filevaultbackend.sharing_service.service.ShareTokenGenerator;
import org.qbitspark.filevaultbackend.storage_service.service.ContentStore;
import org.qbitspark.filevaultbackend.upload_validation_service.enums.ValidationFailure;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.net.URI;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

/**
 * Share links. Access checks and shared downloads run without a surrounding transaction: the
 * deactivation of an expired token commits on its own, and a download is consumed by a single
 * conditional update.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ShareServiceImpl implements ShareService {

    private final ShareTokenRepository shareTokenRepository;
    private final FileRepository fileRepository;
    private final FileAccessPolicy accessPolicy;
    private final ShareTokenGenerator tokenGenerator;
    private final PasswordEncoder passwordEncoder;
    private final ContentStore contentStore;
    private final AccessLogService accessLogService;
    private final RequestValidator requestValidator;
    private final Clock clock;

    @Override
    @Transactional(rollbackFor = Exception.class)
    public ShareResponse createShare(UUID fileId, CreateShareRequest request, AccessContext context)
            throws ItemNotFoundException, AccessDeniedException, FileValidationException, ConflictException {

        requestValidator.validate(request);
        FileEntity file = accessPolicy.loadWritable(fileId, context);
        if (file.isDeleted()) {
            throw new ConflictException("Cannot share deleted file");
        }

        LocalDateTime now = LocalDateTime.now(clock);
        if (request.getExpiresAt() != null && !request.getExpiresAt().isAfter(now)) {
            throw new FileValidationException(ValidationFailure.INVALID_REQUEST, "Share expiry must be in the future");
        }

        ShareTokenEntity share = ShareTokenEntity.builder()
                .fileId(fileId)
                .issuerId(context.getUserId())
                .token(tokenGenerator.generate())
                .expiresAt(request.getExpiresAt())
                .maxDownloads(request.getMaxDownloads())
                .passwordHash(request.getPassword() != null ? passwordEncoder.encode(request.getPassword()) : null)
                .allowedDomains(normalizeDomains(request.getAllowedDomains()))
                .requireAuth(request.isRequireAuth())
                .createdAt(now)
                .build();
        ShareTokenEntity saved = shareTokenRepository.save(share);

        accessLogService.recordSuccess(fileId, context, AccessAction.SHARE_CREATE);
        log.info("Share created for file {} by {} (expires: {}, max downloads: {}, password: {})",
                fileId, context.getUserId(), saved.getExpiresAt(), saved.getMaxDownloads(), saved.hasPassword());
        return toResponse(saved);
    }

    @Override
    public ShareAccessResponse validateShare(String token, String password, AccessContext context)
            throws ItemNotFoundException, ShareExpiredException, ShareLimitReachedException,
            AccessDeniedException, UnauthorizedAccessException {

        ShareTokenEntity share = checkAccess(token, password, context);
        FileEntity file = loadSharedFile(share);
        return ShareAccessResponse.builder()
                .shareId(share.getShareId())
                .fileId(file.getFileId())
                .fileName(file.getOriginalName())
                .mimeType(file.getMimeType())
                .size(file.getFileSize())
                .remainingDownloads(remaining(share))
                .expiresAt(share.getExpiresAt())
                .build();
    }

    @Override
    public FileDownload downloadViaShare(String token, String password, AccessContext context)
            throws ItemNotFoundException, ShareExpiredException, ShareLimitReachedException,
            AccessDeniedException, UnauthorizedAccessException {

        ShareTokenEntity share = findShare(token);
        try {
            checkAccess(share, password, context);
            FileEntity file = loadSharedFile(share);

            // Read and verify before touching the counter
            byte[] content = contentStore.retrieve(file.getStorageKey(), file.getChecksum());

            LocalDateTime now = LocalDateTime.now(clock);
            if (shareTokenRepository.incrementDownloadCount(share.getShareId(), now) == 0) {
                rejectConsume(share.getShareId());
            }
            if (shareTokenRepository.deactivateIfExhausted(share.getShareId()) > 0) {
                log.info("Share {} reached its download limit and was deactivated", share.getShareId());
            }
            fileRepository.recordDownload(file.getFileId(), now);

            accessLogService.recordSuccess(file.getFileId(), context, AccessAction.SHARE_DOWNLOAD);
            log.info("Shared download of file {} via share {}", file.getFileId(), share.getShareId());

            return FileDownload.builder()
                    .fileId(file.getFileId())
                    .fileName(file.getOriginalName())
                    .mimeType(file.getMimeType())
                    .size(content.length)
                    .checksum(file.getChecksum())
                    .content(content)
                    .build();
        } catch (ItemNotFoundException | ShareExpiredException | ShareLimitReachedException
                 | AccessDeniedException | UnauthorizedAccessException | IntegrityException e) {
            accessLogService.recordFailure(share.getFileId(), context, AccessAction.SHARE_DOWNLOAD, e.getMessage());
            throw e;
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<ShareResponse> listShares(UUID fileId, AccessContext context)
            throws ItemNotFoundException, AccessDeniedException {

        accessPolicy.loadWritable(fileId, context);
        return shareTokenRepository.findByFileIdOrderByCreatedAtDesc(fileId).stream()
                .map(this::toResponse)
                .toList();
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public void revokeShare(UUID shareId, AccessContext context) throws ItemNotFoundException, AccessDeniedException {

        ShareTokenEntity share = shareTokenRepository.findById(shareId)
                .orElseThrow(() -> new ItemNotFoundException("Share not found"));
        accessPolicy.loadWritable(share.getFileId(), context);

        if (shareTokenRepository.deactivate(shareId) > 0) {
            accessLogService.recordSuccess(share.getFileId(), context, AccessAction.SHARE_REVOKE);
            log.info("Share {} for file {} revoked", shareId, share.getFileId());
        } else {
            log.debug("Share {} was already inactive", shareId);
        }
    }

    @Override
    public int deactivateExpiredShares() {
        int deactivated = shareTokenRepository.deactivateExpired(LocalDateTime.now(clock));
        if (deactivated > 0) {
            log.info("Deactivated {} expired shares", deactivated);
        }
        return deactivated;
    }

    private ShareTokenEntity checkAccess(String token, String password, AccessContext context)
            throws ItemNotFoundException, ShareExpiredException, ShareLimitReachedException,
            AccessDeniedException, UnauthorizedAccessException {
        ShareTokenEntity share = findShare(token);
        checkAccess(share, password, context);
        return share;
    }

    // Expiry and the download cap are reported as such even after the token was deactivated
    private void checkAccess(ShareTokenEntity share, String password, AccessContext context)
            throws ItemNotFoundException, ShareExpiredException, ShareLimitReachedException,
            AccessDeniedException, UnauthorizedAccessException {

        LocalDateTime now = LocalDateTime.now(clock);
        if (share.isExpiredAt(now)) {
            if (share.isActive() && shareTokenRepository.deactivate(share.getShareId()) > 0) {
                log.info("Share {} expired and was deactivated", share.getShareId());
            }
            throw new ShareExpiredException("Share link has expired");
        }
        if (share.isLimitReached()) {
            if (share.isActive()) {
                shareTokenRepository.deactivateIfExhausted(share.getShareId());
            }
            throw new ShareLimitReachedException("Share link download limit reached");
        }
        if (!share.isActive()) {
            throw new ItemNotFoundException("Share not found");
        }

        if (!share.getAllowedDomains().isEmpty() && !isAllowedOrigin(share.getAllowedDomains(), originOf(context))) {
            log.warn("Share {} accessed from disallowed origin: {}", share.getShareId(), originOf(context));
            throw new AccessDeniedException("Access denied: Domain not allowed for this share");
        }
        if (share.isRequireAuth() && (context == null || !context.isAuthenticated())) {
            throw new UnauthorizedAccessException("Authentication required to access this share");
        }
        if (share.hasPassword()) {
            if (password == null || password.isEmpty()) {
                throw new UnauthorizedAccessException("Password required for this share");
            }
            if (!passwordEncoder.matches(password, share.getPasswordHash())) {
                log.warn("Invalid password supplied for share {}", share.getShareId());
                throw new UnauthorizedAccessException("Invalid share password");
            }
        }
    }

    // The conditional consume matched no row: report why, based on the current state
    private void rejectConsume(UUID shareId)
            throws ItemNotFoundException, ShareExpiredException, ShareLimitReachedException {
        ShareTokenEntity current = shareTokenRepository.findById(shareId)
                .orElseThrow(() -> new ItemNotFoundException("Share not found"));
        if (current.isExpiredAt(LocalDateTime.now(clock))) {
            shareTokenRepository.deactivate(shareId);
            throw new ShareExpiredException("Share link has expired");
        }
        if (current.isLimitReached()) {
            shareTokenRepository.deactivateIfExhausted(shareId);
            log.info("Share {} download limit reached by a concurrent download", shareId);
            throw new ShareLimitReachedException("Share link download limit reached");
        }
        throw new ItemNotFoundException("Share not found");
    }

    private ShareTokenEntity findShare(String token) throws ItemNotFoundException {
        if (token == null || token.isBlank()) {
            throw new ItemNotFoundException("Share not found");
        }
        return shareTokenRepository.findByToken(token)
                .orElseThrow(() -> new ItemNotFoundException("Share not found"));
    }

    private FileEntity loadSharedFile(ShareTokenEntity share) throws ItemNotFoundException {
        FileEntity file = fileRepository.findById(share.getFileId())
                .orElseThrow(() -> new ItemNotFoundException("Share not found"));
        if (file.isDeleted()) {
            throw new ItemNotFoundException("Share not found");
        }
        return file;
    }

    static boolean isAllowedOrigin(Set<String> allowedDomains, String origin) {
        String host = hostOf(origin);
        if (host == null) {
            return false;
        }
        for (String domain : allowedDomains) {
            if (host.equals(domain) || host.endsWith("." + domain)) {
                return true;
            }
        }
        return false;
    }

    static String hostOf(String origin) {
        if (origin == null || origin.isBlank()) {
            return null;
        }
        String value = origin.trim();
        String host;
        if (value.contains("://")) {
            try {
                host = URI.create(value).getHost();
            } catch (IllegalArgumentException e) {
                return null;
            }
        } else {
            int end = value.length();
            for (char separator : new char[]{'/', ':', '?', '#'}) {
                int index = value.indexOf(separator);
                if (index >= 0 && index < end) {
                    end = index;
                }
            }
            host = value.substring(0, end);
        }
        return host == null || host.isEmpty() ? null : host.toLowerCase(Locale.ROOT);
    }

    private static Set<String> normalizeDomains(Set<String> domains) throws FileValidationException {
        Set<String> normalized = new HashSet<>();
        if (domains == null) {
            return normalized;
        }
        for (String domain : domains) {
            if (domain == null || domain.isBlank()) {
                throw new FileValidationException(ValidationFailure.INVALID_REQUEST, "Allowed domains cannot be blank");
            }
            normalized.add(domain.trim().toLowerCase(Locale.ROOT));
        }
        return normalized;
    }

    private static String originOf(AccessContext context) {
        return context != null ? context.getOrigin() : null;
    }

    private static Integer remaining(ShareTokenEntity share) {
        return share.getMaxDownloads() != null
                ? Math.max(0, share.getMaxDownloads() - share.getDownloadCount())
                : null;
    }

    private ShareResponse toResponse(ShareTokenEntity share) {
        List<String> domains = new ArrayList<>(share.getAllowedDomains());
        domains.sort(null);
        return ShareResponse.builder()
                .shareId(share.getShareId())
                .fileId(share.getFileId())
                .issuerId(share.getIssuerId())
                .token(share.getToken())
                .expiresAt(share.getExpiresAt())
                .maxDownloads(share.getMaxDownloads())
                .downloadCount(share.getDownloadCount())
                .remainingDownloads(remaining(share))
                .passwordProtected(share.hasPassword())
                .allowedDomains(domains)
                .requireAuth(share.isRequireAuth())
                .active(share.isActive())
                .createdAt(share.getCreatedAt())
                .lastAccessedAt(share.getLastAccessedAt())
                .build();
    }
}
