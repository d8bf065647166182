package org.qbitspark.filevaultbackend.sharing_service.service;

import org.qbitspark.filevaultbackend.files_mng_service.payload.FileDownload;
import org.qbitspark.filevaultbackend.globeadvice.exceptions.AccessDeniedException;
import org.qbitspark.filevaultbackend.globeadvice.exceptions.ConflictException;
import org.qbitspark.filevaultbackend.globeadvice.exceptions.FileValidationException;
import org.qbitspark.filevaultbackend.globeadvice.exceptions.ItemNotFoundException;
import org.qbitspark.filevaultbackend.globeadvice.exceptions.ShareExpiredException;
import org.qbitspark.filevaultbackend.globeadvice.exceptions.ShareLimitReachedException;
import org.qbitspark.filevaultbackend.globeadvice.exceptions.UnauthorizedAccessException;
import org.qbitspark.filevaultbackend.globesecurity.AccessContext;
import org.qbitspark.filevaultbackend.sharing_service.payload.CreateShareRequest;
import org.qbitspark.filevaultbackend.sharing_service.payload.ShareAccessResponse;
import org.qbitspark.filevaultbackend.sharing_service.payload.ShareResponse;

import java.util.List;
import java.util.UUID;

public interface ShareService {

    ShareResponse createShare(UUID fileId, CreateShareRequest request, AccessContext context)
            throws ItemNotFoundException, AccessDeniedException, FileValidationException, ConflictException;

    /**
     * Runs every access check without consuming a download. An expired token is deactivated
     * as a side effect.
     */
    ShareAccessResponse validateShare(String token, String password, AccessContext context)
            throws ItemNotFoundException, ShareExpiredException, ShareLimitReachedException,
            AccessDeniedException, UnauthorizedAccessException;

    /**
     * Checks access, reads and verifies the bytes, then consumes one download. Of two
     * concurrent calls against the last remaining download exactly one succeeds.
     */
    FileDownload downloadViaShare(String token, String password, AccessContext context)
            throws ItemNotFoundException, ShareExpiredException, ShareLimitReachedException,
            AccessDeniedException, UnauthorizedAccessException;

    List<ShareResponse> listShares(UUID fileId, AccessContext context)
            throws ItemNotFoundException, AccessDeniedException;

    void revokeShare(UUID shareId, AccessContext context) throws ItemNotFoundException, AccessDeniedException;

    int deactivateExpiredShares();
}
