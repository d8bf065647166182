package org.qbitspark.filevaultbackend.bulk_ops_service.service;

import org.qbitspark.filevaultbackend.bulk_ops_service.payload.BulkCopyRequest;
import org.qbitspark.filevaultbackend.bulk_ops_service.payload.BulkDeleteRequest;
import org.qbitspark.filevaultbackend.bulk_ops_service.payload.BulkMoveRequest;
import org.qbitspark.filevaultbackend.bulk_ops_service.payload.BulkOperationResponse;
import org.qbitspark.filevaultbackend.bulk_ops_service.payload.BulkTagRequest;
import org.qbitspark.filevaultbackend.globeadvice.exceptions.FileValidationException;
import org.qbitspark.filevaultbackend.globesecurity.AccessContext;

/**
 * Batch operations over at most 100 distinct files. Each file is handled in its own
 * transaction; a failing file is reported and the rest of the batch still runs.
 */
public interface BulkOperationService {

    BulkOperationResponse bulkDelete(BulkDeleteRequest request, AccessContext context) throws FileValidationException;

    BulkOperationResponse bulkMove(BulkMoveRequest request, AccessContext context) throws FileValidationException;

    BulkOperationResponse bulkCopy(BulkCopyRequest request, AccessContext context) throws FileValidationException;

    BulkOperationResponse bulkTag(BulkTagRequest request, AccessContext context) throws FileValidationException;
}
