package org.qbitspark.filevaultbackend.upload_validation_service.service;

import org.qbitspark.filevaultbackend.upload_validation_service.payload.CategoryPolicy;
import org.qbitspark.filevaultbackend.upload_validation_service.payload.ValidationResult;

public interface UploadValidator {

    /**
     * Runs the upload checks in order and stops at the first failure. Has no side effects.
     *
     * @param content      raw uploaded bytes
     * @param declaredName client-supplied file name
     * @param declaredMime client-supplied MIME type
     * @param size         size in bytes the caller accounts for
     * @param policy       limits of the target category
     * @return ok, or the first rejection with its reason
     */
    ValidationResult validate(byte[] content, String declaredName, String declaredMime, long size, CategoryPolicy policy);

    /**
     * Filename rules on their own, for renames.
     */
    ValidationResult validateFileName(String fileName);
}
