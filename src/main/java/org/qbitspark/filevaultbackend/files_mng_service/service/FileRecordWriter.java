package org.qbitspark.filevaultbackend.files_mng_service.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.qbitspark.filevaultbackend.files_mng_service.entity.FileEntity;
import org.qbitspark.filevaultbackend.files_mng_service.repo.FileRepository;
import org.qbitspark.filevaultbackend.globeadvice.exceptions.ConflictException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Component;

/**
 * Flushes record changes immediately so a concurrent modification of the same file is
 * detected inside the calling operation rather than at commit.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FileRecordWriter {

    private final FileRepository fileRepository;

    public FileEntity save(FileEntity file) throws ConflictException {
        try {
            return fileRepository.saveAndFlush(file);
        } catch (OptimisticLockingFailureException e) {
            log.warn("Concurrent modification of file {}: {}", file.getFileId(), e.getMessage());
            throw new ConflictException("File was modified concurrently, please retry", e);
        }
    }
}
