package org.qbitspark.filevaultbackend.storage_service.service.impl;

import lombok.extern.slf4j.Slf4j;
import org.qbitspark.filevaultbackend.globeadvice.exceptions.StorageException;
import org.qbitspark.filevaultbackend.storage_service.config.StorageProperties;
import org.qbitspark.filevaultbackend.storage_service.service.StorageBackend;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;

/**
 * Stores objects as plain files under a root directory. Keys map to relative paths.
 */
@Service
@Slf4j
@ConditionalOnProperty(prefix = "app.storage", name = "backend", havingValue = "local", matchIfMissing = true)
public class LocalDiskStorageBackend implements StorageBackend {

    private final Path root;

    @Autowired
    public LocalDiskStorageBackend(StorageProperties properties) {
        this(Paths.get(properties.getLocalRoot()));
    }

    public LocalDiskStorageBackend(Path root) {
        this.root = root.toAbsolutePath().normalize();
        try {
            Files.createDirectories(this.root);
        } catch (IOException e) {
            throw new StorageException("Failed to create storage root " + this.root, e);
        }
        log.info("Local storage initialized at: {}", this.root);
    }

    @Override
    public void put(String key, byte[] content) {
        Path target = resolve(key);
        Path temp = null;
        try {
            Files.createDirectories(target.getParent());
            temp = Files.createTempFile(target.getParent(), ".upload-", ".tmp");
            Files.write(temp, content);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Stored object: {} ({} bytes)", key, content.length);
        } catch (IOException e) {
            deleteQuietly(temp);
            log.error("Error storing object: {}", key, e);
            throw new StorageException("Failed to store object " + key, e);
        }
    }

    @Override
    public byte[] get(String key) {
        Path source = resolve(key);
        try {
            return Files.readAllBytes(source);
        } catch (NoSuchFileException e) {
            throw new StorageException.ObjectNotFoundException(key);
        } catch (IOException e) {
            log.error("Error reading object: {}", key, e);
            throw new StorageException("Failed to read object " + key, e);
        }
    }

    @Override
    public void delete(String key) {
        Path target = resolve(key);
        try {
            if (Files.deleteIfExists(target)) {
                log.debug("Deleted object: {}", key);
            }
        } catch (IOException e) {
            log.error("Error deleting object: {}", key, e);
            throw new StorageException("Failed to delete object " + key, e);
        }
    }

    @Override
    public String name() {
        return "local";
    }

    // Keys are generated internally, but a key must never escape the root
    Path resolve(String key) {
        if (key == null || key.isBlank()) {
            throw new StorageException("Storage key is required");
        }
        Path resolved = root.resolve(key).normalize();
        if (!resolved.startsWith(root) || resolved.equals(root)) {
            throw new StorageException("Storage key escapes the storage root: " + key);
        }
        return resolved;
    }

    private void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not remove temporary file {}: {}", temp, e.getMessage());
        }
    }
}
