package org.qbitspark.filevaultbackend.storage_service.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.qbitspark.filevaultbackend.files_mng_service.enums.FileCategory;
import org.qbitspark.filevaultbackend.globe_utils.ChecksumService;
import org.qbitspark.filevaultbackend.globeadvice.exceptions.IntegrityException;
import org.qbitspark.filevaultbackend.storage_service.service.ContentStore;
import org.qbitspark.filevaultbackend.storage_service.service.StorageBackend;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

@Service
@RequiredArgsConstructor
@Slf4j
public class ContentStoreImpl implements ContentStore {

    private static final Pattern EXTENSION = Pattern.compile("[A-Za-z0-9]{1,10}");
    private static final String THUMBNAIL_DIRECTORY = "thumbnails";

    private final StorageBackend storageBackend;
    private final ChecksumService checksumService;
    private final Clock clock;

    // Strictly increasing per process, so two revisions of one file never share a key
    private final AtomicLong lastKeyMillis = new AtomicLong();

    @Override
    public String checksum(byte[] content) {
        return checksumService.sha256Hex(content);
    }

    @Override
    public String store(byte[] content, FileCategory category, UUID fileId, String originalName) {
        String storageKey = generateStorageKey(category, fileId, originalName);
        storageBackend.put(storageKey, content);
        log.info("Stored {} bytes for file {} under {}", content.length, fileId, storageKey);
        return storageKey;
    }

    @Override
    public byte[] retrieve(String storageKey, String expectedChecksum) {
        byte[] content = storageBackend.get(storageKey);
        String actual = checksum(content);
        if (!actual.equalsIgnoreCase(expectedChecksum)) {
            log.error("Integrity check failed for {}: expected {} but was {}", storageKey, expectedChecksum, actual);
            throw new IntegrityException(storageKey, expectedChecksum, actual);
        }
        return content;
    }

    @Override
    public void delete(String storageKey) {
        storageBackend.delete(storageKey);
    }

    @Override
    public String thumbnailKeyFor(String storageKey) {
        int slash = storageKey.lastIndexOf('/');
        String directory = slash >= 0 ? storageKey.substring(0, slash + 1) : "";
        String fileName = storageKey.substring(slash + 1);
        int dot = fileName.lastIndexOf('.');
        String baseName = dot > 0 ? fileName.substring(0, dot) : fileName;
        return directory + THUMBNAIL_DIRECTORY + "/" + baseName + "_thumb.jpg";
    }

    @Override
    public String storeThumbnail(String storageKey, byte[] thumbnail) {
        String thumbnailKey = thumbnailKeyFor(storageKey);
        storageBackend.put(thumbnailKey, thumbnail);
        log.debug("Stored {} byte thumbnail under {}", thumbnail.length, thumbnailKey);
        return thumbnailKey;
    }

    @Override
    public byte[] retrieveThumbnail(String thumbnailKey) {
        return storageBackend.get(thumbnailKey);
    }

    String generateStorageKey(FileCategory category, UUID fileId, String originalName) {
        Instant now = clock.instant();
        long millis = lastKeyMillis.updateAndGet(last -> Math.max(last + 1, now.toEpochMilli()));
        ZonedDateTime date = now.atZone(clock.getZone());
        return String.format("%s/%04d/%02d/%s_%d%s",
                category.storagePrefix(),
                date.getYear(),
                date.getMonthValue(),
                fileId,
                millis,
                extensionOf(originalName));
    }

    static String extensionOf(String originalName) {
        if (originalName == null) {
            return "";
        }
        int dot = originalName.lastIndexOf('.');
        if (dot < 0 || dot == originalName.length() - 1) {
            return "";
        }
        String extension = originalName.substring(dot + 1);
        return EXTENSION.matcher(extension).matches() ? "." + extension.toLowerCase(Locale.ROOT) : "";
    }
}
