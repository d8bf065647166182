package org.qbitspark.filevaultbackend.storage_service.service;

import org.qbitspark.filevaultbackend.files_mng_service.enums.FileCategory;

import java.util.UUID;

public interface ContentStore {

    /**
     * @return lower-case hex SHA-256 of the content
     */
    String checksum(byte[] content);

    /**
     * Writes the bytes under a fresh key of the form
     * {@code <category>/<yyyy>/<MM>/<id>_<epochMillis><.ext>}.
     *
     * @return the storage key
     */
    String store(byte[] content, FileCategory category, UUID fileId, String originalName);

    /**
     * Reads the bytes and verifies them against the recorded checksum.
     *
     * @throws org.qbitspark.filevaultbackend.globeadvice.exceptions.IntegrityException when the digest differs
     */
    byte[] retrieve(String storageKey, String expectedChecksum);

    void delete(String storageKey);

    /**
     * Key of the thumbnail derived from a revision: {@code <dir>/thumbnails/<name>_thumb.jpg}.
     */
    String thumbnailKeyFor(String storageKey);

    /**
     * Writes a thumbnail next to the revision it was rendered from.
     *
     * @return the thumbnail key
     */
    String storeThumbnail(String storageKey, byte[] thumbnail);

    // Thumbnails carry no checksum; they can always be rendered again
    byte[] retrieveThumbnail(String thumbnailKey);
}
