package org.qbitspark.filevaultbackend.versioning_service.service;

import org.qbitspark.filevaultbackend.files_mng_service.entity.FileEntity;
import org.qbitspark.filevaultbackend.files_mng_service.enums.FileCategory;
import org.qbitspark.filevaultbackend.files_mng_service.enums.FileVisibility;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Point-in-time copies of a file record's mutable fields, stored as JSON with each version.
 */
public final class VersionSnapshots {

    public static final String ORIGINAL_NAME = "originalName";
    public static final String MIME_TYPE = "mimeType";
    public static final String FILE_SIZE = "fileSize";
    public static final String CHECKSUM = "checksum";
    public static final String STORAGE_KEY = "storageKey";
    public static final String THUMBNAIL_KEY = "thumbnailKey";
    public static final String CATEGORY = "category";
    public static final String VISIBILITY = "visibility";
    public static final String TAGS = "tags";
    public static final String DESCRIPTION = "description";
    public static final String EXPIRES_AT = "expiresAt";

    private VersionSnapshots() {
    }

    public static Map<String, Object> capture(FileEntity file) {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put(ORIGINAL_NAME, file.getOriginalName());
        snapshot.put(MIME_TYPE, file.getMimeType());
        snapshot.put(FILE_SIZE, file.getFileSize());
        snapshot.put(CHECKSUM, file.getChecksum());
        snapshot.put(STORAGE_KEY, file.getStorageKey());
        snapshot.put(THUMBNAIL_KEY, file.getThumbnailKey());
        snapshot.put(CATEGORY, file.getCategory() != null ? file.getCategory().name() : null);
        snapshot.put(VISIBILITY, file.getVisibility() != null ? file.getVisibility().name() : null);
        List<String> tags = new ArrayList<>(file.getTags() != null ? file.getTags() : List.of());
        tags.sort(null);
        snapshot.put(TAGS, tags);
        snapshot.put(DESCRIPTION, file.getDescription());
        snapshot.put(EXPIRES_AT, file.getExpiresAt() != null ? file.getExpiresAt().toString() : null);
        return snapshot;
    }

    /**
     * Overwrites the record's mutable fields with the snapshot. Keys missing from an older
     * snapshot leave the field untouched.
     */
    public static void apply(Map<String, Object> snapshot, FileEntity file) {
        if (snapshot.containsKey(ORIGINAL_NAME)) {
            file.setOriginalName((String) snapshot.get(ORIGINAL_NAME));
        }
        if (snapshot.containsKey(MIME_TYPE)) {
            file.setMimeType((String) snapshot.get(MIME_TYPE));
        }
        if (snapshot.get(FILE_SIZE) instanceof Number) {
            file.setFileSize(((Number) snapshot.get(FILE_SIZE)).longValue());
        }
        if (snapshot.containsKey(CHECKSUM)) {
            file.setChecksum((String) snapshot.get(CHECKSUM));
        }
        if (snapshot.containsKey(STORAGE_KEY)) {
            file.setStorageKey((String) snapshot.get(STORAGE_KEY));
        }
        if (snapshot.containsKey(THUMBNAIL_KEY)) {
            file.setThumbnailKey((String) snapshot.get(THUMBNAIL_KEY));
        }
        if (snapshot.get(CATEGORY) != null) {
            file.setCategory(FileCategory.valueOf((String) snapshot.get(CATEGORY)));
        }
        if (snapshot.get(VISIBILITY) != null) {
            file.setVisibility(FileVisibility.valueOf((String) snapshot.get(VISIBILITY)));
        }
        if (snapshot.get(TAGS) instanceof Collection) {
            Collection<?> tags = (Collection<?>) snapshot.get(TAGS);
            Set<String> restored = new HashSet<>();
            tags.forEach(tag -> restored.add(String.valueOf(tag)));
            file.setTags(restored);
        }
        if (snapshot.containsKey(DESCRIPTION)) {
            file.setDescription((String) snapshot.get(DESCRIPTION));
        }
        if (snapshot.containsKey(EXPIRES_AT)) {
            Object expiresAt = snapshot.get(EXPIRES_AT);
            file.setExpiresAt(expiresAt != null ? LocalDateTime.parse(expiresAt.toString()) : null);
        }
    }
}
