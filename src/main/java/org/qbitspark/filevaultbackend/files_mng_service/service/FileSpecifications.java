package org.qbitspark.filevaultbackend.files_mng_service.service;

import jakarta.persistence.criteria.Join;
import org.qbitspark.filevaultbackend.files_mng_service.entity.FileEntity;
import org.qbitspark.filevaultbackend.files_mng_service.enums.FileCategory;
import org.qbitspark.filevaultbackend.files_mng_service.enums.FileVisibility;
import org.springframework.data.jpa.domain.Specification;

import java.util.Locale;
import java.util.UUID;

public final class FileSpecifications {

    private FileSpecifications() {
    }

    public static Specification<FileEntity> notDeleted() {
        return (root, query, cb) -> cb.isFalse(root.get("deleted"));
    }

    public static Specification<FileEntity> ownedByOrPublic(UUID userId) {
        return (root, query, cb) -> {
            if (userId == null) {
                return cb.equal(root.get("visibility"), FileVisibility.PUBLIC);
            }
            return cb.or(
                    cb.equal(root.get("ownerId"), userId),
                    cb.equal(root.get("visibility"), FileVisibility.PUBLIC));
        };
    }

    public static Specification<FileEntity> inCategory(FileCategory category) {
        return (root, query, cb) -> cb.equal(root.get("category"), category);
    }

    public static Specification<FileEntity> withVisibility(FileVisibility visibility) {
        return (root, query, cb) -> cb.equal(root.get("visibility"), visibility);
    }

    public static Specification<FileEntity> taggedWith(String tag) {
        return (root, query, cb) -> {
            query.distinct(true);
            Join<FileEntity, String> tags = root.join("tags");
            return cb.equal(tags, tag);
        };
    }

    public static Specification<FileEntity> matchesText(String text) {
        String pattern = "%" + escapeLike(text.trim().toLowerCase(Locale.ROOT)) + "%";
        return (root, query, cb) -> cb.or(
                cb.like(cb.lower(root.get("originalName")), pattern, '\\'),
                cb.like(cb.lower(cb.coalesce(root.get("description"), "")), pattern, '\\'));
    }

    private static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
