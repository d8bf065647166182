package org.qbitspark.filevaultbackend.upload_validation_service.service;

import lombok.extern.slf4j.Slf4j;
import org.qbitspark.filevaultbackend.files_mng_service.config.FileVaultProperties;
import org.qbitspark.filevaultbackend.files_mng_service.enums.FileCategory;
import org.qbitspark.filevaultbackend.upload_validation_service.payload.CategoryPolicy;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Upload limits per file category. Built once from the defaults plus {@code app.files.categories}
 * overrides and validated at construction, so a bad override fails start-up instead of an upload.
 */
@Component
@Slf4j
public class CategoryPolicyRegistry {

    private static final long MB = 1024L * 1024L;

    private final Map<FileCategory, CategoryPolicy> policies;

    public CategoryPolicyRegistry(FileVaultProperties properties) {
        Map<FileCategory, CategoryPolicy> resolved = new EnumMap<>(FileCategory.class);
        for (FileCategory category : FileCategory.values()) {
            CategoryPolicy policy = applyOverride(defaultPolicy(category), properties.getCategories().get(category));
            validate(category, policy);
            resolved.put(category, policy);
        }
        this.policies = Collections.unmodifiableMap(resolved);
        log.info("Loaded upload policies for {} categories", policies.size());
    }

    public CategoryPolicy policyFor(FileCategory category) {
        return policies.get(category);
    }

    public Map<FileCategory, CategoryPolicy> allPolicies() {
        return policies;
    }

    private CategoryPolicy applyOverride(CategoryPolicy base, FileVaultProperties.CategoryOverride override) {
        if (override == null) {
            return base;
        }
        CategoryPolicy.CategoryPolicyBuilder builder = base.toBuilder();
        if (override.getMaxSize() != null) {
            builder.maxSize(override.getMaxSize());
        }
        if (override.getAllowedTypes() != null) {
            builder.clearAllowedTypes().allowedTypes(override.getAllowedTypes().stream()
                    .map(String::trim)
                    .map(String::toLowerCase)
                    .collect(Collectors.toSet()));
        }
        if (override.getVirusScanning() != null) {
            builder.virusScanning(override.getVirusScanning());
        }
        if (override.getExtractMetadata() != null) {
            builder.extractMetadata(override.getExtractMetadata());
        }
        if (override.getAutoBackup() != null) {
            builder.autoBackup(override.getAutoBackup());
        }
        if (override.getGenerateThumbnails() != null) {
            builder.generateThumbnails(override.getGenerateThumbnails());
        }
        return builder.build();
    }

    private void validate(FileCategory category, CategoryPolicy policy) {
        if (policy.getMaxSize() <= 0) {
            throw new IllegalStateException("Category " + category + " must have a positive max size");
        }
        if (policy.getAllowedTypes().isEmpty()) {
            throw new IllegalStateException("Category " + category + " must allow at least one MIME type");
        }
        boolean blankType = policy.getAllowedTypes().stream().anyMatch(type -> type == null || type.isBlank());
        if (blankType) {
            throw new IllegalStateException("Category " + category + " has a blank MIME type");
        }
    }

    private static CategoryPolicy defaultPolicy(FileCategory category) {
        return switch (category) {
            case FORMATION -> policy(5 * MB, true, true, true, false,
                    List.of("application/json", "text/plain", "application/xml"));
            case PLAYER_PHOTO -> policy(10 * MB, true, true, true, true,
                    List.of("image/jpeg", "image/png", "image/webp"));
            case TEAM_LOGO -> policy(5 * MB, true, true, true, true,
                    List.of("image/png", "image/svg+xml", "image/jpeg"));
            case DOCUMENT -> policy(50 * MB, true, true, true, true, List.of(
                    "application/pdf",
                    "application/msword",
                    "application/vnd.openxmlformats-officedocument.wordprocessingml.document",
                    "application/vnd.ms-excel",
                    "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet",
                    "text/plain",
                    "text/csv"));
            case VIDEO -> policy(500 * MB, true, true, false, true,
                    List.of("video/mp4", "video/avi", "video/mov", "video/wmv"));
            case AUDIO -> policy(100 * MB, true, true, false, false,
                    List.of("audio/mp3", "audio/wav", "audio/aac", "audio/ogg"));
            case ARCHIVE -> policy(100 * MB, true, true, true, false,
                    List.of("application/zip", "application/x-rar-compressed", "application/x-7z-compressed"));
            case BACKUP -> policy(1024 * MB, false, false, false, false,
                    List.of("application/octet-stream", "application/sql", "application/x-sql"));
            case REPORT -> policy(20 * MB, true, true, true, true, List.of(
                    "application/pdf",
                    "text/csv",
                    "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet"));
            case OTHER -> policy(25 * MB, true, true, false, false, List.of(CategoryPolicy.ANY_TYPE));
        };
    }

    private static CategoryPolicy policy(long maxSize, boolean virusScanning, boolean extractMetadata,
                                         boolean autoBackup, boolean generateThumbnails, List<String> types) {
        return CategoryPolicy.builder()
                .maxSize(maxSize)
                .virusScanning(virusScanning)
                .extractMetadata(extractMetadata)
                .autoBackup(autoBackup)
                .generateThumbnails(generateThumbnails)
                .allowedTypes(types)
                .build();
    }
}
