package org.qbitspark.filevaultbackend.upload_validation_service.service.impl;

import lombok.extern.slf4j.Slf4j;
import org.qbitspark.filevaultbackend.globe_utils.MimeTypes;
import org.qbitspark.filevaultbackend.upload_validation_service.enums.ValidationFailure;
import org.qbitspark.filevaultbackend.upload_validation_service.payload.CategoryPolicy;
import org.qbitspark.filevaultbackend.upload_validation_service.payload.ValidationResult;
import org.qbitspark.filevaultbackend.upload_validation_service.service.ImageHeaderReader;
import org.qbitspark.filevaultbackend.upload_validation_service.service.UploadValidator;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

@Service
@Slf4j
public class UploadValidatorImpl implements UploadValidator {

    private static final int MAX_FILE_NAME_LENGTH = 255;
    private static final int MAX_IMAGE_DIMENSION = 10_000;
    private static final String INVALID_NAME_CHARS = "<>:\"|?*";

    private static final Set<String> RESERVED_NAMES = Set.of(
            "CON", "PRN", "AUX", "NUL",
            "COM1", "COM2", "COM3", "COM4", "COM5", "COM6", "COM7", "COM8", "COM9",
            "LPT1", "LPT2", "LPT3", "LPT4", "LPT5", "LPT6", "LPT7", "LPT8", "LPT9");

    // Executable formats, only meaningful at offset 0
    private static final List<byte[]> EXECUTABLE_HEADERS = List.of(
            new byte[]{0x4D, 0x5A},                                   // PE / DOS "MZ"
            new byte[]{0x7F, 0x45, 0x4C, 0x46},                       // ELF
            new byte[]{(byte) 0xFE, (byte) 0xED, (byte) 0xFA, (byte) 0xCE}, // Mach-O 32
            new byte[]{(byte) 0xFE, (byte) 0xED, (byte) 0xFA, (byte) 0xCF}, // Mach-O 64
            new byte[]{(byte) 0xCE, (byte) 0xFA, (byte) 0xED, (byte) 0xFE},
            new byte[]{(byte) 0xCF, (byte) 0xFA, (byte) 0xED, (byte) 0xFE});

    // Lower-case ASCII, matched case-insensitively anywhere in the content
    private static final List<byte[]> SCRIPT_MARKERS = List.of(
            ascii("<?php"),
            ascii("<script"),
            ascii("javascript:"));

    private static final Map<String, List<Signature>> HEADER_SIGNATURES = Map.of(
            "image/jpeg", List.of(new Signature(0, new byte[]{(byte) 0xFF, (byte) 0xD8, (byte) 0xFF})),
            "image/png", List.of(new Signature(0, new byte[]{(byte) 0x89, 0x50, 0x4E, 0x47})),
            "image/gif", List.of(new Signature(0, ascii("GIF87a")), new Signature(0, ascii("GIF89a"))),
            "image/webp", List.of(new Signature(0, ascii("RIFF")).and(8, ascii("WEBP"))),
            "application/pdf", List.of(new Signature(0, ascii("%PDF"))),
            "application/zip", List.of(new Signature(0, new byte[]{0x50, 0x4B, 0x03, 0x04})),
            "video/mp4", List.of(new Signature(4, ascii("ftyp"))));

    @Override
    public ValidationResult validate(byte[] content, String declaredName, String declaredMime,
                                     long size, CategoryPolicy policy) {
        String mimeType = MimeTypes.normalize(declaredMime);

        ValidationResult result = checkSize(content, size, policy);
        if (result.isValid()) {
            result = checkMimeType(mimeType, policy);
        }
        if (result.isValid()) {
            result = validateFileName(declaredName);
        }
        if (result.isValid()) {
            result = scanForDangerousContent(content);
        }
        if (result.isValid()) {
            result = checkHeader(content, mimeType);
        }
        if (result.isValid()) {
            result = checkStructure(content, mimeType);
        }

        if (!result.isValid()) {
            log.warn("Upload rejected ({}): {} - {}", result.getFailure(), declaredName, result.getReason());
        }
        return result;
    }

    @Override
    public ValidationResult validateFileName(String fileName) {
        if (fileName == null || fileName.isBlank()) {
            return reject(ValidationFailure.UNSAFE_FILENAME, "File name is required");
        }
        if (fileName.length() > MAX_FILE_NAME_LENGTH) {
            return reject(ValidationFailure.UNSAFE_FILENAME,
                    "File name exceeds " + MAX_FILE_NAME_LENGTH + " characters");
        }
        if (fileName.contains("..") || fileName.indexOf('/') >= 0 || fileName.indexOf('\\') >= 0) {
            return reject(ValidationFailure.UNSAFE_FILENAME, "File name contains path traversal sequences");
        }
        for (int i = 0; i < fileName.length(); i++) {
            char c = fileName.charAt(i);
            if (c < 0x20 || c == 0x7F) {
                return reject(ValidationFailure.UNSAFE_FILENAME, "File name contains control characters");
            }
            if (INVALID_NAME_CHARS.indexOf(c) >= 0) {
                return reject(ValidationFailure.UNSAFE_FILENAME, "File name contains invalid character '" + c + "'");
            }
        }
        if (fileName.startsWith(".") || fileName.endsWith(".") || fileName.endsWith(" ")) {
            return reject(ValidationFailure.UNSAFE_FILENAME, "File name cannot start or end with a dot");
        }
        int dot = fileName.indexOf('.');
        String baseName = (dot >= 0 ? fileName.substring(0, dot) : fileName).trim().toUpperCase(Locale.ROOT);
        if (RESERVED_NAMES.contains(baseName)) {
            return reject(ValidationFailure.UNSAFE_FILENAME, "File name uses a reserved device name");
        }
        return ValidationResult.ok();
    }

    private ValidationResult checkSize(byte[] content, long size, CategoryPolicy policy) {
        if (content == null || content.length == 0 || size <= 0) {
            return reject(ValidationFailure.EMPTY_FILE, "File is empty");
        }
        if (size > policy.getMaxSize()) {
            return reject(ValidationFailure.FILE_TOO_LARGE,
                    "File size exceeds limit of " + formatLimit(policy.getMaxSize()));
        }
        return ValidationResult.ok();
    }

    private ValidationResult checkMimeType(String mimeType, CategoryPolicy policy) {
        if (mimeType == null) {
            return reject(ValidationFailure.TYPE_NOT_ALLOWED, "File type is required");
        }
        if (!policy.allowsType(mimeType)) {
            return reject(ValidationFailure.TYPE_NOT_ALLOWED, "File type " + mimeType + " not allowed");
        }
        return ValidationResult.ok();
    }

    private ValidationResult scanForDangerousContent(byte[] content) {
        for (byte[] header : EXECUTABLE_HEADERS) {
            if (startsWith(content, 0, header)) {
                return reject(ValidationFailure.MALICIOUS_CONTENT, "Potentially malicious content detected");
            }
        }
        for (byte[] marker : SCRIPT_MARKERS) {
            if (containsIgnoreCase(content, marker)) {
                return reject(ValidationFailure.MALICIOUS_CONTENT, "Potentially malicious content detected");
            }
        }
        return ValidationResult.ok();
    }

    private ValidationResult checkHeader(byte[] content, String mimeType) {
        List<Signature> expected = HEADER_SIGNATURES.get(mimeType);
        if (expected == null) {
            return ValidationResult.ok();
        }
        boolean matches = expected.stream().anyMatch(signature -> signature.matches(content));
        return matches
                ? ValidationResult.ok()
                : reject(ValidationFailure.HEADER_MISMATCH, "File header does not match MIME type " + mimeType);
    }

    private ValidationResult checkStructure(byte[] content, String mimeType) {
        if (mimeType.startsWith("image/")) {
            try {
                Optional<ImageHeaderReader.ImageInfo> info = ImageHeaderReader.readDimensions(content);
                if (info.isPresent()
                        && (info.get().getWidth() > MAX_IMAGE_DIMENSION || info.get().getHeight() > MAX_IMAGE_DIMENSION)) {
                    return reject(ValidationFailure.INVALID_STRUCTURE, "Image dimensions too large");
                }
            } catch (IOException | RuntimeException e) {
                log.debug("Image header could not be read: {}", e.getMessage());
                return reject(ValidationFailure.INVALID_STRUCTURE, "Invalid image file");
            }
        } else if ("application/pdf".equals(mimeType) && !startsWith(content, 0, ascii("%PDF"))) {
            return reject(ValidationFailure.INVALID_STRUCTURE, "Invalid PDF file");
        }
        return ValidationResult.ok();
    }

    private static ValidationResult reject(ValidationFailure failure, String reason) {
        return ValidationResult.rejected(failure, reason);
    }

    private static String formatLimit(long bytes) {
        return Math.round(bytes / 1024.0 / 1024.0) + "MB";
    }

    private static boolean startsWith(byte[] content, int offset, byte[] prefix) {
        if (content.length < offset + prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (content[offset + i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }

    private static boolean containsIgnoreCase(byte[] content, byte[] lowerMarker) {
        int last = content.length - lowerMarker.length;
        for (int i = 0; i <= last; i++) {
            if (toLower(content[i]) != lowerMarker[0]) {
                continue;
            }
            int j = 1;
            while (j < lowerMarker.length && toLower(content[i + j]) == lowerMarker[j]) {
                j++;
            }
            if (j == lowerMarker.length) {
                return true;
            }
        }
        return false;
    }

    private static byte toLower(byte b) {
        return (b >= 'A' && b <= 'Z') ? (byte) (b + 32) : b;
    }

    private static byte[] ascii(String value) {
        return value.getBytes(StandardCharsets.US_ASCII);
    }

    private static final class Signature {
        private final int[] offsets;
        private final byte[][] patterns;

        Signature(int offset, byte[] pattern) {
            this(new int[]{offset}, new byte[][]{pattern});
        }

        private Signature(int[] offsets, byte[][] patterns) {
            this.offsets = offsets;
            this.patterns = patterns;
        }

        // Adds a second fixed-offset pattern that must also match
        Signature and(int offset, byte[] pattern) {
            int[] nextOffsets = Arrays.copyOf(offsets, offsets.length + 1);
            byte[][] nextPatterns = Arrays.copyOf(patterns, patterns.length + 1);
            nextOffsets[offsets.length] = offset;
            nextPatterns[patterns.length] = pattern;
            return new Signature(nextOffsets, nextPatterns);
        }

        boolean matches(byte[] content) {
            for (int i = 0; i < offsets.length; i++) {
                if (!startsWith(content, offsets[i], patterns[i])) {
                    return false;
                }
            }
            return true;
        }
    }
}
