package org.qbitspark.filevaultbackend.files_mng_service.service;

import lombok.extern.slf4j.Slf4j;
import org.qbitspark.filevaultbackend.upload_validation_service.service.ImageHeaderReader;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls descriptive metadata out of uploaded content. Never fails an upload: whatever was
 * collected before an error is returned.
 */
@Component
@Slf4j
public class MetadataExtractor {

    private static final Pattern PDF_VERSION = Pattern.compile("^%PDF-(\\d\\.\\d)");

    public Map<String, Object> extract(byte[] content, String mimeType) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("sizeBytes", content != null ? content.length : 0);
        if (content == null || mimeType == null) {
            return metadata;
        }
        String type = mimeType.toLowerCase(Locale.ROOT);
        try {
            if (type.startsWith("image/")) {
                Optional<ImageHeaderReader.ImageInfo> info = ImageHeaderReader.readDimensions(content);
                info.ifPresent(image -> {
                    metadata.put("width", image.getWidth());
                    metadata.put("height", image.getHeight());
                    metadata.put("format", image.getFormat());
                });
            } else if (type.equals("application/pdf")) {
                String header = new String(content, 0, Math.min(content.length, 16), StandardCharsets.US_ASCII);
                Matcher matcher = PDF_VERSION.matcher(header);
                if (matcher.find()) {
                    metadata.put("pdfVersion", matcher.group(1));
                }
            }
        } catch (Exception e) {
            log.warn("Metadata extraction failed for {} content: {}", mimeType, e.getMessage());
        }
        return metadata;
    }
}
