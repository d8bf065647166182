package org.qbitspark.filevaultbackend.upload_validation_service.payload;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.qbitspark.filevaultbackend.globe_utils.MimeTypes;

import java.util.Set;

@Value
@Builder(toBuilder = true)
public class CategoryPolicy {

    public static final String ANY_TYPE = "*/*";

    long maxSize;
    @Singular
    Set<String> allowedTypes;
    boolean virusScanning;
    boolean extractMetadata;
    boolean autoBackup;
    // 300x300 JPEG preview for image content
    boolean generateThumbnails;

    public boolean acceptsAnyType() {
        return allowedTypes.contains(ANY_TYPE);
    }

    public boolean allowsType(String mimeType) {
        String normalized = MimeTypes.normalize(mimeType);
        return acceptsAnyType() || (normalized != null && allowedTypes.contains(normalized));
    }
}
