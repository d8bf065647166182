package org.qbitspark.filevaultbackend.globe_utils;

import java.util.Locale;

public final class MimeTypes {

    private MimeTypes() {
    }

    /**
     * Bare lower-case type without parameters, e.g. {@code "Image/JPEG; charset=binary"} becomes
     * {@code "image/jpeg"}. Blank input gives null.
     */
    public static String normalize(String mimeType) {
        if (mimeType == null || mimeType.isBlank()) {
            return null;
        }
        int params = mimeType.indexOf(';');
        String bare = params >= 0 ? mimeType.substring(0, params) : mimeType;
        String normalized = bare.trim().toLowerCase(Locale.ROOT);
        return normalized.isEmpty() ? null : normalized;
    }
}
