package org.qbitspark.filevaultbackend.upload_validation_service.service;

import lombok.Value;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Iterator;
import java.util.Optional;

/**
 * Reads image dimensions from the header without decoding pixel data.
 */
public final class ImageHeaderReader {

    private ImageHeaderReader() {
    }

    /**
     * @return empty when no installed reader recognises the format (e.g. SVG, WebP)
     * @throws IOException when a reader recognises the format but cannot parse the header
     */
    public static Optional<ImageInfo> readDimensions(byte[] content) throws IOException {
        try (ImageInputStream input = ImageIO.createImageInputStream(new ByteArrayInputStream(content))) {
            if (input == null) {
                return Optional.empty();
            }
            Iterator<ImageReader> readers = ImageIO.getImageReaders(input);
            if (!readers.hasNext()) {
                return Optional.empty();
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(input, true, true);
                return Optional.of(new ImageInfo(reader.getWidth(0), reader.getHeight(0),
                        reader.getFormatName().toLowerCase()));
            } finally {
                reader.dispose();
            }
        }
    }

    @Value
    public static class ImageInfo {
        int width;
        int height;
        String format;
    }
}
