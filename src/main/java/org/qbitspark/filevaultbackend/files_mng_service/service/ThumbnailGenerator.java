package org.qbitspark.filevaultbackend.files_mng_service.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Optional;

/**
 * Renders JPEG previews that fit inside {@value #MAX_EDGE}x{@value #MAX_EDGE} pixels. Smaller
 * images keep their size. Like metadata extraction, a failure never fails the upload.
 */
@Component
@Slf4j
public class ThumbnailGenerator {

    public static final int MAX_EDGE = 300;

    public Optional<byte[]> generate(byte[] content, String mimeType) {
        if (content == null || mimeType == null || !mimeType.startsWith("image/")) {
            return Optional.empty();
        }
        try {
            BufferedImage source = ImageIO.read(new ByteArrayInputStream(content));
            if (source == null) {
                log.debug("No image reader for {} content, thumbnail skipped", mimeType);
                return Optional.empty();
            }

            double scale = Math.min(1.0, Math.min(
                    (double) MAX_EDGE / source.getWidth(),
                    (double) MAX_EDGE / source.getHeight()));
            int width = Math.max(1, (int) Math.round(source.getWidth() * scale));
            int height = Math.max(1, (int) Math.round(source.getHeight() * scale));

            // JPEG has no alpha channel
            BufferedImage thumbnail = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
            Graphics2D graphics = thumbnail.createGraphics();
            try {
                graphics.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
                graphics.setColor(Color.WHITE);
                graphics.fillRect(0, 0, width, height);
                graphics.drawImage(source, 0, 0, width, height, null);
            } finally {
                graphics.dispose();
            }

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            if (!ImageIO.write(thumbnail, "jpg", out)) {
                log.warn("No JPEG writer available, thumbnail skipped");
                return Optional.empty();
            }
            return Optional.of(out.toByteArray());
        } catch (IOException | RuntimeException e) {
            log.warn("Thumbnail generation failed for {} content: {}", mimeType, e.getMessage());
            return Optional.empty();
        }
    }
}
