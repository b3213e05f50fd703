package uk.gegc.lessondocs.features.document.application;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.lessondocs.features.document.config.DocumentProperties;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.Semaphore;

/**
 * Decodes photo and logo bytes before layout starts.
 * <p>
 * Decoding is the most memory-hungry step of a render, so concurrent decodes across all renders are
 * bounded by {@code documents.images.max-concurrent-decodes}. Undecodable input is logged and reported
 * as empty; callers fall back to text-only layout.
 */
@Slf4j
@Component
public class DocumentImageLoader {

    private final DocumentProperties properties;
    private final Semaphore decodePermits;

    public DocumentImageLoader(DocumentProperties properties) {
        this.properties = properties;
        this.decodePermits = new Semaphore(Math.max(1, properties.getImages().getMaxConcurrentDecodes()), true);
    }

    /**
     * Photo scaled down to the configured maximum width and flattened to opaque RGB.
     */
    public Optional<BufferedImage> loadPhoto(byte[] bytes, String owner) {
        return decode(bytes, "photo", owner)
                .map(image -> toRgb(image, properties.getImages().getPhotoMaxWidth()));
    }

    /**
     * Logo as decoded, transparency kept.
     */
    public Optional<BufferedImage> loadLogo(byte[] bytes, String owner) {
        return decode(bytes, "logo", owner);
    }

    private Optional<BufferedImage> decode(byte[] bytes, String kind, String owner) {
        if (bytes == null || bytes.length == 0) {
            return Optional.empty();
        }
        try {
            decodePermits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted waiting to decode {} for '{}', rendering without it", kind, owner);
            return Optional.empty();
        }
        try {
            BufferedImage image = ImageIO.read(new ByteArrayInputStream(bytes));
            if (image == null || image.getWidth() <= 0 || image.getHeight() <= 0) {
                log.warn("Unrecognized {} format for '{}' ({} bytes), rendering without it", kind, owner, bytes.length);
                return Optional.empty();
            }
            return Optional.of(image);
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to decode {} for '{}', rendering without it: {}", kind, owner, e.getMessage());
            return Optional.empty();
        } finally {
            decodePermits.release();
        }
    }

    static BufferedImage toRgb(BufferedImage source, int maxWidth) {
        int width = source.getWidth();
        int height = source.getHeight();
        if (maxWidth > 0 && width > maxWidth) {
            height = Math.max(1, Math.round((float) height * maxWidth / width));
            width = maxWidth;
        }
        if (width == source.getWidth() && source.getType() == BufferedImage.TYPE_INT_RGB) {
            return source;
        }
        BufferedImage target = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = target.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, width, height);
            g.drawImage(source, 0, 0, width, height, null);
        } finally {
            g.dispose();
        }
        return target;
    }
}
