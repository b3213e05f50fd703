package uk.gegc.lessondocs.features.document.domain.model;

import java.io.InputStream;
import java.util.function.Supplier;

/**
 * Finished PDF ready to be returned or written.
 */
public record RenderedDocument(
        String filename,
        String contentType,
        Supplier<InputStream> contentSupplier,
        long contentLength,
        int pageCount
) {
    public RenderedDocument {
        if (filename == null || filename.isBlank()) {
            throw new IllegalArgumentException("Filename cannot be null or blank");
        }
        if (contentType == null || contentType.isBlank()) {
            throw new IllegalArgumentException("Content type cannot be null or blank");
        }
        if (contentSupplier == null) {
            throw new IllegalArgumentException("Content supplier cannot be null");
        }
        if (contentLength < 0) {
            contentLength = -1;
        }
        if (pageCount < 1) {
            throw new IllegalArgumentException("A rendered document has at least one page");
        }
    }
}
