package uk.gegc.lessondocs.features.document.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for document rendering and batch backfill.
 */
@Data
@Component
@ConfigurationProperties(prefix = "documents")
public class DocumentProperties {

    /**
     * Footer attribution line. {@code {year}} is replaced with the current year.
     */
    private String attribution = "Science In A Snapshot  |  © {year} Alex Jones, M.Ed.  |  AI-Generated Content — Review Before Classroom Use";

    private Images images = new Images();

    private Backfill backfill = new Backfill();

    @Data
    public static class Images {
        /**
         * Photos wider than this are scaled down before embedding.
         * Default: 400
         */
        private int photoMaxWidth = 400;

        /**
         * JPEG quality used when embedding photos.
         * Default: 0.75
         */
        private float jpegQuality = 0.75f;

        /**
         * Upper bound on image decodes running at the same time across all renders.
         * Default: 4
         */
        private int maxConcurrentDecodes = 4;
    }

    @Data
    public static class Backfill {
        /**
         * Attempts per job before it is reported as failed, including the first.
         * Default: 2
         */
        private int maxAttempts = 2;

        /**
         * Directory the file system sink writes rendered documents to.
         */
        private String outputDir = "target/documents";
    }
}
