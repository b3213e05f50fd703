package uk.gegc.lessondocs.features.document.application.layout;

import java.awt.image.BufferedImage;

/**
 * Text and artwork painted by the page frame.
 *
 * @param title             document title
 * @param badge             right-aligned badge on the first page, usually the grade label
 * @param subtitle          line under the title on the first page
 * @param continuationTitle single line painted on every following page
 * @param logo              decoded logo, null when absent or undecodable
 */
public record DocumentHeader(
        String title,
        String badge,
        String subtitle,
        String continuationTitle,
        BufferedImage logo
) {
    public DocumentHeader {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("Header title cannot be null or blank");
        }
        badge = badge == null ? "" : badge;
        subtitle = subtitle == null ? "" : subtitle;
        continuationTitle = continuationTitle == null ? title : continuationTitle;
    }
}
