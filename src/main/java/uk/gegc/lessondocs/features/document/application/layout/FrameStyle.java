package uk.gegc.lessondocs.features.document.application.layout;

/**
 * Color scheme and footer banner of one document type.
 *
 * @param primary        header badge, rules and footer bar
 * @param pageLabelColor page label text on the footer bar
 * @param bannerText     centered footer banner
 */
public record FrameStyle(RgbColor primary, RgbColor pageLabelColor, String bannerText) {

    public FrameStyle {
        if (primary == null || pageLabelColor == null) {
            throw new IllegalArgumentException("Frame colors cannot be null");
        }
        bannerText = bannerText == null ? "" : bannerText;
    }
}
