package uk.gegc.lessondocs.features.document.application.layout;

/**
 * Heading bar colors of one section.
 */
public record SectionPalette(RgbColor background, RgbColor text) {

    public static SectionPalette of(int bgR, int bgG, int bgB, int textR, int textG, int textB) {
        return new SectionPalette(new RgbColor(bgR, bgG, bgB), new RgbColor(textR, textG, textB));
    }
}
