package uk.gegc.lessondocs.features.document.application.layout;

import org.apache.pdfbox.pdmodel.common.PDRectangle;

/**
 * Fixed page geometry shared by every document type. Y grows downwards from the top edge.
 */
public final class PageGeometry {

    public static final float PAGE_WIDTH = PDRectangle.LETTER.getWidth();
    public static final float PAGE_HEIGHT = PDRectangle.LETTER.getHeight();
    public static final float MARGIN = 40f;
    public static final float CONTENT_WIDTH = PAGE_WIDTH - 2 * MARGIN;
    public static final float FOOTER_HEIGHT = 48f;
    /** Lowest y any content block may reach. */
    public static final float CONTENT_BOTTOM = PAGE_HEIGHT - MARGIN - FOOTER_HEIGHT;

    public static final float LINE_SPACING = 1.2f;
    public static final float LINE_GAP = 3f;
    public static final float BLOCK_GAP = 6f;

    public static final float BODY_FONT_SIZE = 9.5f;
    public static final float SECTION_HEADER_FONT_SIZE = 11f;
    public static final float HEADER_TITLE_FONT_SIZE = 16f;
    public static final float HEADER_BADGE_FONT_SIZE = 11f;
    public static final float HEADER_SUBTITLE_FONT_SIZE = 9f;
    public static final float CONTINUATION_TITLE_FONT_SIZE = 11f;
    public static final float CALLOUT_FONT_SIZE = 9f;
    public static final float ATTRIBUTION_FONT_SIZE = 7f;
    public static final float BANNER_FONT_SIZE = 10f;
    public static final float PAGE_LABEL_FONT_SIZE = 7.5f;

    private PageGeometry() {
        throw new AssertionError("Utility class - do not instantiate");
    }
}
