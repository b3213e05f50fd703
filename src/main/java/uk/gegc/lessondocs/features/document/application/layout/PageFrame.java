package uk.gegc.lessondocs.features.document.application.layout;

import java.awt.image.BufferedImage;

import static uk.gegc.lessondocs.features.document.application.layout.PageGeometry.*;

/**
 * Headers and footers shared by all document types.
 * <p>
 * The first page gets the full header (logo, title, badge, subtitle, rule); every later page gets a
 * one-line continuation header. Footers are painted with a "Page i" placeholder while the total is
 * unknown and stamped with "Page i of N" at the end.
 */
public class PageFrame {

    static final float LOGO_WIDTH = 80f;
    static final float LOGO_MAX_HEIGHT = 40f;
    static final float TITLE_OFFSET_WITH_LOGO = 92f;
    static final float FULL_HEADER_HEIGHT = 40f;
    static final float CONTINUATION_HEADER_HEIGHT = 24f;
    static final float FOOTER_BAR_OFFSET = 14f;
    static final float FOOTER_BAR_HEIGHT = 26f;
    static final float PAGE_LABEL_BOX_WIDTH = 100f;

    private final FrameStyle style;
    private final DocumentHeader header;
    private final String attribution;

    public PageFrame(FrameStyle style, DocumentHeader header, String attribution) {
        this.style = style;
        this.header = header;
        this.attribution = attribution == null ? "" : attribution;
    }

    public FrameStyle style() {
        return style;
    }

    /**
     * @return cursor position where page content starts
     */
    public float paintFullHeader(DocumentCanvas canvas, int page, float y) {
        BufferedImage logo = header.logo();
        float textX = MARGIN;
        if (logo != null && logo.getWidth() > 0) {
            float logoHeight = Math.min(LOGO_MAX_HEIGHT, LOGO_WIDTH * logo.getHeight() / logo.getWidth());
            float logoWidth = logoHeight * logo.getWidth() / logo.getHeight();
            canvas.draw(page, new DrawCommand.Image(logo, MARGIN, y, logoWidth, logoHeight, true));
            textX = MARGIN + TITLE_OFFSET_WITH_LOGO;
        }

        float badgeWidth = PdfFont.BOLD.width(header.badge(), HEADER_BADGE_FONT_SIZE);
        float badgeX = PAGE_WIDTH - MARGIN - badgeWidth;
        if (!header.badge().isEmpty()) {
            canvas.draw(page, new DrawCommand.Text(header.badge(), badgeX, y + 4, PdfFont.BOLD,
                    HEADER_BADGE_FONT_SIZE, style.primary()));
        }

        float titleWidth = badgeX - textX - 10f;
        canvas.draw(page, new DrawCommand.Text(fit(header.title(), PdfFont.BOLD, HEADER_TITLE_FONT_SIZE, titleWidth),
                textX, y + 2, PdfFont.BOLD, HEADER_TITLE_FONT_SIZE, RgbColor.HEADER_TEXT));
        canvas.draw(page, new DrawCommand.Text(fit(header.subtitle(), PdfFont.REGULAR, HEADER_SUBTITLE_FONT_SIZE, titleWidth),
                textX, y + 22, PdfFont.REGULAR, HEADER_SUBTITLE_FONT_SIZE, RgbColor.SUBTITLE_TEXT));

        float ruleY = y + FULL_HEADER_HEIGHT;
        canvas.draw(page, new DrawCommand.Line(MARGIN, ruleY, PAGE_WIDTH - MARGIN, ruleY, 1.5f, style.primary()));
        return ruleY + 12f;
    }

    public float paintContinuationHeader(DocumentCanvas canvas, int page, float y) {
        String line = fit(header.continuationTitle(), PdfFont.BOLD, CONTINUATION_TITLE_FONT_SIZE, CONTENT_WIDTH);
        canvas.draw(page, new DrawCommand.Text(line, MARGIN, y + 4, PdfFont.BOLD,
                CONTINUATION_TITLE_FONT_SIZE, RgbColor.HEADER_TEXT));
        float ruleY = y + CONTINUATION_HEADER_HEIGHT;
        canvas.draw(page, new DrawCommand.Line(MARGIN, ruleY, PAGE_WIDTH - MARGIN, ruleY, 1f, style.primary()));
        return ruleY + 8f;
    }

    public void paintFooter(DocumentCanvas canvas, int page) {
        float footerY = PAGE_HEIGHT - FOOTER_HEIGHT;
        float attributionWidth = PdfFont.OBLIQUE.width(attribution, ATTRIBUTION_FONT_SIZE);
        canvas.draw(page, new DrawCommand.Text(attribution, (PAGE_WIDTH - attributionWidth) / 2, footerY,
                PdfFont.OBLIQUE, ATTRIBUTION_FONT_SIZE, RgbColor.ATTRIBUTION_TEXT));

        float barY = barY();
        canvas.draw(page, new DrawCommand.FillRect(0, barY, PAGE_WIDTH, FOOTER_BAR_HEIGHT, style.primary()));
        float bannerWidth = PdfFont.BOLD.width(style.bannerText(), BANNER_FONT_SIZE);
        canvas.draw(page, new DrawCommand.Text(style.bannerText(), (PAGE_WIDTH - bannerWidth) / 2, barY + 7,
                PdfFont.BOLD, BANNER_FONT_SIZE, RgbColor.WHITE));
        paintPageLabel(canvas, page, "Page " + page);
    }

    /**
     * Covers the placeholder label and paints the final one.
     */
    public void stampPageLabel(DocumentCanvas canvas, int page, int totalPages) {
        canvas.draw(page, new DrawCommand.FillRect(PAGE_WIDTH - MARGIN - PAGE_LABEL_BOX_WIDTH, barY(),
                PAGE_LABEL_BOX_WIDTH, FOOTER_BAR_HEIGHT, style.primary()));
        paintPageLabel(canvas, page, "Page " + page + " of " + totalPages);
    }

    private void paintPageLabel(DocumentCanvas canvas, int page, String label) {
        float width = PdfFont.REGULAR.width(label, PAGE_LABEL_FONT_SIZE);
        canvas.draw(page, new DrawCommand.Text(label, PAGE_WIDTH - MARGIN - width, barY() + 9,
                PdfFont.REGULAR, PAGE_LABEL_FONT_SIZE, style.pageLabelColor()));
    }

    private static float barY() {
        return PAGE_HEIGHT - FOOTER_HEIGHT + FOOTER_BAR_OFFSET;
    }

    /**
     * Shortens {@code text} with an ellipsis until it fits {@code maxWidth}.
     */
    static String fit(String text, PdfFont font, float fontSize, float maxWidth) {
        String printable = font.printable(text);
        if (font.width(printable, fontSize) <= maxWidth) {
            return printable;
        }
        String shortened = printable;
        while (!shortened.isEmpty() && font.width(shortened + "...", fontSize) > maxWidth) {
            shortened = shortened.substring(0, shortened.length() - 1);
        }
        return shortened.stripTrailing() + "...";
    }
}
