package uk.gegc.lessondocs.features.document.application.layout;

import lombok.extern.slf4j.Slf4j;

import java.awt.image.BufferedImage;
import java.io.IOException;

import static uk.gegc.lessondocs.features.document.application.layout.PageGeometry.*;

/**
 * Page-flow engine for one render call.
 * <p>
 * Blocks are measured at their real width before they are placed. When a block does not fit above
 * {@link PageGeometry#CONTENT_BOTTOM} the current page gets its placeholder footer, a new page starts
 * with the continuation header, and placement resumes below it. Paragraphs are checked line by line,
 * so long sections break mid-section. {@link #finish(float)} stamps "Page i of N" on every page and
 * serializes the recorded canvas.
 * <p>
 * Instances are single use and not thread-safe.
 */
@Slf4j
public class PageFlow {

    static final float SECTION_BAR_HEIGHT = 22f;
    static final float SECTION_BAR_GAP = 5f;
    static final float CALLOUT_INSET = 10f;
    static final float CALLOUT_BORDER = 4f;
    static final float CALLOUT_PADDING = 8f;
    static final float CALLOUT_LINE_GAP = 2f;
    static final float PHOTO_TEXT_GAP = 16f;
    static final float PHOTO_BLOCK_GAP = 16f;

    private final PageFrame frame;
    private final DocumentCanvas canvas = new DocumentCanvas();
    private final PageState state;
    private float pageContentTop;
    private boolean finished;

    private PageFlow(PageFrame frame) {
        this.frame = frame;
        int first = canvas.addPage();
        float contentTop = frame.paintFullHeader(canvas, first, MARGIN);
        this.state = new PageState(contentTop);
        this.pageContentTop = contentTop;
    }

    /**
     * Starts a document: allocates the canvas and page state and paints the first-page header.
     */
    public static PageFlow begin(PageFrame frame) {
        return new PageFlow(frame);
    }

    public PageState state() {
        return state;
    }

    public float cursorY() {
        return state.cursorY();
    }

    public int currentPage() {
        return state.currentPageIndex();
    }

    public float remaining() {
        return CONTENT_BOTTOM - state.cursorY();
    }

    public boolean fits(float blockHeight) {
        return state.cursorY() + blockHeight <= CONTENT_BOTTOM;
    }

    /**
     * True while nothing has been placed below the header of the current page.
     */
    public boolean atPageTop() {
        return state.cursorY() <= pageContentTop;
    }

    /**
     * Height a block can use on a freshly started continuation page.
     */
    public float continuationPageCapacity() {
        return CONTENT_BOTTOM - (MARGIN + PageFrame.CONTINUATION_HEADER_HEIGHT + 8f);
    }

    /**
     * Breaks the page unless {@code blockHeight} fits. A block that cannot fit even on a fresh page is
     * placed at the top of the current one rather than breaking forever.
     */
    public void ensureSpace(float blockHeight) {
        if (!fits(blockHeight) && !atPageTop()) {
            breakPage();
        }
    }

    public void breakPage() {
        ensureOpen();
        int leaving = state.currentPageIndex();
        frame.paintFooter(canvas, leaving);
        int next = canvas.addPage();
        float contentTop = frame.paintContinuationHeader(canvas, next, MARGIN);
        state.nextPage(contentTop);
        pageContentTop = contentTop;
        log.debug("Page break after page {} (content top {})", leaving, contentTop);
    }

    public void advance(float dy) {
        state.advance(dy);
    }

    public void moveTo(float y) {
        state.moveTo(y);
    }

    public void draw(DrawCommand command) {
        ensureOpen();
        canvas.draw(state.currentPageIndex(), command);
    }

    /**
     * Tinted heading bar. {@code keepWithNext} is the height that must fit below the current cursor for
     * the heading to stay on this page.
     */
    public void sectionHeading(String label, SectionPalette palette, float keepWithNext) {
        ensureSpace(Math.max(keepWithNext, SECTION_BAR_HEIGHT + SECTION_BAR_GAP));
        float y = state.cursorY();
        draw(new DrawCommand.FillRect(MARGIN, y, CONTENT_WIDTH, SECTION_BAR_HEIGHT, palette.background()));
        draw(new DrawCommand.Text(label, MARGIN + 8, y + 5, PdfFont.BOLD, SECTION_HEADER_FONT_SIZE, palette.text()));
        advance(SECTION_BAR_HEIGHT + SECTION_BAR_GAP);
    }

    public static float sectionHeadingHeight() {
        return SECTION_BAR_HEIGHT + SECTION_BAR_GAP;
    }

    /**
     * Body text flowed line by line from the cursor, followed by the block gap.
     */
    public void paragraph(String text, float x, float width, PdfFont font, float fontSize, RgbColor color) {
        paragraph(TextBlock.layout(text, font, fontSize, width, LINE_GAP), x, color);
    }

    public void paragraph(TextBlock block, float x, RgbColor color) {
        for (TextBlock.Line line : block.lines()) {
            float advance = block.advanceOf(line);
            if (!line.isBlank()) {
                ensureSpace(advance);
                draw(new DrawCommand.Text(line.text(), x, state.cursorY(), block.font(), block.fontSize(), color));
            }
            advance(advance);
        }
        advance(BLOCK_GAP);
    }

    public void bodyText(String text) {
        paragraph(text, MARGIN + 4, CONTENT_WIDTH - 8, PdfFont.REGULAR, BODY_FONT_SIZE, RgbColor.BODY_TEXT);
    }

    /**
     * Tinted box with a colored left border, a bold label and wrapped text. A box taller than a whole
     * page is flowed as plain text instead.
     */
    public void callout(String label, String text, CalloutPalette palette) {
        float boxX = MARGIN + CALLOUT_INSET;
        float boxWidth = CONTENT_WIDTH - 2 * CALLOUT_INSET;
        float textX = boxX + CALLOUT_BORDER + CALLOUT_PADDING;
        float textWidth = boxWidth - CALLOUT_BORDER - 2 * CALLOUT_PADDING - 5;

        TextBlock labelBlock = TextBlock.layout(label, PdfFont.BOLD, CALLOUT_FONT_SIZE, textWidth, CALLOUT_LINE_GAP);
        TextBlock body = TextBlock.layout(text, PdfFont.REGULAR, CALLOUT_FONT_SIZE, textWidth, CALLOUT_LINE_GAP);
        float boxHeight = labelBlock.height() + body.height() + 2 * CALLOUT_PADDING + 4;

        if (boxHeight > continuationPageCapacity()) {
            log.debug("Callout '{}' taller than a page ({}), flowing as text", label, boxHeight);
            paragraph(labelBlock, textX, palette.border());
            paragraph(body, textX, RgbColor.BODY_TEXT);
            return;
        }

        ensureSpace(boxHeight);
        float y = state.cursorY();
        draw(new DrawCommand.FillRect(boxX, y, boxWidth, boxHeight, palette.background()));
        draw(new DrawCommand.FillRect(boxX, y, CALLOUT_BORDER, boxHeight, palette.border()));

        float lineY = y + CALLOUT_PADDING;
        for (TextBlock.Line line : labelBlock.lines()) {
            draw(new DrawCommand.Text(line.text(), textX, lineY, PdfFont.BOLD, CALLOUT_FONT_SIZE, RgbColor.HEADER_TEXT));
            lineY += labelBlock.advanceOf(line);
        }
        lineY += 4;
        for (TextBlock.Line line : body.lines()) {
            if (!line.isBlank()) {
                draw(new DrawCommand.Text(line.text(), textX, lineY, PdfFont.REGULAR, CALLOUT_FONT_SIZE, RgbColor.BODY_TEXT));
            }
            lineY += body.advanceOf(line);
        }
        advance(boxHeight + 8);
    }

    /**
     * Photo fitted into a {@code boxWidth x boxHeight} box at the left margin with the text wrapped beside
     * it. Text that does not fit beside the photo continues at full width underneath.
     */
    public void photoWithText(BufferedImage photo, float boxWidth, float boxHeight, String text) {
        ensureSpace(boxHeight + PHOTO_BLOCK_GAP);
        float top = state.cursorY();

        float scale = Math.min(boxWidth / photo.getWidth(), boxHeight / photo.getHeight());
        float drawWidth = photo.getWidth() * scale;
        float drawHeight = photo.getHeight() * scale;
        float photoX = MARGIN + 4 + (boxWidth - drawWidth) / 2;
        float photoY = top + 2 + (boxHeight - drawHeight) / 2;
        draw(new DrawCommand.Image(photo, photoX, photoY, drawWidth, drawHeight, false));

        float textX = MARGIN + boxWidth + PHOTO_TEXT_GAP;
        float textWidth = CONTENT_WIDTH - boxWidth - PHOTO_TEXT_GAP;
        TextBlock block = TextBlock.layout(text, PdfFont.REGULAR, BODY_FONT_SIZE, textWidth, LINE_GAP);
        float lineY = top + 2;
        float besideLimit = top + boxHeight + 4;
        int placed = 0;
        for (TextBlock.Line line : block.lines()) {
            float advance = block.advanceOf(line);
            if (lineY + advance > besideLimit) {
                break;
            }
            if (!line.isBlank()) {
                draw(new DrawCommand.Text(line.text(), textX, lineY, PdfFont.REGULAR, BODY_FONT_SIZE, RgbColor.BODY_TEXT));
            }
            lineY += advance;
            placed++;
        }

        moveTo(top + boxHeight + PHOTO_BLOCK_GAP);
        if (placed < block.lines().size()) {
            bodyText(block.remainderFrom(placed));
        }
    }

    /**
     * Single line centered on the content area.
     */
    public void centeredLine(String text, PdfFont font, float fontSize, RgbColor color) {
        float lineAdvance = fontSize * LINE_SPACING + LINE_GAP;
        ensureSpace(lineAdvance);
        String printable = PageFrame.fit(text, font, fontSize, CONTENT_WIDTH);
        float width = font.width(printable, fontSize);
        draw(new DrawCommand.Text(printable, MARGIN + (CONTENT_WIDTH - width) / 2, state.cursorY(), font, fontSize, color));
        advance(lineAdvance);
    }

    /**
     * Paints the last footer, fixes the page total and stamps every page with its final label.
     *
     * @return the finished canvas, ready to serialize
     */
    public DocumentCanvas finalizeFooters() {
        ensureOpen();
        frame.paintFooter(canvas, state.currentPageIndex());
        state.finalizeTotal(canvas.pageCount());
        int total = state.totalPages();
        for (int page = 1; page <= total; page++) {
            frame.stampPageLabel(canvas, page, total);
        }
        finished = true;
        return canvas;
    }

    public byte[] finish(float jpegQuality) throws IOException {
        return finalizeFooters().serialize(jpegQuality);
    }

    private void ensureOpen() {
        if (finished) {
            throw new IllegalStateException("Page flow already finalized");
        }
    }
}
