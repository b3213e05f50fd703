package uk.gegc.lessondocs.features.document.application.table;

import uk.gegc.lessondocs.features.content.domain.model.RubricCriteria;
import uk.gegc.lessondocs.features.content.domain.model.RubricQuestion;
import uk.gegc.lessondocs.features.document.application.layout.DrawCommand;
import uk.gegc.lessondocs.features.document.application.layout.PageFlow;
import uk.gegc.lessondocs.features.document.application.layout.PdfFont;
import uk.gegc.lessondocs.features.document.application.layout.RgbColor;
import uk.gegc.lessondocs.features.document.application.layout.TextBlock;

import java.util.ArrayList;
import java.util.List;

import static uk.gegc.lessondocs.features.document.application.layout.PageGeometry.CONTENT_WIDTH;
import static uk.gegc.lessondocs.features.document.application.layout.PageGeometry.MARGIN;

/**
 * Five-column rubric table on top of a {@link PageFlow}: one wide question column and four equal
 * proficiency columns.
 * <p>
 * Each row is as tall as its tallest cell, never shorter than {@link #MIN_ROW_HEIGHT}. A row that does
 * not fit starts a new page, and the column header row is repainted there before the row.
 */
public class RubricTableRenderer {

    public static final float MIN_ROW_HEIGHT = 36f;
    public static final float HEADER_ROW_HEIGHT = 24f;
    static final float CELL_PADDING = 5f;
    static final float QUESTION_COLUMN_SHARE = 0.26f;
    static final float HEADER_FONT_SIZE = 9f;
    static final float CELL_FONT_SIZE = 9f;
    static final float QUESTION_FONT_SIZE = 9.5f;
    static final float ANNOTATION_FONT_SIZE = 7.5f;
    static final float CELL_LINE_GAP = 1f;

    static final String[] COLUMN_LABELS = {"Question", "Exceeds (4)", "Meets (3)", "Approaching (2)", "Beginning (1)"};

    static final RgbColor HEADER_BACKGROUND = RgbColor.of(216, 67, 21);
    static final RgbColor ROW_EVEN = RgbColor.WHITE;
    static final RgbColor ROW_ODD = RgbColor.of(253, 246, 243);
    static final RgbColor QUESTION_COLUMN = RgbColor.of(250, 250, 250);
    static final RgbColor BORDER = RgbColor.of(200, 200, 200);
    static final RgbColor ANNOTATION_TEXT = RgbColor.of(120, 120, 120);

    private final PageFlow flow;
    private final float[] columnX = new float[5];
    private final float[] columnWidth = new float[5];

    public RubricTableRenderer(PageFlow flow) {
        this.flow = flow;
        float questionWidth = CONTENT_WIDTH * QUESTION_COLUMN_SHARE;
        float levelWidth = (CONTENT_WIDTH - questionWidth) / 4;
        float x = MARGIN;
        for (int i = 0; i < 5; i++) {
            columnX[i] = x;
            columnWidth[i] = i == 0 ? questionWidth : (i == 4 ? MARGIN + CONTENT_WIDTH - x : levelWidth);
            x += columnWidth[i];
        }
    }

    public float columnWidth(int column) {
        return columnWidth[column];
    }

    /**
     * @return cursor position below the header row
     */
    public float renderHeaderRow() {
        return renderHeaderRow(MIN_ROW_HEIGHT);
    }

    /**
     * Paints the header row, breaking the page first unless a row of {@code firstRowHeight} fits below it.
     *
     * @return cursor position below the header row
     */
    public float renderHeaderRow(float firstRowHeight) {
        flow.ensureSpace(HEADER_ROW_HEIGHT + Math.max(MIN_ROW_HEIGHT, Math.min(firstRowHeight, maxRowHeight())));
        float y = flow.cursorY();
        flow.draw(new DrawCommand.FillRect(MARGIN, y, CONTENT_WIDTH, HEADER_ROW_HEIGHT, HEADER_BACKGROUND));
        for (int i = 0; i < COLUMN_LABELS.length; i++) {
            float labelWidth = PdfFont.BOLD.width(COLUMN_LABELS[i], HEADER_FONT_SIZE);
            float labelX = columnX[i] + (columnWidth[i] - labelWidth) / 2;
            flow.draw(new DrawCommand.Text(COLUMN_LABELS[i], labelX, y + 7, PdfFont.BOLD, HEADER_FONT_SIZE, RgbColor.WHITE));
        }
        flow.advance(HEADER_ROW_HEIGHT);
        return flow.cursorY();
    }

    /**
     * Paints one question row, breaking the page and repeating the header row first when it does not fit.
     *
     * @param rowIndex zero-based position, used for the alternating tint
     * @return cursor position below the row
     */
    public float renderRow(RubricQuestion question, int rowIndex) {
        List<CellText> cells = measureCells(question);
        float rowHeight = rowHeight(cells);

        float maxRowHeight = maxRowHeight();
        if (rowHeight > maxRowHeight) {
            cells = clip(cells, maxRowHeight);
            rowHeight = maxRowHeight;
        }

        if (!flow.fits(rowHeight)) {
            flow.breakPage();
            renderHeaderRow(rowHeight);
        }

        float y = flow.cursorY();
        RgbColor rowTint = rowIndex % 2 == 0 ? ROW_EVEN : ROW_ODD;
        for (int i = 0; i < 5; i++) {
            RgbColor tint = i == 0 ? QUESTION_COLUMN : rowTint;
            flow.draw(new DrawCommand.FillRect(columnX[i], y, columnWidth[i], rowHeight, tint));
            flow.draw(new DrawCommand.StrokeRect(columnX[i], y, columnWidth[i], rowHeight, 0.5f, BORDER));
            paintCell(cells.get(i), columnX[i] + CELL_PADDING, y + CELL_PADDING);
        }
        flow.advance(rowHeight);
        return flow.cursorY();
    }

    /**
     * Height the row for {@code question} will take, before clipping.
     */
    public float measureRow(RubricQuestion question) {
        return rowHeight(measureCells(question));
    }

    /**
     * Height the row for {@code question} will be painted at, after clipping to one page.
     */
    public float fittedRowHeight(RubricQuestion question) {
        return Math.min(measureRow(question), maxRowHeight());
    }

    private float maxRowHeight() {
        return flow.continuationPageCapacity() - HEADER_ROW_HEIGHT;
    }

    private List<CellText> measureCells(RubricQuestion question) {
        RubricCriteria criteria = question.rubric();
        List<CellText> cells = new ArrayList<>(5);
        float questionTextWidth = columnWidth[0] - 2 * CELL_PADDING;
        TextBlock questionBlock = TextBlock.layout(question.questionText(), PdfFont.BOLD, QUESTION_FONT_SIZE,
                questionTextWidth, CELL_LINE_GAP);
        TextBlock annotation = question.hasTaxonomy()
                ? TextBlock.layout(taxonomyLabel(question), PdfFont.OBLIQUE, ANNOTATION_FONT_SIZE, questionTextWidth, CELL_LINE_GAP)
                : null;
        cells.add(new CellText(questionBlock, annotation, RgbColor.HEADER_TEXT));

        String[] levels = {criteria.exceeds(), criteria.meets(), criteria.approaching(), criteria.beginning()};
        for (int i = 0; i < levels.length; i++) {
            TextBlock block = TextBlock.layout(levels[i], PdfFont.REGULAR, CELL_FONT_SIZE,
                    columnWidth[i + 1] - 2 * CELL_PADDING, CELL_LINE_GAP);
            cells.add(new CellText(block, null, RgbColor.BODY_TEXT));
        }
        return cells;
    }

    private float rowHeight(List<CellText> cells) {
        float tallest = 0f;
        for (CellText cell : cells) {
            tallest = Math.max(tallest, cell.height() + 2 * CELL_PADDING + 2);
        }
        return Math.max(MIN_ROW_HEIGHT, tallest);
    }

    private List<CellText> clip(List<CellText> cells, float maxRowHeight) {
        float budget = maxRowHeight - 2 * CELL_PADDING - 2;
        List<CellText> clipped = new ArrayList<>(cells.size());
        for (CellText cell : cells) {
            clipped.add(cell.height() > budget ? cell.clippedTo(budget) : cell);
        }
        return clipped;
    }

    private void paintCell(CellText cell, float x, float y) {
        float lineY = y;
        for (String line : cell.lines()) {
            flow.draw(new DrawCommand.Text(line, x, lineY, cell.block().font(), cell.block().fontSize(), cell.color()));
            lineY += cell.block().lineAdvance();
        }
        if (cell.annotation() != null) {
            lineY += 3;
            for (TextBlock.Line line : cell.annotation().lines()) {
                flow.draw(new DrawCommand.Text(line.text(), x, lineY, PdfFont.OBLIQUE, ANNOTATION_FONT_SIZE, ANNOTATION_TEXT));
                lineY += cell.annotation().lineAdvance();
            }
        }
    }

    private static String taxonomyLabel(RubricQuestion question) {
        List<String> parts = new ArrayList<>(2);
        if (question.bloomsLevel() != null && !question.bloomsLevel().isBlank()) {
            parts.add("Bloom’s: " + question.bloomsLevel().strip());
        }
        if (question.dokLevel() != null && !question.dokLevel().isBlank()) {
            parts.add("DOK: " + question.dokLevel().strip());
        }
        return String.join(" | ", parts);
    }

    private record CellText(TextBlock block, TextBlock annotation, RgbColor color, List<String> lines) {

        CellText(TextBlock block, TextBlock annotation, RgbColor color) {
            this(block, annotation, color, block.lines().stream().map(TextBlock.Line::text).toList());
        }

        float height() {
            float height = lines.size() * block.lineAdvance();
            if (annotation != null) {
                height += 3 + annotation.height();
            }
            return height;
        }

        CellText clippedTo(float budget) {
            float annotationHeight = annotation == null ? 0f : 3 + annotation.height();
            int keep = (int) Math.floor((budget - annotationHeight) / block.lineAdvance());
            keep = Math.max(1, Math.min(keep, lines.size()));
            List<String> kept = new ArrayList<>(lines.subList(0, keep));
            if (keep < lines.size()) {
                kept.set(keep - 1, kept.get(keep - 1) + "...");
            }
            return new CellText(block, annotation, color, kept);
        }
    }
}
