package uk.gegc.lessondocs.features.document.application.layout;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Text wrapped at a given width with real font metrics.
 * <p>
 * Measuring and painting both read from the same block, so the height used for a page-break decision
 * is exactly the height that gets painted. Source newlines are hard breaks; a blank source line
 * advances half a line.
 */
public final class TextBlock {

    private final List<Line> lines;
    private final PdfFont font;
    private final float fontSize;
    private final float lineAdvance;

    private TextBlock(List<Line> lines, PdfFont font, float fontSize, float lineGap) {
        this.lines = lines;
        this.font = font;
        this.fontSize = fontSize;
        this.lineAdvance = fontSize * PageGeometry.LINE_SPACING + lineGap;
    }

    public static TextBlock layout(String text, PdfFont font, float fontSize, float maxWidth, float lineGap) {
        List<Line> lines = new ArrayList<>();
        if (text != null && !text.isBlank()) {
            String[] paragraphs = text.replace("\r\n", "\n").split("\n", -1);
            for (int p = 0; p < paragraphs.length; p++) {
                String printable = font.printable(paragraphs[p]).strip();
                if (printable.isEmpty()) {
                    lines.add(new Line("", p));
                    continue;
                }
                for (String wrapped : wrap(printable, font, fontSize, maxWidth)) {
                    lines.add(new Line(wrapped, p));
                }
            }
        }
        return new TextBlock(lines, font, fontSize, lineGap);
    }

    /**
     * Greedy word wrap. A single word wider than the line is split by character.
     */
    static List<String> wrap(String text, PdfFont font, float fontSize, float maxWidth) {
        List<String> lines = new ArrayList<>();
        StringBuilder line = new StringBuilder();
        for (String word : text.split("\\s+")) {
            if (word.isEmpty()) {
                continue;
            }
            if (font.width(word, fontSize) > maxWidth) {
                if (line.length() > 0) {
                    lines.add(line.toString());
                    line = new StringBuilder();
                }
                List<String> pieces = splitWord(word, font, fontSize, maxWidth);
                lines.addAll(pieces.subList(0, pieces.size() - 1));
                line.append(pieces.get(pieces.size() - 1));
                continue;
            }
            String testLine = line.length() == 0 ? word : line + " " + word;
            if (font.width(testLine, fontSize) > maxWidth && line.length() > 0) {
                lines.add(line.toString());
                line = new StringBuilder(word);
            } else {
                line = new StringBuilder(testLine);
            }
        }
        if (line.length() > 0) {
            lines.add(line.toString());
        }
        return lines;
    }

    private static List<String> splitWord(String word, PdfFont font, float fontSize, float maxWidth) {
        List<String> pieces = new ArrayList<>();
        StringBuilder piece = new StringBuilder();
        word.codePoints().forEach(cp -> {
            String next = piece.toString() + new String(Character.toChars(cp));
            if (piece.length() > 0 && font.width(next, fontSize) > maxWidth) {
                pieces.add(piece.toString());
                piece.setLength(0);
            }
            piece.appendCodePoint(cp);
        });
        pieces.add(piece.toString());
        return pieces;
    }

    public List<Line> lines() {
        return lines;
    }

    public boolean isEmpty() {
        return lines.stream().allMatch(Line::isBlank);
    }

    public PdfFont font() {
        return font;
    }

    public float fontSize() {
        return fontSize;
    }

    public float lineAdvance() {
        return lineAdvance;
    }

    public float advanceOf(Line line) {
        return line.isBlank() ? lineAdvance * 0.5f : lineAdvance;
    }

    public float height() {
        return heightOf(0, lines.size());
    }

    public float heightOf(int fromLine, int toLine) {
        float height = 0f;
        for (int i = fromLine; i < toLine; i++) {
            height += advanceOf(lines.get(i));
        }
        return height;
    }

    /**
     * Rebuilds the source text of lines {@code fromLine} onwards so it can be wrapped again at another width.
     */
    public String remainderFrom(int fromLine) {
        List<Line> rest = lines.subList(Math.min(fromLine, lines.size()), lines.size());
        List<String> paragraphs = new ArrayList<>();
        int currentParagraph = -1;
        StringBuilder current = null;
        for (Line line : rest) {
            if (line.paragraph() != currentParagraph) {
                if (current != null) {
                    paragraphs.add(current.toString());
                }
                current = new StringBuilder(line.text());
                currentParagraph = line.paragraph();
            } else {
                current.append(' ').append(line.text());
            }
        }
        if (current != null) {
            paragraphs.add(current.toString());
        }
        return paragraphs.stream().collect(Collectors.joining("\n"));
    }

    public record Line(String text, int paragraph) {
        public boolean isBlank() {
            return text.isEmpty();
        }
    }
}
