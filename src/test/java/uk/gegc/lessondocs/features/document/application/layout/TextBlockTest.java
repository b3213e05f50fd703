package uk.gegc.lessondocs.features.document.application.layout;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.parallel.Execution;
import org.junit.jupiter.api.parallel.ExecutionMode;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@Execution(ExecutionMode.CONCURRENT)
@DisplayName("TextBlock Tests")
class TextBlockTest {

    private static final float BODY = PageGeometry.BODY_FONT_SIZE;

    @Test
    @DisplayName("layout: every wrapped line fits the width")
    void layout_linesFitWidth() {
        // Given
        String text = "Monarch caterpillars eat only milkweed leaves, which contain chemicals that make the "
                + "caterpillars taste bad to birds and other predators that might try to eat them.";

        // When
        TextBlock block = TextBlock.layout(text, PdfFont.REGULAR, BODY, 150f, PageGeometry.LINE_GAP);

        // Then
        assertThat(block.lines()).hasSizeGreaterThan(3);
        assertThat(block.lines())
                .allSatisfy(line -> assertThat(PdfFont.REGULAR.width(line.text(), BODY)).isLessThanOrEqualTo(150f));
    }

    @Test
    @DisplayName("layout: line advance is size x 1.2 plus the gap")
    void layout_lineAdvance() {
        TextBlock block = TextBlock.layout("One line.", PdfFont.REGULAR, BODY, 500f, 3f);

        assertThat(block.lineAdvance()).isCloseTo(14.4f, within(0.001f));
        assertThat(block.height()).isCloseTo(14.4f, within(0.001f));
    }

    @Test
    @DisplayName("layout: newlines are hard breaks and blank lines advance half a line")
    void layout_hardBreaksAndBlankLines() {
        // When
        TextBlock block = TextBlock.layout("First.\n\nSecond.", PdfFont.REGULAR, BODY, 500f, 3f);

        // Then
        assertThat(block.lines()).extracting(TextBlock.Line::text).containsExactly("First.", "", "Second.");
        assertThat(block.lines()).extracting(TextBlock.Line::paragraph).containsExactly(0, 1, 2);
        assertThat(block.height()).isCloseTo(14.4f * 2.5f, within(0.001f));
    }

    @Test
    @DisplayName("layout: a word wider than the line is split by character")
    void layout_overlongWord_split() {
        // When
        TextBlock block = TextBlock.layout("Pneumonoultramicroscopicsilicovolcanoconiosis", PdfFont.BOLD, 12f, 60f, 2f);

        // Then
        assertThat(block.lines()).hasSizeGreaterThan(1);
        assertThat(String.join("", block.lines().stream().map(TextBlock.Line::text).toList()))
                .isEqualTo("Pneumonoultramicroscopicsilicovolcanoconiosis");
        assertThat(block.lines())
                .allSatisfy(line -> assertThat(PdfFont.BOLD.width(line.text(), 12f)).isLessThanOrEqualTo(60f));
    }

    @Test
    @DisplayName("layout: null and blank text give an empty block")
    void layout_blank_emptyBlock() {
        TextBlock block = TextBlock.layout(null, PdfFont.REGULAR, BODY, 500f, 3f);

        assertThat(block.isEmpty()).isTrue();
        assertThat(block.height()).isZero();
        assertThat(TextBlock.layout("  \n ", PdfFont.REGULAR, BODY, 500f, 3f).lines()).isEmpty();
    }

    @Test
    @DisplayName("layout: substitutes or drops characters the font cannot show")
    void layout_unencodableCharacters() {
        TextBlock block = TextBlock.layout("🌱 Sprouts grow ≥ 2 cm → measure", PdfFont.REGULAR, BODY, 500f, 3f);

        assertThat(block.lines()).extracting(TextBlock.Line::text).containsExactly("Sprouts grow >= 2 cm -> measure");
    }

    @Test
    @DisplayName("remainderFrom: rebuilds the source text of the remaining lines by paragraph")
    void remainderFrom_rebuildsParagraphs() {
        // Given
        TextBlock block = TextBlock.layout("alpha beta gamma delta\nepsilon", PdfFont.REGULAR, 10f, 40f, 2f);
        int lines = block.lines().size();

        // When / Then
        assertThat(block.remainderFrom(0)).isEqualTo("alpha beta gamma delta\nepsilon");
        assertThat(block.remainderFrom(lines - 1)).isEqualTo("epsilon");
        assertThat(block.remainderFrom(lines)).isEmpty();
    }

    @Test
    @DisplayName("heightOf: sums the advances of a line range")
    void heightOf_range() {
        TextBlock block = TextBlock.layout("a\nb\nc", PdfFont.REGULAR, 10f, 100f, 0f);

        assertThat(block.heightOf(0, 2)).isCloseTo(24f, within(0.001f));
        assertThat(block.heightOf(1, 1)).isZero();
    }
}
