package uk.gegc.lessondocs.features.document.application.layout;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.parallel.Execution;
import org.junit.jupiter.api.parallel.ExecutionMode;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@Execution(ExecutionMode.CONCURRENT)
@DisplayName("PdfFont Tests")
class PdfFontTest {

    @Test
    @DisplayName("printable: keeps WinAnsi characters such as accents, curly quotes and dashes")
    void printable_keepsWinAnsi() {
        assertThat(PdfFont.REGULAR.printable("Café — “leaf” • 20°C")).isEqualTo("Café — “leaf” • 20°C");
    }

    @Test
    @DisplayName("printable: maps special spaces, hyphens and symbols, drops emoji and control characters")
    void printable_substitutesAndDrops() {
        assertThat(PdfFont.BOLD.printable("a\u00A0b\u2011c \u2264 5 \u2248 6 \u2190 x")).isEqualTo("a b-c <= 5 ~ 6 <- x");
        assertThat(PdfFont.REGULAR.printable("\uD83E\uDD8BMonarch\007")).isEqualTo("Monarch");
        assertThat(PdfFont.REGULAR.printable(null)).isEmpty();
    }

    @Test
    @DisplayName("width: grows with text and size, zero for empty text")
    void width_measures() {
        float small = PdfFont.REGULAR.width("Milkweed", 10f);

        assertThat(small).isPositive();
        assertThat(PdfFont.REGULAR.width("Milkweed", 20f)).isCloseTo(small * 2, within(0.01f));
        assertThat(PdfFont.BOLD.width("Milkweed", 10f)).isGreaterThan(small);
        assertThat(PdfFont.REGULAR.width("", 10f)).isZero();
        assertThat(PdfFont.REGULAR.width(null, 10f)).isZero();
    }

    @Test
    @DisplayName("ascent: Helvetica ascender scaled to the font size")
    void ascent_scaled() {
        assertThat(PdfFont.OBLIQUE.ascent(10f)).isCloseTo(7.18f, within(0.001f));
    }
}
