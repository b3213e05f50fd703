package uk.gegc.lessondocs.features.document.application.layout;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static uk.gegc.lessondocs.features.document.application.layout.PageGeometry.*;

@DisplayName("PageFlow Tests")
class PageFlowTest {

    private static final SectionPalette SECTION = SectionPalette.of(232, 245, 233, 46, 125, 50);
    private static final CalloutPalette CALLOUT = CalloutPalette.of(255, 248, 225, 255, 179, 0);

    private PageFlow flow;

    @BeforeEach
    void setUp() {
        flow = PageFlow.begin(LayoutFixtures.frame());
    }

    @Test
    @DisplayName("begin: first page starts below the full header")
    void begin_startsBelowFullHeader() {
        assertThat(flow.currentPage()).isEqualTo(1);
        assertThat(flow.cursorY()).isEqualTo(92f);
        assertThat(flow.atPageTop()).isTrue();
        assertThat(LayoutFixtures.textValues(flowCanvasPeek(), 1)).contains("Monarch Butterfly", "3rd Grade");
    }

    @Test
    @DisplayName("ensureSpace: never breaks while the page is still empty")
    void ensureSpace_atPageTop_noBreak() {
        flow.ensureSpace(5000f);

        assertThat(flow.currentPage()).isEqualTo(1);
    }

    @Test
    @DisplayName("ensureSpace: breaks to a continuation page when the block does not fit")
    void ensureSpace_noRoom_breaks() {
        // Given
        flow.moveTo(650f);

        // When
        flow.ensureSpace(100f);

        // Then
        assertThat(flow.currentPage()).isEqualTo(2);
        assertThat(flow.cursorY()).isEqualTo(72f);
        assertThat(flow.continuationPageCapacity()).isEqualTo(632f);
    }

    @Test
    @DisplayName("paragraph: 100 lines flow over three pages and never pass the content bottom")
    void paragraph_longText_spansPages() {
        // Given
        String text = IntStream.rangeClosed(1, 100)
                .mapToObj(i -> "Observation " + i + ": the seedling leaned toward the window.")
                .collect(Collectors.joining("\n"));

        // When
        flow.bodyText(text);
        DocumentCanvas canvas = flow.finalizeFooters();

        // Then
        assertThat(canvas.pageCount()).isEqualTo(3);
        for (int page = 1; page <= 3; page++) {
            List<DrawCommand.Text> body = LayoutFixtures.texts(canvas, page)
                    .filter(t -> t.fontSize() == BODY_FONT_SIZE)
                    .toList();
            assertThat(body).isNotEmpty();
            assertThat(body).allSatisfy(t -> assertThat(t.y() + 14.4f).isLessThanOrEqualTo(CONTENT_BOTTOM + 0.01f));
        }
        long observations = IntStream.rangeClosed(1, 3)
                .mapToLong(page -> LayoutFixtures.textValues(canvas, page).stream()
                        .filter(t -> t.startsWith("Observation ")).count())
                .sum();
        assertThat(observations).isEqualTo(100);
    }

    @Test
    @DisplayName("finalizeFooters: every page is labelled with the final total")
    void finalizeFooters_labelsEveryPage() {
        // Given
        flow.breakPage();
        flow.breakPage();

        // When
        DocumentCanvas canvas = flow.finalizeFooters();

        // Then
        assertThat(flow.state().totalPages()).isEqualTo(3);
        for (int page = 1; page <= 3; page++) {
            assertThat(LayoutFixtures.textValues(canvas, page)).contains("Page " + page + " of 3", "FOR TEACHER USE ONLY");
        }
        assertThat(LayoutFixtures.textValues(canvas, 2)).contains("Monarch Butterfly — 3rd Grade Lesson Guide");
    }

    @Test
    @DisplayName("finalizeFooters: a finished flow rejects more drawing and a second finalization")
    void finalizeFooters_twice_throws() {
        flow.finalizeFooters();

        assertThatThrownBy(() -> flow.finalizeFooters()).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> flow.bodyText("late")).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> flow.state().finalizeTotal(1))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already finalized");
    }

    @Test
    @DisplayName("sectionHeading: moves to the next page with its first block when they do not fit together")
    void sectionHeading_keepWithNext() {
        // Given
        flow.moveTo(CONTENT_BOTTOM - 40f);

        // When
        flow.sectionHeading("Materials", SECTION, PageFlow.sectionHeadingHeight() + 30f);

        // Then
        assertThat(flow.currentPage()).isEqualTo(2);
        DocumentCanvas canvas = flow.finalizeFooters();
        assertThat(LayoutFixtures.textValues(canvas, 1)).doesNotContain("Materials");
        assertThat(LayoutFixtures.textValues(canvas, 2)).contains("Materials");
    }

    @Test
    @DisplayName("callout: boxed label and text, followed by spacing")
    void callout_paintsBox() {
        // When
        flow.callout("Teacher Tip:", "Let students handle the hand lenses before the walk.", CALLOUT);

        // Then
        DocumentCanvas canvas = flow.finalizeFooters();
        assertThat(canvas.commands(1)).anySatisfy(c -> {
            assertThat(c).isInstanceOf(DrawCommand.FillRect.class);
            assertThat(((DrawCommand.FillRect) c).color()).isEqualTo(CALLOUT.background());
        });
        assertThat(LayoutFixtures.textValues(canvas, 1)).contains("Teacher Tip:");
        assertThat(flow.cursorY()).isGreaterThan(92f + 12.8f + 14f + 20f);
    }

    @Test
    @DisplayName("callout: a box taller than a page is flowed as plain text")
    void callout_tallerThanPage_degradesToText() {
        // Given
        String text = IntStream.rangeClosed(1, 60)
                .mapToObj(i -> "Step " + i + ": record the temperature.")
                .collect(Collectors.joining("\n"));

        // When
        flow.callout("Safety:", text, CALLOUT);
        DocumentCanvas canvas = flow.finalizeFooters();

        // Then
        assertThat(canvas.pageCount()).isEqualTo(2);
        for (int page = 1; page <= 2; page++) {
            assertThat(canvas.commands(page))
                    .filteredOn(DrawCommand.FillRect.class::isInstance)
                    .map(c -> ((DrawCommand.FillRect) c).color())
                    .doesNotContain(CALLOUT.background());
        }
    }

    @Test
    @DisplayName("photoWithText: text starts beside the photo and the cursor lands below it")
    void photoWithText_sideBySide() {
        // Given
        BufferedImage photo = new BufferedImage(200, 150, BufferedImage.TYPE_INT_RGB);
        float top = flow.cursorY();

        // When
        flow.photoWithText(photo, 160f, 120f, "A monarch rests on a milkweed leaf.");

        // Then
        DocumentCanvas canvas = flow.finalizeFooters();
        DrawCommand.Image image = canvas.commands(1).stream()
                .filter(DrawCommand.Image.class::isInstance)
                .map(DrawCommand.Image.class::cast)
                .findFirst().orElseThrow();
        assertThat(image.width()).isCloseTo(160f, within(0.01f));
        assertThat(image.height()).isCloseTo(120f, within(0.01f));
        DrawCommand.Text description = LayoutFixtures.texts(canvas, 1)
                .filter(t -> t.text().startsWith("A monarch"))
                .findFirst().orElseThrow();
        assertThat(description.x()).isEqualTo(MARGIN + 160f + 16f);
        assertThat(description.y()).isEqualTo(top + 2f);
        assertThat(flow.cursorY()).isEqualTo(top + 120f + 16f);
    }

    @Test
    @DisplayName("finish: serializes a PDF with the laid-out text")
    void finish_serializesPdf() throws Exception {
        // Given
        flow.sectionHeading("Core Science Concepts", SECTION, 60f);
        flow.bodyText("Butterflies go through four life stages.");

        // When
        byte[] pdf = flow.finish(0.85f);

        // Then
        try (PDDocument document = PDDocument.load(pdf)) {
            assertThat(document.getNumberOfPages()).isEqualTo(1);
            String text = new PDFTextStripper().getText(document);
            assertThat(text).contains("Core Science Concepts", "Butterflies go through four life stages.");
        }
    }

    private DocumentCanvas flowCanvasPeek() {
        return flow.finalizeFooters();
    }
}
