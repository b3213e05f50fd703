package uk.gegc.lessondocs.features.document.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import uk.gegc.lessondocs.features.content.domain.model.Category;
import uk.gegc.lessondocs.features.content.domain.model.ContentRecord;
import uk.gegc.lessondocs.features.content.domain.model.DocumentType;
import uk.gegc.lessondocs.features.content.domain.model.GradeLevel;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RenderPayload Tests")
class RenderPayloadTest {

    private static final ContentRecord RECORD = ContentRecord.of("Crème Brûlée & the Sun's Heat!",
            Category.PHYSICAL_SCIENCE, GradeLevel.FIRST_GRADE, "");

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "LESSON_GUIDE, creme-brulee-the-sun-s-heat-lesson-first-grade.pdf",
            "FIVE_E_PLAN, creme-brulee-the-sun-s-heat-5e-first-grade.pdf",
            "EXIT_TICKET, creme-brulee-the-sun-s-heat-exit-ticket-first-grade.pdf"
    })
    @DisplayName("filenameFor: slug of title, type and grade")
    void filenameFor_derived(DocumentType type, String expected) {
        assertThat(RenderPayload.of(RECORD).filenameFor(type)).isEqualTo(expected);
    }

    @Test
    @DisplayName("filenameFor: explicit prefix wins, blank prefix is ignored")
    void filenameFor_explicitPrefix() {
        assertThat(new RenderPayload(RECORD, null, "custom-name").filenameFor(DocumentType.RUBRIC))
                .isEqualTo("custom-name.pdf");
        assertThat(new RenderPayload(RECORD, null, "  ").filenameFor(DocumentType.RUBRIC))
                .isEqualTo("creme-brulee-the-sun-s-heat-rubric-first-grade.pdf");
    }

    @Test
    @DisplayName("slugify: title without letters or digits falls back to document")
    void slugify_symbolsOnly() {
        assertThat(RenderPayload.slugify("🌋 !!!")).isEqualTo("document");
    }

    @Test
    @DisplayName("constructor: record is required")
    void constructor_nullRecord_throws() {
        assertThatThrownBy(() -> RenderPayload.of(null)).isInstanceOf(IllegalArgumentException.class);
    }
}
