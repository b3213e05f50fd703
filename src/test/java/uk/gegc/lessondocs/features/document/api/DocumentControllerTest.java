package uk.gegc.lessondocs.features.document.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import uk.gegc.lessondocs.features.backfill.application.BackfillService;
import uk.gegc.lessondocs.features.backfill.domain.model.BackfillResult;
import uk.gegc.lessondocs.features.backfill.domain.model.BackfillStatus;
import uk.gegc.lessondocs.features.backfill.domain.model.BackfillSummary;
import uk.gegc.lessondocs.features.content.application.RubricDataParser;
import uk.gegc.lessondocs.features.content.domain.model.DocumentType;
import uk.gegc.lessondocs.features.content.domain.model.RubricCriteria;
import uk.gegc.lessondocs.features.content.domain.model.RubricQuestion;
import uk.gegc.lessondocs.features.document.application.DocumentRenderService;
import uk.gegc.lessondocs.features.document.domain.model.RenderPayload;
import uk.gegc.lessondocs.features.document.domain.model.RenderedDocument;
import uk.gegc.lessondocs.shared.exception.DocumentRenderException;
import uk.gegc.lessondocs.shared.exception.InvalidRubricDataException;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(DocumentController.class)
@AutoConfigureMockMvc(addFilters = false)
@DisplayName("DocumentController")
class DocumentControllerTest {

    private static final String LESSON_REQUEST = """
            {
              "title": "Monarch Butterfly on Milkweed",
              "category": "life-science",
              "gradeLevel": "third-grade",
              "rawBody": "## Photo Description\\nA monarch rests on a leaf."
            }
            """;

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private DocumentRenderService documentRenderService;

    @MockitoBean
    private RubricDataParser rubricDataParser;

    @MockitoBean
    private BackfillService backfillService;

    @Test
    @DisplayName("POST /api/v1/documents/lesson returns the PDF as an attachment")
    void render_lesson_returnsPdf() throws Exception {
        byte[] pdf = "%PDF-1.4 lesson".getBytes(StandardCharsets.US_ASCII);
        when(documentRenderService.render(eq(DocumentType.LESSON_GUIDE), any(RenderPayload.class)))
                .thenReturn(new RenderedDocument("monarch-butterfly-on-milkweed-lesson-third-grade.pdf",
                        "application/pdf", () -> new ByteArrayInputStream(pdf), pdf.length, 2));

        mockMvc.perform(post("/api/v1/documents/lesson")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(LESSON_REQUEST))
                .andExpect(status().isOk())
                .andExpect(content().contentType(MediaType.APPLICATION_PDF))
                .andExpect(header().string("Content-Disposition",
                        "attachment; filename=\"monarch-butterfly-on-milkweed-lesson-third-grade.pdf\""))
                .andExpect(header().string("X-Page-Count", "2"))
                .andExpect(content().bytes(pdf));

        verify(documentRenderService).render(eq(DocumentType.LESSON_GUIDE), argThat(payload ->
                payload.record().title().equals("Monarch Butterfly on Milkweed")
                        && payload.record().rawBody().startsWith("## Photo Description")));
    }

    @Test
    @DisplayName("POST /api/v1/documents/lesson escapes quotes in a caller supplied filename")
    void render_filenameWithQuotes_escaped() throws Exception {
        byte[] pdf = "%PDF-1.4 lesson".getBytes(StandardCharsets.US_ASCII);
        when(documentRenderService.render(eq(DocumentType.LESSON_GUIDE), any(RenderPayload.class)))
                .thenReturn(new RenderedDocument("field-notes \"draft\".pdf",
                        "application/pdf", () -> new ByteArrayInputStream(pdf), pdf.length, 1));

        mockMvc.perform(post("/api/v1/documents/lesson")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(LESSON_REQUEST))
                .andExpect(status().isOk())
                .andExpect(header().string("Content-Disposition",
                        "attachment; filename=\"field-notes \\\"draft\\\".pdf\""));
    }

    @Test
    @DisplayName("POST /api/v1/documents/poster returns 400 for an unknown document type")
    void render_unknownType_badRequest() throws Exception {
        mockMvc.perform(post("/api/v1/documents/poster")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(LESSON_REQUEST))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title").value("Unsupported Document Type"))
                .andExpect(jsonPath("$.detail").value(containsString("poster")));

        verify(documentRenderService, never()).render(any(), any());
    }

    @Test
    @DisplayName("POST /api/v1/documents/lesson without a title returns 400 with field errors")
    void render_missingTitle_validationFailed() throws Exception {
        mockMvc.perform(post("/api/v1/documents/lesson")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"category": "life-science", "gradeLevel": "third-grade"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title").value("Validation Failed"))
                .andExpect(jsonPath("$.fieldErrors[0].field").value("title"));
    }

    @Test
    @DisplayName("POST /api/v1/documents/lesson with an unknown grade returns 400")
    void render_unknownGrade_malformed() throws Exception {
        mockMvc.perform(post("/api/v1/documents/lesson")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"title": "Monarch", "category": "life-science", "gradeLevel": "ninth-grade"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title").value("Malformed JSON"));
    }

    @Test
    @DisplayName("POST /api/v1/documents/rubric returns 422 when rubric data is missing")
    void render_rubricWithoutQuestions_unprocessable() throws Exception {
        when(documentRenderService.render(eq(DocumentType.RUBRIC), any(RenderPayload.class)))
                .thenThrow(new InvalidRubricDataException("Rubric questions are required to render a rubric"));

        mockMvc.perform(post("/api/v1/documents/rubric")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(LESSON_REQUEST))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.title").value("Invalid Rubric Data"));
    }

    @Test
    @DisplayName("POST /api/v1/documents/5e returns 500 when the render fails")
    void render_failure_serverError() throws Exception {
        when(documentRenderService.render(eq(DocumentType.FIVE_E_PLAN), any(RenderPayload.class)))
                .thenThrow(new DocumentRenderException("5e", "Monarch Butterfly on Milkweed", new IllegalStateException("boom")));

        mockMvc.perform(post("/api/v1/documents/5e")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(LESSON_REQUEST))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.title").value("Document Render Failed"));
    }

    @Test
    @DisplayName("POST /api/v1/documents/rubric-data returns the parsed questions")
    void parseRubricData_returnsQuestions() throws Exception {
        when(rubricDataParser.parse(anyString())).thenReturn(List.of(
                new RubricQuestion("Why do leaves change color?", "Analyze", "2",
                        new RubricCriteria("e", "m", "a", "b"))));

        mockMvc.perform(post("/api/v1/documents/rubric-data")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"questions\": []}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].questionText").value("Why do leaves change color?"))
                .andExpect(jsonPath("$[0].rubric.meets").value("m"));
    }

    @Test
    @DisplayName("POST /api/v1/documents/rubric-data returns 422 for data without the rubric shape")
    void parseRubricData_invalid_unprocessable() throws Exception {
        when(rubricDataParser.parse(anyString()))
                .thenThrow(new InvalidRubricDataException("Rubric data must contain a 'questions' array"));

        mockMvc.perform(post("/api/v1/documents/rubric-data")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"rows\": []}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.detail").value("Rubric data must contain a 'questions' array"));
    }

    @Test
    @DisplayName("POST /api/v1/documents/backfill returns the batch summary")
    void backfill_returnsSummary() throws Exception {
        BackfillResult written = new BackfillResult("Monarch Butterfly on Milkweed", DocumentType.LESSON_GUIDE,
                BackfillStatus.WRITTEN, 1, "monarch-butterfly-on-milkweed-lesson-third-grade.pdf", null);
        when(backfillService.run(anyList())).thenReturn(BackfillSummary.of(List.of(written), 42L));

        mockMvc.perform(post("/api/v1/documents/backfill")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"jobs\": [{\"type\": \"lesson\", \"document\": " + LESSON_REQUEST + "}]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(1))
                .andExpect(jsonPath("$.written").value(1))
                .andExpect(jsonPath("$.results[0].type").value("lesson"))
                .andExpect(jsonPath("$.results[0].status").value("WRITTEN"));
    }

    @Test
    @DisplayName("POST /api/v1/documents/backfill with no jobs returns 400")
    void backfill_noJobs_badRequest() throws Exception {
        mockMvc.perform(post("/api/v1/documents/backfill")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"jobs\": []}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.fieldErrors[0].field").value("jobs"));

        verify(backfillService, never()).run(anyList());
    }
}
