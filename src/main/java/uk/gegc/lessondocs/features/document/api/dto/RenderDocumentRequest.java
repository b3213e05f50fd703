package uk.gegc.lessondocs.features.document.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import uk.gegc.lessondocs.features.content.domain.model.Category;
import uk.gegc.lessondocs.features.content.domain.model.ContentRecord;
import uk.gegc.lessondocs.features.content.domain.model.GradeLevel;
import uk.gegc.lessondocs.features.content.domain.model.RubricQuestion;
import uk.gegc.lessondocs.features.document.domain.model.RenderPayload;

import java.util.List;

@Schema(name = "RenderDocumentRequest", description = "Content record to render as a PDF document")
public record RenderDocumentRequest(
        @Schema(description = "Photo or lesson title shown in the header", example = "Monarch Butterfly on Milkweed")
        @NotBlank(message = "Title must not be blank")
        @Size(max = 200, message = "Title must be at most 200 characters long")
        String title,

        @Schema(description = "Subject area slug", example = "life-science")
        @NotNull(message = "Category is required")
        Category category,

        @Schema(description = "Grade level slug", example = "third-grade")
        @NotNull(message = "Grade level is required")
        GradeLevel gradeLevel,

        @Schema(description = "Generated markdown body")
        String rawBody,

        @Schema(description = "Base64 encoded photo (PNG or JPEG)")
        byte[] image,

        @Schema(description = "Base64 encoded logo artwork")
        byte[] logo,

        @Schema(description = "Structured rubric rows, required for the rubric document")
        List<@Valid @NotNull RubricQuestion> rubricQuestions,

        @Schema(description = "Filename without extension; derived from title, type and grade when omitted")
        @Size(max = 120, message = "Filename must be at most 120 characters long")
        String filename
) {
    public RenderPayload toPayload() {
        ContentRecord record = new ContentRecord(title, category, gradeLevel, rawBody, image, logo);
        return new RenderPayload(record, rubricQuestions, filename);
    }
}
