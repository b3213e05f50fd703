package uk.gegc.lessondocs.features.document.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import uk.gegc.lessondocs.features.backfill.domain.model.BackfillJob;
import uk.gegc.lessondocs.features.content.domain.model.DocumentType;

import java.util.List;

@Schema(name = "BackfillRequest", description = "Documents to render and write in one batch")
public record BackfillRequest(
        @NotEmpty(message = "At least one job is required")
        @Size(max = 500, message = "At most 500 jobs per request")
        List<@Valid @NotNull Job> jobs
) {
    public List<BackfillJob> toJobs() {
        return jobs.stream()
                .map(job -> new BackfillJob(job.type(), job.document().toPayload()))
                .toList();
    }

    @Schema(name = "BackfillJobRequest")
    public record Job(
            @Schema(description = "Document type slug", example = "lesson")
            @NotNull(message = "Document type is required")
            DocumentType type,

            @NotNull(message = "Document content is required")
            @Valid
            RenderDocumentRequest document
    ) {
    }
}
