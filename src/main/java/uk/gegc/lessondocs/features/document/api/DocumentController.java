package uk.gegc.lessondocs.features.document.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.InputStreamResource;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.lessondocs.features.backfill.application.BackfillService;
import uk.gegc.lessondocs.features.backfill.domain.model.BackfillSummary;
import uk.gegc.lessondocs.features.content.application.RubricDataParser;
import uk.gegc.lessondocs.features.content.domain.model.DocumentType;
import uk.gegc.lessondocs.features.content.domain.model.RubricQuestion;
import uk.gegc.lessondocs.features.document.api.dto.BackfillRequest;
import uk.gegc.lessondocs.features.document.api.dto.RenderDocumentRequest;
import uk.gegc.lessondocs.features.document.application.DocumentRenderService;
import uk.gegc.lessondocs.features.document.domain.model.RenderedDocument;
import uk.gegc.lessondocs.shared.exception.UnsupportedDocumentTypeException;

import java.util.List;

@Tag(name = "Documents", description = "Render lesson guides, 5E plans, rubrics, exit tickets and engineering challenges as PDF.")
@RestController
@RequestMapping("/api/v1/documents")
@RequiredArgsConstructor
@Validated
@Slf4j
public class DocumentController {

    private final DocumentRenderService documentRenderService;
    private final RubricDataParser rubricDataParser;
    private final BackfillService backfillService;

    @Operation(
            summary = "Render a document",
            description = "Renders one PDF for the given content record. Type is one of lesson, 5e, rubric, exit-ticket or edp. The rubric type requires rubricQuestions."
    )
    @PostMapping("/{type}")
    public ResponseEntity<Resource> render(
            @Parameter(description = "Document type slug", example = "lesson") @PathVariable String type,
            @RequestBody @Valid RenderDocumentRequest request
    ) {
        RenderedDocument document = documentRenderService.render(resolveType(type), request.toPayload());
        InputStreamResource resource = new InputStreamResource(document.contentSupplier().get());

        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_PDF)
                .contentLength(document.contentLength())
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(document.filename()).build().toString())
                .header("X-Page-Count", String.valueOf(document.pageCount()))
                .body(resource);
    }

    @Operation(
            summary = "Parse rubric data",
            description = "Parses rubric JSON, either {\"questions\": [...]} or a bare array, and returns the normalized questions. Responds 422 when the data does not have the rubric shape."
    )
    @PostMapping(value = "/rubric-data", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<RubricQuestion>> parseRubricData(@RequestBody String rubricJson) {
        return ResponseEntity.ok(rubricDataParser.parse(rubricJson));
    }

    @Operation(
            summary = "Backfill documents",
            description = "Renders and writes a batch of documents. Each job is retried on render failure; the summary reports render and write failures separately."
    )
    @PostMapping("/backfill")
    public ResponseEntity<BackfillSummary> backfill(@RequestBody @Valid BackfillRequest request) {
        return ResponseEntity.ok(backfillService.run(request.toJobs()));
    }

    private DocumentType resolveType(String slug) {
        try {
            return DocumentType.fromSlug(slug);
        } catch (IllegalArgumentException e) {
            throw new UnsupportedDocumentTypeException("Unsupported document type: " + slug);
        }
    }
}
