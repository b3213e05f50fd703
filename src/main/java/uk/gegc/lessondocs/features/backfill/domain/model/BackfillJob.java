package uk.gegc.lessondocs.features.backfill.domain.model;

import uk.gegc.lessondocs.features.content.domain.model.DocumentType;
import uk.gegc.lessondocs.features.document.domain.model.RenderPayload;

/**
 * One unit of backfill work: a single document type rendered for a single content record.
 */
public record BackfillJob(DocumentType type, RenderPayload payload) {

    public BackfillJob {
        if (type == null) {
            throw new IllegalArgumentException("Document type cannot be null");
        }
        if (payload == null) {
            throw new IllegalArgumentException("Render payload cannot be null");
        }
    }

    public String describe() {
        return type.slug() + " '" + payload.record().title() + "'";
    }
}
