package uk.gegc.lessondocs.features.document.application.template;

import uk.gegc.lessondocs.features.content.domain.model.DocumentType;
import uk.gegc.lessondocs.features.document.domain.model.RenderPayload;
import uk.gegc.lessondocs.features.document.domain.model.RenderedDocument;

/**
 * Produces one document type from a content record.
 */
public interface DocumentTemplate {

    boolean supports(DocumentType type);

    RenderedDocument render(RenderPayload payload);
}
