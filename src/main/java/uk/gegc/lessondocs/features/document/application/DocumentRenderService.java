package uk.gegc.lessondocs.features.document.application;

import uk.gegc.lessondocs.features.content.domain.model.DocumentType;
import uk.gegc.lessondocs.features.document.domain.model.RenderPayload;
import uk.gegc.lessondocs.features.document.domain.model.RenderedDocument;

public interface DocumentRenderService {

    /**
     * Renders one document of the given type. Either the whole PDF is returned or an exception is thrown.
     */
    RenderedDocument render(DocumentType type, RenderPayload payload);
}
