package uk.gegc.lessondocs.features.document.application.template;

import uk.gegc.lessondocs.features.content.domain.model.DocumentType;
import uk.gegc.lessondocs.features.document.application.layout.DocumentCanvas;
import uk.gegc.lessondocs.features.document.application.layout.PageFlow;
import uk.gegc.lessondocs.features.document.config.DocumentProperties;
import uk.gegc.lessondocs.features.document.domain.model.RenderPayload;
import uk.gegc.lessondocs.features.document.domain.model.RenderedDocument;
import uk.gegc.lessondocs.shared.exception.DocumentRenderException;
import uk.gegc.lessondocs.shared.exception.InvalidRubricDataException;

import java.io.ByteArrayInputStream;
import java.io.IOException;

/**
 * Runs layout, footer finalization and serialization for a template. Documents are all or nothing:
 * any failure after layout starts surfaces as {@link DocumentRenderException} and no bytes are returned.
 */
public abstract class AbstractDocumentTemplate implements DocumentTemplate {

    static final String PDF_CONTENT_TYPE = "application/pdf";

    protected final DocumentProperties properties;

    protected AbstractDocumentTemplate(DocumentProperties properties) {
        this.properties = properties;
    }

    protected abstract DocumentType type();

    /**
     * Lays out the whole document. The returned flow has not been finalized.
     */
    protected abstract PageFlow layout(RenderPayload payload);

    @Override
    public boolean supports(DocumentType type) {
        return type == type();
    }

    @Override
    public RenderedDocument render(RenderPayload payload) {
        if (payload == null) {
            throw new IllegalArgumentException("Render payload cannot be null");
        }
        try {
            DocumentCanvas canvas = layout(payload).finalizeFooters();
            byte[] bytes = canvas.serialize(properties.getImages().getJpegQuality());
            return new RenderedDocument(
                    payload.filenameFor(type()),
                    PDF_CONTENT_TYPE,
                    () -> new ByteArrayInputStream(bytes),
                    bytes.length,
                    canvas.pageCount()
            );
        } catch (InvalidRubricDataException | DocumentRenderException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new DocumentRenderException(type().slug(), payload.record().title(), e);
        }
    }
}
