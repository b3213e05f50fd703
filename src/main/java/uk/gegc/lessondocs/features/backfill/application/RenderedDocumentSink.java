package uk.gegc.lessondocs.features.backfill.application;

import uk.gegc.lessondocs.features.content.domain.model.ContentRecord;
import uk.gegc.lessondocs.features.document.domain.model.RenderedDocument;

import java.io.IOException;

/**
 * Destination for documents produced by a backfill run.
 */
public interface RenderedDocumentSink {

    void write(ContentRecord record, RenderedDocument document) throws IOException;
}
