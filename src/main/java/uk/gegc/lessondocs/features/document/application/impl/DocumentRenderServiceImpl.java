package uk.gegc.lessondocs.features.document.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.lessondocs.features.content.domain.model.DocumentType;
import uk.gegc.lessondocs.features.document.application.DocumentRenderService;
import uk.gegc.lessondocs.features.document.application.template.DocumentTemplate;
import uk.gegc.lessondocs.features.document.domain.model.RenderPayload;
import uk.gegc.lessondocs.features.document.domain.model.RenderedDocument;
import uk.gegc.lessondocs.shared.exception.UnsupportedDocumentTypeException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentRenderServiceImpl implements DocumentRenderService {

    private final List<DocumentTemplate> templates;
    private final Clock clock;

    @Override
    public RenderedDocument render(DocumentType type, RenderPayload payload) {
        if (type == null) {
            throw new UnsupportedDocumentTypeException("Document type is required");
        }
        if (payload == null) {
            throw new IllegalArgumentException("Render payload cannot be null");
        }
        Instant startTime = clock.instant();
        log.debug("Rendering {} for '{}' ({}, {})", type.slug(), payload.record().title(),
                payload.record().category().slug(), payload.record().gradeLevel().slug());

        RenderedDocument document = resolveTemplate(type).render(payload);

        long durationMs = Duration.between(startTime, clock.instant()).toMillis();
        log.info("Document render completed: type={}, title='{}', filename={}, pages={}, bytes={}, durationMs={}",
                type.slug(), payload.record().title(), document.filename(), document.pageCount(),
                document.contentLength(), durationMs);
        return document;
    }

    private DocumentTemplate resolveTemplate(DocumentType type) {
        return templates.stream()
                .filter(template -> template.supports(type))
                .findFirst()
                .orElseThrow(() -> new UnsupportedDocumentTypeException("No template registered for document type: " + type.slug()));
    }
}
