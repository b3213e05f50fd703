package uk.gegc.lessondocs.features.document.application.template;

import lombok.extern.slf4j.Slf4j;
import uk.gegc.lessondocs.features.content.application.TextSanitizer;
import uk.gegc.lessondocs.features.content.application.extraction.SectionExtractor;
import uk.gegc.lessondocs.features.content.application.extraction.SectionSpec;
import uk.gegc.lessondocs.features.content.domain.model.ContentRecord;
import uk.gegc.lessondocs.features.content.domain.model.Section;
import uk.gegc.lessondocs.features.document.application.DocumentImageLoader;
import uk.gegc.lessondocs.features.document.application.PageFrameFactory;
import uk.gegc.lessondocs.features.document.application.layout.FrameStyle;
import uk.gegc.lessondocs.features.document.application.layout.PageFlow;
import uk.gegc.lessondocs.features.document.application.layout.PageFrame;
import uk.gegc.lessondocs.features.document.application.layout.PdfFont;
import uk.gegc.lessondocs.features.document.application.layout.RgbColor;
import uk.gegc.lessondocs.features.document.application.layout.TextBlock;
import uk.gegc.lessondocs.features.document.config.DocumentProperties;
import uk.gegc.lessondocs.features.document.domain.model.RenderPayload;

import java.awt.image.BufferedImage;
import java.util.List;

import static uk.gegc.lessondocs.features.document.application.layout.PageGeometry.*;

/**
 * Template made of ordered prose sections flowed across pages.
 * <p>
 * The first declared slot is the lead block: it is painted next to the photo on page 1. Every other
 * slot gets a heading bar, its sanitized body and any callouts; empty slots are skipped without
 * leaving a gap.
 */
@Slf4j
public abstract class FlowedDocumentTemplate extends AbstractDocumentTemplate {

    protected final SectionExtractor sectionExtractor;
    protected final TextSanitizer sanitizer;
    protected final DocumentImageLoader imageLoader;
    protected final PageFrameFactory frameFactory;

    protected FlowedDocumentTemplate(DocumentProperties properties,
                                     SectionExtractor sectionExtractor,
                                     TextSanitizer sanitizer,
                                     DocumentImageLoader imageLoader,
                                     PageFrameFactory frameFactory) {
        super(properties);
        this.sectionExtractor = sectionExtractor;
        this.sanitizer = sanitizer;
        this.imageLoader = imageLoader;
        this.frameFactory = frameFactory;
    }

    abstract List<SectionSlot> slots();

    abstract FrameStyle frameStyle();

    abstract float photoBoxWidth();

    abstract float photoBoxHeight();

    /**
     * Text painted in the lead block when its section is missing, or null to skip the block.
     */
    String leadFallback() {
        return null;
    }

    PageFrame frame(ContentRecord record) {
        return frameFactory.create(record, frameStyle(), type().label());
    }

    @Override
    protected PageFlow layout(RenderPayload payload) {
        ContentRecord record = payload.record();
        List<SectionSlot> slots = slots();
        List<SectionSpec> specs = slots.stream().map(SectionSlot::spec).toList();
        List<Section> sections = sectionExtractor.extractSections(record.rawBody(), specs);

        BufferedImage photo = imageLoader.loadPhoto(record.imageBytes(), record.title()).orElse(null);
        PageFlow flow = PageFlow.begin(frame(record));

        paintLead(flow, slots.get(0), sections.get(0), photo);
        for (int i = 1; i < slots.size(); i++) {
            paintSection(flow, slots.get(i), sections.get(i));
        }
        log.debug("Laid out {} '{}' on {} page(s)", type().slug(), record.title(), flow.currentPage());
        return flow;
    }

    void paintLead(PageFlow flow, SectionSlot slot, Section section, BufferedImage photo) {
        String text = sanitizer.sanitize(section.bodyText());
        if (text.isEmpty()) {
            text = leadFallback();
        }
        if (text == null) {
            logMissing(slot);
            return;
        }
        flow.sectionHeading(slot.label(), slot.palette(), PageFlow.sectionHeadingHeight() + photoBoxHeight());
        if (photo != null) {
            flow.photoWithText(photo, photoBoxWidth(), photoBoxHeight(), text);
        } else {
            flow.bodyText(text);
        }
        paintCallouts(flow, slot, section);
    }

    void paintSection(PageFlow flow, SectionSlot slot, Section section) {
        String body = sanitizer.sanitize(section.bodyText());
        boolean hasCallouts = slot.callouts().stream()
                .anyMatch(callout -> !section.span(callout.span().tagName()).isBlank());
        if (body.isEmpty() && !hasCallouts) {
            logMissing(slot);
            return;
        }
        TextBlock block = TextBlock.layout(body, PdfFont.REGULAR, BODY_FONT_SIZE, CONTENT_WIDTH - 2 * slot.inset(), LINE_GAP);
        float keepWithNext = PageFlow.sectionHeadingHeight() + block.heightOf(0, Math.min(2, block.lines().size()));
        flow.sectionHeading(slot.label(), slot.palette(), keepWithNext);
        if (!block.isEmpty()) {
            flow.paragraph(block, MARGIN + slot.inset(), RgbColor.BODY_TEXT);
        }
        paintCallouts(flow, slot, section);
    }

    void paintCallouts(PageFlow flow, SectionSlot slot, Section section) {
        for (SectionSlot.CalloutSlot callout : slot.callouts()) {
            String text = sanitizer.sanitize(section.span(callout.span().tagName()));
            if (!text.isEmpty()) {
                flow.callout(callout.label(), text, callout.palette());
            }
        }
    }

    private void logMissing(SectionSlot slot) {
        if (!slot.optional()) {
            log.debug("Section '{}' missing or empty in {} content, skipped", slot.key(), type().slug());
        }
    }
}
