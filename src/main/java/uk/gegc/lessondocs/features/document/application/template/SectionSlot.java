package uk.gegc.lessondocs.features.document.application.template;

import uk.gegc.lessondocs.features.content.application.extraction.HeadingMatcher;
import uk.gegc.lessondocs.features.content.application.extraction.NestedSpan;
import uk.gegc.lessondocs.features.content.application.extraction.SectionSpec;
import uk.gegc.lessondocs.features.document.application.layout.CalloutPalette;
import uk.gegc.lessondocs.features.document.application.layout.SectionPalette;

import java.util.ArrayList;
import java.util.List;

/**
 * Section declaration of a flowed template: what to extract and how to paint it.
 *
 * @param spec     extraction rule
 * @param palette  heading bar colors
 * @param inset    horizontal inset of the body text from the margin
 * @param optional absent sections are expected and not worth logging
 * @param callouts nested spans painted as callout boxes under the body
 */
record SectionSlot(
        SectionSpec spec,
        SectionPalette palette,
        float inset,
        boolean optional,
        List<CalloutSlot> callouts
) {
    static final float DEFAULT_INSET = 4f;

    SectionSlot {
        callouts = callouts == null ? List.of() : List.copyOf(callouts);
    }

    static SectionSlot of(String key, String label, HeadingMatcher matcher, SectionPalette palette) {
        return new SectionSlot(SectionSpec.of(key, label, matcher), palette, DEFAULT_INSET, false, List.of());
    }

    SectionSlot asOptional() {
        return new SectionSlot(spec, palette, inset, true, callouts);
    }

    SectionSlot withInset(float newInset) {
        return new SectionSlot(spec, palette, newInset, optional, callouts);
    }

    SectionSlot withNestedHeadings(String regex) {
        return new SectionSlot(spec.withNestedHeadings(regex), palette, inset, optional, callouts);
    }

    SectionSlot withCallout(NestedSpan span, String label, CalloutPalette calloutPalette) {
        List<CalloutSlot> more = new ArrayList<>(callouts);
        more.add(new CalloutSlot(span, label, calloutPalette));
        List<NestedSpan> spans = more.stream().map(CalloutSlot::span).toList();
        SectionSpec withSpans = spec.withSpans(spans.toArray(NestedSpan[]::new));
        return new SectionSlot(withSpans, palette, inset, optional, more);
    }

    String key() {
        return spec.key();
    }

    String label() {
        return spec.label();
    }

    record CalloutSlot(NestedSpan span, String label, CalloutPalette palette) {
    }
}
