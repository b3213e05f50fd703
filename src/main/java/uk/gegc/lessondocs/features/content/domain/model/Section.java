package uk.gegc.lessondocs.features.content.domain.model;

import java.util.Map;

/**
 * A named block of body text recovered from a heading-delimited document.
 *
 * @param key         template-declared key
 * @param label       heading label painted for the section
 * @param bodyText    body with nested spans removed, empty when the heading was missing
 * @param nestedSpans span name to captured text, one entry per declared span
 */
public record Section(
        String key,
        String label,
        String bodyText,
        Map<String, String> nestedSpans
) {
    public Section {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Section key cannot be null or blank");
        }
        bodyText = bodyText == null ? "" : bodyText;
        nestedSpans = nestedSpans == null ? Map.of() : Map.copyOf(nestedSpans);
    }

    public boolean isEmpty() {
        return bodyText.isBlank();
    }

    public String span(String name) {
        return nestedSpans.getOrDefault(name, "");
    }
}
