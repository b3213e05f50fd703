package uk.gegc.lessondocs.features.content.application.extraction;

import java.util.List;
import java.util.regex.Pattern;

/**
 * One entry of a template's ordered section declaration.
 *
 * @param key            key the extracted body is stored under
 * @param label          label painted above the section
 * @param matcher        heading that opens the section
 * @param spans          tagged spans pulled out of the body
 * @param nestedHeadings headings that belong to the section even at equal depth, may be null
 */
public record SectionSpec(
        String key,
        String label,
        HeadingMatcher matcher,
        List<NestedSpan> spans,
        Pattern nestedHeadings
) {
    public SectionSpec {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Section key cannot be null or blank");
        }
        if (matcher == null) {
            throw new IllegalArgumentException("Heading matcher cannot be null for section: " + key);
        }
        label = label == null ? key : label;
        spans = spans == null ? List.of() : List.copyOf(spans);
    }

    public static SectionSpec of(String key, String label, HeadingMatcher matcher) {
        return new SectionSpec(key, label, matcher, List.of(), null);
    }

    public SectionSpec withSpans(NestedSpan... nested) {
        return new SectionSpec(key, label, matcher, List.of(nested), nestedHeadings);
    }

    public SectionSpec withNestedHeadings(String regex) {
        return new SectionSpec(key, label, matcher, spans, Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
    }

    boolean ownsHeading(String headingText) {
        return nestedHeadings != null && nestedHeadings.matcher(headingText.strip()).lookingAt();
    }
}
