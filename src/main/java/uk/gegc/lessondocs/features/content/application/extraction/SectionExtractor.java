package uk.gegc.lessondocs.features.content.application.extraction;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.lessondocs.features.content.domain.model.Section;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recovers named sections from a heading-delimited markdown body.
 * <p>
 * For each declared {@link SectionSpec}, in order, the first heading accepted by its matcher opens the
 * section and the next heading of equal or shallower depth closes it. Every declared key is present in
 * the result; a missing heading yields an empty string. Tagged spans declared by the spec are removed
 * from the body and returned separately.
 */
@Slf4j
@Component
public class SectionExtractor {

    private static final Pattern HEADING_LINE = Pattern.compile("^ {0,3}(#{1,6})(?:[ \\t]+(.*?))?[ \\t]*#*[ \\t]*$");

    public Map<String, String> extract(String rawBody, List<SectionSpec> specs) {
        Map<String, String> bodies = new LinkedHashMap<>();
        for (Section section : extractSections(rawBody, specs)) {
            bodies.put(section.key(), section.bodyText());
        }
        return bodies;
    }

    public List<Section> extractSections(String rawBody, List<SectionSpec> specs) {
        if (specs == null || specs.isEmpty()) {
            return List.of();
        }
        String body = normalizeLineEndings(rawBody);
        List<Heading> headings = scanHeadings(body);

        List<Section> sections = new ArrayList<>(specs.size());
        for (SectionSpec spec : specs) {
            String text = captureBody(body, headings, spec);
            Map<String, String> spans = new LinkedHashMap<>();
            for (NestedSpan span : spec.spans()) {
                SpanCut cut = cutSpan(text, span);
                spans.put(span.tagName(), cut.spanText());
                text = cut.remainder();
            }
            sections.add(new Section(spec.key(), spec.label(), text.strip(), spans));
        }
        if (log.isDebugEnabled()) {
            long found = sections.stream().filter(s -> !s.isEmpty()).count();
            log.debug("Extracted {}/{} sections from {} headings", found, specs.size(), headings.size());
        }
        return sections;
    }

    private String captureBody(String body, List<Heading> headings, SectionSpec spec) {
        for (int i = 0; i < headings.size(); i++) {
            Heading opening = headings.get(i);
            if (!spec.matcher().matches(opening.depth(), opening.text())) {
                continue;
            }
            int end = body.length();
            for (int j = i + 1; j < headings.size(); j++) {
                Heading next = headings.get(j);
                if (next.depth() <= opening.depth() && !spec.ownsHeading(next.text())) {
                    end = next.lineStart();
                    break;
                }
            }
            return opening.bodyStart() >= end ? "" : body.substring(opening.bodyStart(), end);
        }
        return "";
    }

    private List<Heading> scanHeadings(String body) {
        List<Heading> headings = new ArrayList<>();
        int lineStart = 0;
        while (lineStart <= body.length()) {
            int newline = body.indexOf('\n', lineStart);
            int lineEnd = newline < 0 ? body.length() : newline;
            Matcher m = HEADING_LINE.matcher(body.substring(lineStart, lineEnd));
            if (m.matches()) {
                int bodyStart = newline < 0 ? body.length() : newline + 1;
                String text = m.group(2) == null ? "" : m.group(2);
                headings.add(new Heading(m.group(1).length(), text, lineStart, bodyStart));
            }
            if (newline < 0) {
                break;
            }
            lineStart = newline + 1;
        }
        return headings;
    }

    private SpanCut cutSpan(String text, NestedSpan span) {
        String tag = Pattern.quote(span.tagName());
        Pattern pattern = Pattern.compile("<" + tag + "(?:\\s[^>]*)?>([\\s\\S]*?)</" + tag + "\\s*>",
                Pattern.CASE_INSENSITIVE);
        Matcher m = pattern.matcher(text);
        if (!m.find()) {
            return new SpanCut("", text);
        }
        String remainder = text.substring(0, m.start()) + text.substring(m.end());
        return new SpanCut(m.group(1).strip(), remainder);
    }

    private static String normalizeLineEndings(String rawBody) {
        if (rawBody == null) {
            return "";
        }
        return rawBody.replace("\r\n", "\n").replace('\r', '\n');
    }

    private record Heading(int depth, String text, int lineStart, int bodyStart) {
    }

    private record SpanCut(String spanText, String remainder) {
    }
}
