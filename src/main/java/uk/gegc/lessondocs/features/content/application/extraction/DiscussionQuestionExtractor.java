package uk.gegc.lessondocs.features.content.application.extraction;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.lessondocs.features.content.application.TextSanitizer;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits a "Discussion Questions" section into student-facing question prompts.
 * <p>
 * A question starts at an unindented numbered or bulleted line. Indented lines underneath it are
 * teacher guidance and are dropped.
 */
@Component
@RequiredArgsConstructor
public class DiscussionQuestionExtractor {

    private static final Pattern QUESTION_START = Pattern.compile("^ ?(?:\\d+[.)]|[*\\-•])\\s+(.*)$");
    private static final Pattern TAXONOMY_NOTE = Pattern.compile(
            "\\s*[(\\[]\\s*\\*{0,2}(?:Bloom['’]?s|DOK)\\b[^)\\]]*[)\\]]", Pattern.CASE_INSENSITIVE);
    private static final Pattern SURROUNDING_QUOTES = Pattern.compile("^[\"“”]+|[\"“”]+$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final TextSanitizer sanitizer;

    public List<String> extract(String sectionBody) {
        List<String> questions = new ArrayList<>();
        if (sectionBody == null || sectionBody.isBlank()) {
            return questions;
        }
        StringBuilder current = null;
        for (String line : sectionBody.replace("\r\n", "\n").split("\n")) {
            var m = QUESTION_START.matcher(line);
            if (m.matches()) {
                addIfPresent(questions, current);
                current = new StringBuilder(m.group(1));
            } else if (current != null && !line.isBlank() && !Character.isWhitespace(line.charAt(0))) {
                // wrapped continuation of the question itself
                current.append(' ').append(line.strip());
            } else if (line.isBlank() && current != null) {
                addIfPresent(questions, current);
                current = null;
            }
        }
        addIfPresent(questions, current);
        return questions;
    }

    public String clean(String question) {
        if (question == null) {
            return "";
        }
        String text = TAXONOMY_NOTE.matcher(question).replaceAll("");
        text = sanitizer.sanitize(text);
        text = WHITESPACE.matcher(text).replaceAll(" ").strip();
        return SURROUNDING_QUOTES.matcher(text).replaceAll("").strip();
    }

    private void addIfPresent(List<String> questions, StringBuilder current) {
        if (current == null) {
            return;
        }
        String cleaned = clean(current.toString());
        if (!cleaned.isEmpty()) {
            questions.add(cleaned);
        }
    }
}
