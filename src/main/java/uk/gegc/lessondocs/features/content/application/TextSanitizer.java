package uk.gegc.lessondocs.features.content.application;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.regex.Pattern;

/**
 * Reduces generated markdown to plain prose for the PDF renderers.
 * <p>
 * Ordered pipeline:
 * <ol>
 *     <li>resolve standards wiki links such as {@code [[NGSS:PE:K-LS1-1]]} to the bare code</li>
 *     <li>turn {@code *} and {@code -} list markers into bullets so they are not read as emphasis</li>
 *     <li>strip emphasis markers, triple before double before single</li>
 *     <li>resolve {@code [label](url)} links to their label</li>
 *     <li>strip remaining tag markup</li>
 *     <li>collapse runs of blank lines and trim</li>
 * </ol>
 * A pass can expose markup for an earlier step (a link nested in a link, a wiki link hidden behind
 * emphasis), so the pipeline repeats until the text is stable. Apart from the one-time bullet rewrite,
 * every pass that changes the text also shortens it, which bounds the loop.
 */
@Slf4j
@Service
public class TextSanitizer {

    private static final Pattern WIKI_LINK = Pattern.compile("\\[\\[(?:[^\\[\\]:|]+:)*([^\\[\\]:|]+)(?:\\|[^\\[\\]]*)?\\]\\]");
    private static final Pattern LIST_MARKER = Pattern.compile("(?m)^([ \\t]*)[*\\-][ \\t]+");
    private static final Pattern TRIPLE_EMPHASIS = Pattern.compile("\\*\\*\\*(.*?)\\*\\*\\*");
    private static final Pattern DOUBLE_EMPHASIS = Pattern.compile("\\*\\*(.*?)\\*\\*");
    private static final Pattern SINGLE_EMPHASIS = Pattern.compile("\\*(.*?)\\*");
    private static final Pattern LINK = Pattern.compile("\\[([^\\]\\n]+)\\]\\([^)\\n]*\\)");
    private static final Pattern TAG = Pattern.compile("<[^<>\\n]+>");
    private static final Pattern BLANK_RUN = Pattern.compile("\\n{3,}");

    public String sanitize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String current = text.replace("\r\n", "\n");
        String previous;
        int passes = 0;
        do {
            previous = current;
            current = singlePass(current);
            passes++;
        } while (!current.equals(previous));

        if (passes > 2 && log.isDebugEnabled()) {
            log.debug("Sanitizer needed {} passes for {} chars", passes, text.length());
        }
        return current;
    }

    private String singlePass(String text) {
        // 1. standards codes keep their value
        String result = WIKI_LINK.matcher(text).replaceAll("$1");

        // 2. list markers
        result = LIST_MARKER.matcher(result).replaceAll("$1\u2022 ");

        // 3. emphasis, longest marker first
        result = TRIPLE_EMPHASIS.matcher(result).replaceAll("$1");
        result = DOUBLE_EMPHASIS.matcher(result).replaceAll("$1");
        result = SINGLE_EMPHASIS.matcher(result).replaceAll("$1");

        // 4. links
        result = LINK.matcher(result).replaceAll("$1");

        // 5. leftover tags
        result = TAG.matcher(result).replaceAll("");

        // 6. whitespace
        result = BLANK_RUN.matcher(result).replaceAll("\n\n");
        return result.strip();
    }
}
