package uk.gegc.lessondocs.features.content.application.extraction;

import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls the grade-band specific variant out of an engineering task block.
 * <p>
 * The generator writes the two variants in one of three phrasings, tried in this order:
 * <ol>
 *     <li>inline bold label with quoted text on the same line: {@code **K-2**: "Build ..."}</li>
 *     <li>sub-heading followed by a paragraph: {@code ### K-2 Challenge}</li>
 *     <li>bold label followed by a paragraph on the next line: {@code **K-2 Version:**}</li>
 * </ol>
 * The first phrasing that yields non-empty text wins.
 */
@Component
public class GradeBandTaskExtractor {

    private static final Pattern SURROUNDING_QUOTES = Pattern.compile("^[\"“”]+|[\"“”]+$");

    private final Map<GradeBand, List<Pattern>> phrasings = new EnumMap<>(GradeBand.class);

    public GradeBandTaskExtractor() {
        for (GradeBand band : GradeBand.values()) {
            String label = band.labelRegex();
            phrasings.put(band, List.of(
                    Pattern.compile("\\*\\*" + label + "\\*\\*:[ \\t]*(.+?)[ \\t]*(?=\\n|\\z)"),
                    Pattern.compile("#{2,3}[^\\n]*?" + label + "[^\\n]*\\n([\\s\\S]*?)(?=\\n#{2,3}\\s|\\n---|\\n-\\s*\\*\\*|\\z)"),
                    Pattern.compile("\\*\\*" + label + "[^*]*\\*\\*[:\\s]*\\n([\\s\\S]*?)(?=\\n\\*\\*[0-9K]|\\n#{2,3}\\s|\\n---|\\z)")
            ));
        }
    }

    /**
     * @return the variant text for {@code band}, or {@code null} when none of the phrasings match
     */
    public String extract(String text, GradeBand band) {
        if (text == null || text.isBlank() || band == null) {
            return null;
        }
        String normalized = text.replace("\r\n", "\n");
        for (Pattern phrasing : phrasings.get(band)) {
            Matcher m = phrasing.matcher(normalized);
            if (m.find()) {
                String candidate = SURROUNDING_QUOTES.matcher(m.group(1).strip()).replaceAll("").strip();
                if (!candidate.isEmpty()) {
                    return candidate;
                }
            }
        }
        return null;
    }
}
