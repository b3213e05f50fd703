package uk.gegc.lessondocs.features.content.application.extraction;

import java.util.Arrays;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Matches a markdown heading on its stable text portion.
 * <p>
 * Generated headings usually carry a leading icon, and that icon is frequently mangled by encoding
 * round-trips (an emoji arriving as {@code ðŸ“¸}). Anything before the first ASCII letter or digit is
 * ignored, as is an ordinal such as {@code 1.} or {@code 2)}. Comparison is case-insensitive.
 */
public final class HeadingMatcher {

    private static final String LEADING_NOISE = "[^A-Za-z0-9]*(?:\\d+\\s*[.)]\\s*)?";
    private static final String WORD_END = "(?![A-Za-z0-9])";
    private static final String EXACT_TAIL = "[^A-Za-z0-9]*";
    private static final String FREE_TAIL = ".*";

    private final String description;
    private final Pattern pattern;
    private final int minDepth;
    private final int maxDepth;

    private HeadingMatcher(String description, String body, boolean allowTrailingText, int minDepth, int maxDepth) {
        if (minDepth < 1 || maxDepth > 6 || minDepth > maxDepth) {
            throw new IllegalArgumentException("Invalid heading depth range: " + minDepth + ".." + maxDepth);
        }
        this.description = description;
        this.pattern = Pattern.compile(
                LEADING_NOISE + "(?:" + body + ")" + WORD_END + (allowTrailingText ? FREE_TAIL : EXACT_TAIL),
                Pattern.CASE_INSENSITIVE);
        this.minDepth = minDepth;
        this.maxDepth = maxDepth;
    }

    /**
     * Heading whose text is exactly {@code phrase}, apart from icons and punctuation.
     */
    public static HeadingMatcher exact(String phrase, int minDepth, int maxDepth) {
        return new HeadingMatcher(phrase, phraseToRegex(phrase), false, minDepth, maxDepth);
    }

    /**
     * Heading that starts with {@code phrase} and may continue with anything.
     */
    public static HeadingMatcher startingWith(String phrase, int minDepth, int maxDepth) {
        return new HeadingMatcher(phrase + "...", phraseToRegex(phrase), true, minDepth, maxDepth);
    }

    /**
     * Heading matched by a raw regex fragment, for headings with optional words.
     */
    public static HeadingMatcher pattern(String regex, boolean allowTrailingText, int minDepth, int maxDepth) {
        return new HeadingMatcher(regex, regex, allowTrailingText, minDepth, maxDepth);
    }

    public boolean matches(int depth, String headingText) {
        if (depth < minDepth || depth > maxDepth || headingText == null) {
            return false;
        }
        return pattern.matcher(headingText.strip()).matches();
    }

    static String phraseToRegex(String phrase) {
        return Arrays.stream(phrase.trim().split("\\s+"))
                .map(Pattern::quote)
                .collect(Collectors.joining("\\s*"));
    }

    @Override
    public String toString() {
        return "HeadingMatcher[" + description + ", depth " + minDepth + ".." + maxDepth + "]";
    }
}
