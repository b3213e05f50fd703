package uk.gegc.lessondocs.features.content.application.extraction;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.parallel.Execution;
import org.junit.jupiter.api.parallel.ExecutionMode;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Execution(ExecutionMode.CONCURRENT)
@DisplayName("HeadingMatcher Tests")
class HeadingMatcherTest {

    @Test
    @DisplayName("exact: tolerates icons, punctuation and extra spacing")
    void exact_noiseAroundPhrase_matches() {
        HeadingMatcher matcher = HeadingMatcher.exact("Photo Description", 2, 3);

        assertThat(matcher.matches(2, "📸 Photo Description")).isTrue();
        assertThat(matcher.matches(2, "**Photo  Description**")).isTrue();
        assertThat(matcher.matches(3, "1) Photo Description:")).isTrue();
        assertThat(matcher.matches(2, "PhotoDescription")).isTrue();
    }

    @Test
    @DisplayName("exact: rejects longer headings and word continuations")
    void exact_longerHeading_rejected() {
        HeadingMatcher matcher = HeadingMatcher.exact("Photo Description", 2, 3);

        assertThat(matcher.matches(2, "Photo Descriptions")).isFalse();
        assertThat(matcher.matches(2, "Photo Description and Notes")).isFalse();
        assertThat(matcher.matches(2, "The Photo Description")).isFalse();
    }

    @Test
    @DisplayName("startingWith: accepts trailing text")
    void startingWith_trailingText_matches() {
        HeadingMatcher matcher = HeadingMatcher.startingWith("Zoom In / Zoom Out", 2, 3);

        assertThat(matcher.matches(2, "🔍 Zoom In / Zoom Out (Scale and Systems)")).isTrue();
        assertThat(matcher.matches(2, "Zoom In/Zoom Out")).isTrue();
        assertThat(matcher.matches(2, "Zoom Inward")).isFalse();
    }

    @Test
    @DisplayName("pattern: optional words")
    void pattern_optionalWords_match() {
        HeadingMatcher matcher = HeadingMatcher.pattern("(?:Potential\\s+)?Student\\s+Misconceptions", false, 2, 3);

        assertThat(matcher.matches(2, "Potential Student Misconceptions")).isTrue();
        assertThat(matcher.matches(2, "Student Misconceptions")).isTrue();
        assertThat(matcher.matches(2, "Misconceptions")).isFalse();
    }

    @Test
    @DisplayName("matches: depth outside range and null text never match")
    void matches_depthAndNull() {
        HeadingMatcher matcher = HeadingMatcher.exact("Vocabulary", 2, 3);

        assertThat(matcher.matches(1, "Vocabulary")).isFalse();
        assertThat(matcher.matches(4, "Vocabulary")).isFalse();
        assertThat(matcher.matches(2, null)).isFalse();
    }

    @Test
    @DisplayName("factory: rejects an invalid depth range")
    void factory_invalidDepthRange_throws() {
        assertThatThrownBy(() -> HeadingMatcher.exact("Vocabulary", 3, 2))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> HeadingMatcher.exact("Vocabulary", 0, 2))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
