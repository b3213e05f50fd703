package uk.gegc.lessondocs.features.content.application.extraction;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.parallel.Execution;
import org.junit.jupiter.api.parallel.ExecutionMode;
import uk.gegc.lessondocs.features.content.application.TextSanitizer;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Execution(ExecutionMode.CONCURRENT)
@DisplayName("DiscussionQuestionExtractor Tests")
class DiscussionQuestionExtractorTest {

    private final DiscussionQuestionExtractor extractor = new DiscussionQuestionExtractor(new TextSanitizer());

    @Test
    @DisplayName("extract: numbered and bulleted questions, guidance dropped, continuations joined")
    void extract_mixedList() {
        // Given
        String section = """
                1. What do you notice about the leaf? (Bloom's: Remember, DOK: 1)
                   - Teacher note: look for the veins.
                2. **Why** might the caterpillar eat milkweed?
                - How could we test
                this idea?

                3. "What would happen if it rained all week?"
                """;

        // When
        List<String> questions = extractor.extract(section);

        // Then
        assertThat(questions).containsExactly(
                "What do you notice about the leaf?",
                "Why might the caterpillar eat milkweed?",
                "How could we test this idea?",
                "What would happen if it rained all week?"
        );
    }

    @Test
    @DisplayName("extract: prose without list markers yields no questions")
    void extract_noListMarkers_empty() {
        assertThat(extractor.extract("Ask students what they see in the photo.")).isEmpty();
    }

    @Test
    @DisplayName("extract: null and blank sections yield no questions")
    void extract_nullOrBlank_empty() {
        assertThat(extractor.extract(null)).isEmpty();
        assertThat(extractor.extract("  \n ")).isEmpty();
    }

    @Test
    @DisplayName("clean: removes taxonomy notes, markup and surrounding quotes")
    void clean_removesNoise() {
        assertThat(extractor.clean("“*How* do seeds travel?” [DOK 2]")).isEqualTo("How do seeds travel?");
        assertThat(extractor.clean("Which is bigger?  (**Bloom’s**: Analyze)")).isEqualTo("Which is bigger?");
        assertThat(extractor.clean(null)).isEmpty();
    }
}
