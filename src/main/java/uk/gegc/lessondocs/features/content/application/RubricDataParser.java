package uk.gegc.lessondocs.features.content.application;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.lessondocs.features.content.domain.model.RubricQuestion;
import uk.gegc.lessondocs.shared.exception.InvalidRubricDataException;

import java.util.List;
import java.util.Objects;

/**
 * Parses stored rubric JSON into {@link RubricQuestion} records.
 * <p>
 * Accepts either {@code {"questions": [...]}} or a bare array. Nothing is recovered from partially
 * valid data: any shape mismatch fails the whole parse.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RubricDataParser {

    private static final TypeReference<List<RubricQuestion>> QUESTION_LIST = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public List<RubricQuestion> parse(String json) {
        if (json == null || json.isBlank()) {
            throw new InvalidRubricDataException("Rubric data is empty");
        }
        try {
            JsonNode root = objectMapper.readTree(json);
            JsonNode questions = root.isArray() ? root : root.get("questions");
            if (questions == null || !questions.isArray()) {
                throw new InvalidRubricDataException("Rubric data must contain a 'questions' array");
            }
            List<RubricQuestion> parsed = objectMapper.convertValue(questions, QUESTION_LIST);
            validate(parsed);
            log.debug("Parsed {} rubric questions", parsed.size());
            return parsed;
        } catch (JsonProcessingException e) {
            throw new InvalidRubricDataException("Rubric data is not valid JSON: " + e.getOriginalMessage(), e);
        } catch (IllegalArgumentException e) {
            // convertValue reports mapping failures, including record validation, this way
            throw new InvalidRubricDataException("Rubric data does not match the rubric question shape: " + e.getMessage(), e);
        }
    }

    public void validate(List<RubricQuestion> questions) {
        if (questions == null) {
            throw new InvalidRubricDataException("Rubric questions are required");
        }
        if (questions.stream().anyMatch(Objects::isNull)) {
            throw new InvalidRubricDataException("Rubric questions cannot contain null entries");
        }
    }
}
