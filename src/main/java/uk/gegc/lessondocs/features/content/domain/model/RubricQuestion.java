package uk.gegc.lessondocs.features.content.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One scored question of a rubric.
 *
 * @param questionText discussion question being scored
 * @param bloomsLevel  Bloom's taxonomy level, optional
 * @param dokLevel     depth-of-knowledge level, optional
 * @param rubric       criteria for each proficiency level
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RubricQuestion(
        String questionText,
        String bloomsLevel,
        String dokLevel,
        RubricCriteria rubric
) {
    public RubricQuestion {
        if (questionText == null) {
            throw new IllegalArgumentException("Rubric question text cannot be null");
        }
        if (rubric == null) {
            throw new IllegalArgumentException("Rubric criteria cannot be null for question: " + questionText);
        }
    }

    public boolean hasTaxonomy() {
        return (bloomsLevel != null && !bloomsLevel.isBlank()) || (dokLevel != null && !dokLevel.isBlank());
    }
}
