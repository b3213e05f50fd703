package uk.gegc.lessondocs.features.content.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Criteria text for the four proficiency levels of one rubric question.
 * Empty strings are allowed, missing levels are not.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RubricCriteria(
        String exceeds,
        String meets,
        String approaching,
        String beginning
) {
    public RubricCriteria {
        if (exceeds == null || meets == null || approaching == null || beginning == null) {
            throw new IllegalArgumentException("Rubric criteria require exceeds, meets, approaching and beginning");
        }
    }
}
