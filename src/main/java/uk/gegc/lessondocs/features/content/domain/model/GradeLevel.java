package uk.gegc.lessondocs.features.content.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Grade level a content record targets: six grade bands plus the engineering design variant.
 */
public enum GradeLevel {
    KINDERGARTEN("kindergarten", "Kindergarten"),
    FIRST_GRADE("first-grade", "1st Grade"),
    SECOND_GRADE("second-grade", "2nd Grade"),
    THIRD_GRADE("third-grade", "3rd Grade"),
    FOURTH_GRADE("fourth-grade", "4th Grade"),
    FIFTH_GRADE("fifth-grade", "5th Grade"),
    ENGINEERING_DESIGN("edp", "Engineering Design");

    private final String slug;
    private final String label;

    GradeLevel(String slug, String label) {
        this.slug = slug;
        this.label = label;
    }

    @JsonValue
    public String slug() {
        return slug;
    }

    public String label() {
        return label;
    }

    @JsonCreator
    public static GradeLevel fromSlug(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Grade level cannot be null");
        }
        String normalized = value.trim();
        return Arrays.stream(values())
                .filter(g -> g.slug.equalsIgnoreCase(normalized) || g.name().equalsIgnoreCase(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown grade level: " + value));
    }
}
