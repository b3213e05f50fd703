package uk.gegc.lessondocs.features.content.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Printable document variants the engine produces from one content record.
 */
public enum DocumentType {
    LESSON_GUIDE("lesson", "Lesson Guide"),
    FIVE_E_PLAN("5e", "5E Lesson Plan"),
    RUBRIC("rubric", "Scoring Rubric"),
    EXIT_TICKET("exit-ticket", "Exit Ticket"),
    ENGINEERING_CHALLENGE("edp", "Engineering Design Process");

    private final String slug;
    private final String label;

    DocumentType(String slug, String label) {
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
    public static DocumentType fromSlug(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Document type cannot be null");
        }
        String normalized = value.trim();
        return Arrays.stream(values())
                .filter(t -> t.slug.equalsIgnoreCase(normalized) || t.name().equalsIgnoreCase(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown document type: " + value));
    }
}
