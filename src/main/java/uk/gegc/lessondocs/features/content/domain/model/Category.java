package uk.gegc.lessondocs.features.content.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Subject area a content record belongs to. Serialized by slug.
 */
public enum Category {
    LIFE_SCIENCE("life-science", "Life Science"),
    EARTH_SPACE_SCIENCE("earth-space-science", "Earth & Space Science"),
    PHYSICAL_SCIENCE("physical-science", "Physical Science");

    private final String slug;
    private final String label;

    Category(String slug, String label) {
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
    public static Category fromSlug(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Category cannot be null");
        }
        String normalized = value.trim();
        return Arrays.stream(values())
                .filter(c -> c.slug.equalsIgnoreCase(normalized) || c.name().equalsIgnoreCase(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown category: " + value));
    }
}
