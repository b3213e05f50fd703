package uk.gegc.lessondocs.features.content.domain.model;

/**
 * Finished content produced by the generation pipeline. Consumed once per render call.
 *
 * @param title      photo/lesson title shown in every header
 * @param category   subject area
 * @param gradeLevel target grade
 * @param rawBody    unstructured markdown body; headings and tags follow the generator's conventions
 * @param imageBytes encoded photo (PNG/JPEG), may be null
 * @param logoBytes  encoded logo artwork, may be null
 */
public record ContentRecord(
        String title,
        Category category,
        GradeLevel gradeLevel,
        String rawBody,
        byte[] imageBytes,
        byte[] logoBytes
) {
    public ContentRecord {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("Title cannot be null or blank");
        }
        if (category == null) {
            throw new IllegalArgumentException("Category cannot be null");
        }
        if (gradeLevel == null) {
            throw new IllegalArgumentException("Grade level cannot be null");
        }
        if (rawBody == null) {
            rawBody = "";
        }
    }

    public static ContentRecord of(String title, Category category, GradeLevel gradeLevel, String rawBody) {
        return new ContentRecord(title, category, gradeLevel, rawBody, null, null);
    }

    public ContentRecord withImages(byte[] image, byte[] logo) {
        return new ContentRecord(title, category, gradeLevel, rawBody, image, logo);
    }
}
