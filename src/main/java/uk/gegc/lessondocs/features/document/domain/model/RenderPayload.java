package uk.gegc.lessondocs.features.document.domain.model;

import uk.gegc.lessondocs.features.content.domain.model.ContentRecord;
import uk.gegc.lessondocs.features.content.domain.model.DocumentType;
import uk.gegc.lessondocs.features.content.domain.model.RubricQuestion;

import java.text.Normalizer;
import java.util.List;
import java.util.Locale;

/**
 * Input handed to a document template.
 *
 * @param record          content to render
 * @param rubricQuestions pre-structured rubric rows, only read by the rubric template
 * @param filenamePrefix  filename without extension, derived from the record when null
 */
public record RenderPayload(
        ContentRecord record,
        List<RubricQuestion> rubricQuestions,
        String filenamePrefix
) {
    public RenderPayload {
        if (record == null) {
            throw new IllegalArgumentException("Content record cannot be null");
        }
        if (filenamePrefix != null && filenamePrefix.isBlank()) {
            filenamePrefix = null;
        }
    }

    public static RenderPayload of(ContentRecord record) {
        return new RenderPayload(record, null, null);
    }

    public static RenderPayload of(ContentRecord record, List<RubricQuestion> rubricQuestions) {
        return new RenderPayload(record, rubricQuestions, null);
    }

    public String filenameFor(DocumentType type) {
        if (filenamePrefix != null) {
            return filenamePrefix + ".pdf";
        }
        return slugify(record.title()) + "-" + type.slug() + "-" + record.gradeLevel().slug() + ".pdf";
    }

    static String slugify(String text) {
        String ascii = Normalizer.normalize(text, Normalizer.Form.NFD).replaceAll("\\p{M}", "");
        String slug = ascii.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("^-+|-+$", "");
        return slug.isEmpty() ? "document" : slug;
    }
}
