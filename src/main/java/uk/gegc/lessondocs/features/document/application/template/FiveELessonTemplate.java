package uk.gegc.lessondocs.features.document.application.template;

import org.springframework.stereotype.Component;
import uk.gegc.lessondocs.features.content.application.TextSanitizer;
import uk.gegc.lessondocs.features.content.application.extraction.HeadingMatcher;
import uk.gegc.lessondocs.features.content.application.extraction.SectionExtractor;
import uk.gegc.lessondocs.features.content.domain.model.DocumentType;
import uk.gegc.lessondocs.features.document.application.DocumentImageLoader;
import uk.gegc.lessondocs.features.document.application.PageFrameFactory;
import uk.gegc.lessondocs.features.document.application.layout.FrameStyle;
import uk.gegc.lessondocs.features.document.application.layout.RgbColor;
import uk.gegc.lessondocs.features.document.application.layout.SectionPalette;
import uk.gegc.lessondocs.features.document.config.DocumentProperties;

import java.util.List;

/**
 * 5E lesson plan: core concepts beside the photo, lesson framing, the five phases, then differentiation
 * and extensions.
 */
@Component
public class FiveELessonTemplate extends FlowedDocumentTemplate {

    static final FrameStyle FRAME = new FrameStyle(RgbColor.of(123, 31, 162), RgbColor.of(220, 200, 235),
            "FOR EDUCATIONAL PURPOSES ONLY");

    private static final List<SectionSlot> SLOTS = List.of(
            SectionSlot.of("coreConcepts", "Core Science Concepts",
                    HeadingMatcher.startingWith("Core Science Concepts", 2, 3),
                    SectionPalette.of(243, 229, 245, 106, 27, 154)),
            SectionSlot.of("lessonTitle", "Lesson Title",
                    HeadingMatcher.exact("Lesson Title", 2, 3),
                    SectionPalette.of(237, 231, 246, 81, 45, 168)),
            SectionSlot.of("lessonOverview", "Lesson Overview",
                    HeadingMatcher.startingWith("Lesson Overview", 2, 3),
                    SectionPalette.of(232, 234, 246, 40, 53, 147)),
            SectionSlot.of("learningObjectives", "Learning Objectives",
                    HeadingMatcher.startingWith("Learning Objectives", 2, 3),
                    SectionPalette.of(227, 242, 253, 13, 71, 161)),
            phase("engage", "1. ENGAGE", "ENGAGE", SectionPalette.of(255, 243, 224, 230, 81, 0)),
            phase("explore", "2. EXPLORE", "EXPLORE", SectionPalette.of(232, 245, 233, 46, 125, 50)),
            phase("explain", "3. EXPLAIN", "EXPLAIN", SectionPalette.of(227, 242, 253, 21, 101, 192)),
            phase("elaborate", "4. ELABORATE", "ELABORATE", SectionPalette.of(224, 247, 250, 0, 105, 92)),
            phase("evaluate", "5. EVALUATE", "EVALUATE", SectionPalette.of(243, 229, 245, 142, 36, 170)),
            SectionSlot.of("differentiation", "Differentiation",
                            HeadingMatcher.startingWith("Differentiation", 2, 3),
                            SectionPalette.of(255, 248, 225, 245, 127, 23))
                    .asOptional(),
            SectionSlot.of("extensions", "Extension Activities",
                            HeadingMatcher.pattern("Extension(?:s|\\s+Activities)?", true, 2, 3),
                            SectionPalette.of(241, 248, 233, 85, 139, 47))
                    .asOptional()
    );

    public FiveELessonTemplate(DocumentProperties properties,
                               SectionExtractor sectionExtractor,
                               TextSanitizer sanitizer,
                               DocumentImageLoader imageLoader,
                               PageFrameFactory frameFactory) {
        super(properties, sectionExtractor, sanitizer, imageLoader, frameFactory);
    }

    private static SectionSlot phase(String key, String label, String phaseName, SectionPalette palette) {
        return SectionSlot.of(key, label, HeadingMatcher.startingWith(phaseName, 3, 4), palette);
    }

    @Override
    protected DocumentType type() {
        return DocumentType.FIVE_E_PLAN;
    }

    @Override
    List<SectionSlot> slots() {
        return SLOTS;
    }

    @Override
    FrameStyle frameStyle() {
        return FRAME;
    }

    @Override
    float photoBoxWidth() {
        return 140f;
    }

    @Override
    float photoBoxHeight() {
        return 105f;
    }
}
