package uk.gegc.lessondocs.features.document.application.template;

import org.springframework.stereotype.Component;
import uk.gegc.lessondocs.features.content.application.TextSanitizer;
import uk.gegc.lessondocs.features.content.application.extraction.HeadingMatcher;
import uk.gegc.lessondocs.features.content.application.extraction.NestedSpan;
import uk.gegc.lessondocs.features.content.application.extraction.SectionExtractor;
import uk.gegc.lessondocs.features.content.domain.model.DocumentType;
import uk.gegc.lessondocs.features.document.application.DocumentImageLoader;
import uk.gegc.lessondocs.features.document.application.PageFrameFactory;
import uk.gegc.lessondocs.features.document.application.layout.CalloutPalette;
import uk.gegc.lessondocs.features.document.application.layout.FrameStyle;
import uk.gegc.lessondocs.features.document.application.layout.RgbColor;
import uk.gegc.lessondocs.features.document.application.layout.SectionPalette;
import uk.gegc.lessondocs.features.document.config.DocumentProperties;

import java.util.List;

/**
 * Teacher lesson guide: photo with its description on page 1, then the lesson sections in order.
 */
@Component
public class LessonGuideTemplate extends FlowedDocumentTemplate {

    static final FrameStyle FRAME = new FrameStyle(RgbColor.of(46, 134, 171), RgbColor.of(200, 225, 240),
            "FOR TEACHER USE ONLY");

    static final CalloutPalette PEDAGOGICAL_TIP = CalloutPalette.of(255, 248, 225, 249, 168, 37);
    static final CalloutPalette UDL = CalloutPalette.of(243, 229, 245, 142, 36, 170);

    private static final List<SectionSlot> SLOTS = List.of(
            SectionSlot.of("photoDescription", "Photo Description",
                    HeadingMatcher.exact("Photo Description", 2, 3),
                    SectionPalette.of(227, 242, 253, 21, 101, 192)),
            SectionSlot.of("scientificPhenomena", "Scientific Phenomena",
                    HeadingMatcher.exact("Scientific Phenomena", 2, 3),
                    SectionPalette.of(232, 245, 233, 46, 125, 50)),
            SectionSlot.of("coreConcepts", "Core Science Concepts",
                            HeadingMatcher.startingWith("Core Science Concepts", 2, 3),
                            SectionPalette.of(241, 248, 233, 85, 139, 47))
                    .withCallout(NestedSpan.PEDAGOGICAL_TIP, "Pedagogical Tip:", PEDAGOGICAL_TIP)
                    .withCallout(NestedSpan.UDL_SUGGESTIONS, "UDL Suggestions:", UDL),
            SectionSlot.of("zoomInOut", "Zoom In / Zoom Out",
                    HeadingMatcher.startingWith("Zoom In / Zoom Out", 2, 3),
                    SectionPalette.of(255, 248, 225, 245, 127, 23)),
            SectionSlot.of("misconceptions", "Potential Student Misconceptions",
                    HeadingMatcher.pattern("(?:Potential\\s+)?Student\\s+Misconceptions", false, 2, 3),
                    SectionPalette.of(255, 235, 238, 198, 40, 40)),
            SectionSlot.of("ngssConnections", "NGSS Connections",
                    HeadingMatcher.exact("NGSS Connections", 2, 3),
                    SectionPalette.of(232, 234, 246, 40, 53, 147)),
            SectionSlot.of("discussionQuestions", "Discussion Questions",
                            HeadingMatcher.exact("Discussion Questions", 2, 3),
                            SectionPalette.of(255, 243, 224, 230, 81, 0))
                    .withInset(8f),
            SectionSlot.of("vocabulary", "Science Vocabulary",
                    HeadingMatcher.pattern("(?:Science\\s+)?Vocabulary", false, 2, 3),
                    SectionPalette.of(227, 242, 253, 13, 71, 161)),
            SectionSlot.of("extensionActivities", "Extension Activities",
                            HeadingMatcher.exact("Extension Activities", 2, 3),
                            SectionPalette.of(224, 247, 250, 0, 105, 92))
                    .asOptional(),
            SectionSlot.of("crossCurricular", "Cross-Curricular Ideas",
                    HeadingMatcher.pattern("Cross[-\\s]?Curricular(?:\\s+(?:Ideas|Connections))?", false, 2, 3),
                    SectionPalette.of(243, 229, 245, 106, 27, 154)),
            SectionSlot.of("careerConnection", "STEM Career Connection",
                    HeadingMatcher.pattern("(?:STEM\\s+)?Career\\s+Connections?", false, 2, 3),
                    SectionPalette.of(232, 245, 233, 27, 94, 32)),
            SectionSlot.of("externalResources", "External Resources",
                    HeadingMatcher.pattern("(?:External\\s+)?Resources", false, 2, 3),
                    SectionPalette.of(245, 245, 245, 66, 66, 66))
    );

    public LessonGuideTemplate(DocumentProperties properties,
                               SectionExtractor sectionExtractor,
                               TextSanitizer sanitizer,
                               DocumentImageLoader imageLoader,
                               PageFrameFactory frameFactory) {
        super(properties, sectionExtractor, sanitizer, imageLoader, frameFactory);
    }

    @Override
    protected DocumentType type() {
        return DocumentType.LESSON_GUIDE;
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
        return 160f;
    }

    @Override
    float photoBoxHeight() {
        return 120f;
    }

    @Override
    String leadFallback() {
        return "No description available.";
    }
}
