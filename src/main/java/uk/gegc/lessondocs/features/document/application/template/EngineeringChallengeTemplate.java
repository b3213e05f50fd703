package uk.gegc.lessondocs.features.document.application.template;

import org.springframework.stereotype.Component;
import uk.gegc.lessondocs.features.content.application.TextSanitizer;
import uk.gegc.lessondocs.features.content.application.extraction.GradeBand;
import uk.gegc.lessondocs.features.content.application.extraction.GradeBandTaskExtractor;
import uk.gegc.lessondocs.features.content.application.extraction.HeadingMatcher;
import uk.gegc.lessondocs.features.content.application.extraction.SectionExtractor;
import uk.gegc.lessondocs.features.content.domain.model.ContentRecord;
import uk.gegc.lessondocs.features.content.domain.model.DocumentType;
import uk.gegc.lessondocs.features.content.domain.model.Section;
import uk.gegc.lessondocs.features.document.application.DocumentImageLoader;
import uk.gegc.lessondocs.features.document.application.PageFrameFactory;
import uk.gegc.lessondocs.features.document.application.layout.CalloutPalette;
import uk.gegc.lessondocs.features.document.application.layout.FrameStyle;
import uk.gegc.lessondocs.features.document.application.layout.PageFlow;
import uk.gegc.lessondocs.features.document.application.layout.PageFrame;
import uk.gegc.lessondocs.features.document.application.layout.RgbColor;
import uk.gegc.lessondocs.features.document.application.layout.SectionPalette;
import uk.gegc.lessondocs.features.document.config.DocumentProperties;

import java.util.List;

/**
 * Engineering design challenge built around a photo, with separate task variants for the K-2 and 3-5
 * grade bands when the content provides them.
 */
@Component
public class EngineeringChallengeTemplate extends FlowedDocumentTemplate {

    static final String BADGE = "Engineering Challenge";
    static final String TASK_KEY = "engineeringTask";

    static final FrameStyle FRAME = new FrameStyle(RgbColor.of(46, 125, 50), RgbColor.of(200, 235, 210),
            "FOR TEACHER USE ONLY");

    static final CalloutPalette EARLY_BAND = CalloutPalette.of(255, 248, 225, 249, 168, 37);
    static final CalloutPalette LATER_BAND = CalloutPalette.of(224, 247, 250, 0, 137, 123);

    private static final SectionPalette ENGINEERING = SectionPalette.of(232, 245, 233, 46, 125, 50);

    private static final List<SectionSlot> SLOTS = List.of(
            SectionSlot.of("visibleElements", "Visible Elements in Photo",
                    HeadingMatcher.startingWith("Visible Elements", 2, 3),
                    SectionPalette.of(227, 242, 253, 21, 101, 192)),
            SectionSlot.of("inferences", "Reasonable Inferences",
                    HeadingMatcher.startingWith("Reasonable Inferences", 2, 3),
                    SectionPalette.of(232, 234, 246, 40, 53, 147)),
            SectionSlot.of(TASK_KEY, "Engineering Task",
                            HeadingMatcher.startingWith("Engineering Task", 2, 3), ENGINEERING)
                    .withNestedHeadings("[^A-Za-z0-9]*(?:K|3)\\s*[–-]\\s*(?:2|5)\\b"),
            SectionSlot.of("edpPhase", "EDP Phase Targeted",
                    HeadingMatcher.pattern("(?:EDP\\s+)?Phase\\s+Targeted", true, 2, 3),
                    SectionPalette.of(255, 243, 224, 230, 81, 0)),
            SectionSlot.of("materials", "Suggested Materials",
                    HeadingMatcher.pattern("(?:Suggested\\s+)?Materials", true, 2, 3),
                    SectionPalette.of(241, 248, 233, 85, 139, 47)),
            SectionSlot.of("estimatedTime", "Estimated Time",
                    HeadingMatcher.startingWith("Estimated Time", 2, 3),
                    SectionPalette.of(255, 248, 225, 245, 127, 23)),
            SectionSlot.of("whyItWorks", "Why This Works for Teachers",
                            HeadingMatcher.startingWith("Why This Works", 2, 3),
                            SectionPalette.of(243, 229, 245, 142, 36, 170))
                    .asOptional()
    );

    private final GradeBandTaskExtractor gradeBandExtractor;

    public EngineeringChallengeTemplate(DocumentProperties properties,
                                        SectionExtractor sectionExtractor,
                                        TextSanitizer sanitizer,
                                        DocumentImageLoader imageLoader,
                                        PageFrameFactory frameFactory,
                                        GradeBandTaskExtractor gradeBandExtractor) {
        super(properties, sectionExtractor, sanitizer, imageLoader, frameFactory);
        this.gradeBandExtractor = gradeBandExtractor;
    }

    @Override
    protected DocumentType type() {
        return DocumentType.ENGINEERING_CHALLENGE;
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

    @Override
    PageFrame frame(ContentRecord record) {
        return frameFactory.create(record, FRAME, type().label(), BADGE, BADGE);
    }

    @Override
    void paintSection(PageFlow flow, SectionSlot slot, Section section) {
        if (!TASK_KEY.equals(slot.key())) {
            super.paintSection(flow, slot, section);
            return;
        }
        String earlyTask = gradeBandExtractor.extract(section.bodyText(), GradeBand.K_TO_2);
        String laterTask = gradeBandExtractor.extract(section.bodyText(), GradeBand.GRADES_3_TO_5);
        if (earlyTask == null && laterTask == null) {
            super.paintSection(flow, slot, section);
            return;
        }
        flow.sectionHeading(slot.label(), slot.palette(), PageFlow.sectionHeadingHeight() + 40f);
        if (earlyTask != null) {
            flow.callout("K-2 Challenge:", sanitizer.sanitize(earlyTask), EARLY_BAND);
        }
        if (laterTask != null) {
            flow.callout("3-5 Challenge:", sanitizer.sanitize(laterTask), LATER_BAND);
        }
    }
}
