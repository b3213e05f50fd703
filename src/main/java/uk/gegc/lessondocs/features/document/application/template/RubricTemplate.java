package uk.gegc.lessondocs.features.document.application.template;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.lessondocs.features.content.application.RubricDataParser;
import uk.gegc.lessondocs.features.content.domain.model.ContentRecord;
import uk.gegc.lessondocs.features.content.domain.model.DocumentType;
import uk.gegc.lessondocs.features.content.domain.model.RubricQuestion;
import uk.gegc.lessondocs.features.document.application.PageFrameFactory;
import uk.gegc.lessondocs.features.document.application.layout.FrameStyle;
import uk.gegc.lessondocs.features.document.application.layout.PageFlow;
import uk.gegc.lessondocs.features.document.application.layout.PdfFont;
import uk.gegc.lessondocs.features.document.application.layout.RgbColor;
import uk.gegc.lessondocs.features.document.application.layout.TextBlock;
import uk.gegc.lessondocs.features.document.application.table.RubricTableRenderer;
import uk.gegc.lessondocs.features.document.config.DocumentProperties;
import uk.gegc.lessondocs.features.document.domain.model.RenderPayload;
import uk.gegc.lessondocs.shared.exception.InvalidRubricDataException;

import java.util.List;

import static uk.gegc.lessondocs.features.document.application.layout.PageGeometry.*;

/**
 * Scoring rubric: a scale legend and one table row per discussion question.
 */
@Slf4j
@Component
public class RubricTemplate extends AbstractDocumentTemplate {

    static final FrameStyle FRAME = new FrameStyle(RgbColor.of(216, 67, 21), RgbColor.of(255, 210, 190),
            "FOR TEACHER USE ONLY");

    static final String SCALE_LEGEND =
            "4 = Exceeds Expectations  |  3 = Meets Expectations  |  2 = Approaching  |  1 = Beginning";
    static final String REVIEW_NOTE = "Note: This rubric is AI-generated based on the discussion questions for this "
            + "photograph. Review and adjust criteria as needed for your classroom context.";

    private final PageFrameFactory frameFactory;
    private final RubricDataParser rubricDataParser;

    public RubricTemplate(DocumentProperties properties,
                          PageFrameFactory frameFactory,
                          RubricDataParser rubricDataParser) {
        super(properties);
        this.frameFactory = frameFactory;
        this.rubricDataParser = rubricDataParser;
    }

    @Override
    protected DocumentType type() {
        return DocumentType.RUBRIC;
    }

    @Override
    protected PageFlow layout(RenderPayload payload) {
        List<RubricQuestion> questions = payload.rubricQuestions();
        if (questions == null) {
            throw new InvalidRubricDataException("Rubric questions are required to render a rubric");
        }
        rubricDataParser.validate(questions);

        ContentRecord record = payload.record();
        PageFlow flow = PageFlow.begin(frameFactory.create(record, FRAME, type().label()));
        flow.centeredLine(SCALE_LEGEND, PdfFont.REGULAR, 8.5f, RgbColor.SUBTITLE_TEXT);
        flow.advance(4f);

        RubricTableRenderer table = new RubricTableRenderer(flow);
        float firstRow = questions.isEmpty() ? RubricTableRenderer.MIN_ROW_HEIGHT : table.fittedRowHeight(questions.get(0));
        table.renderHeaderRow(firstRow);
        for (int i = 0; i < questions.size(); i++) {
            table.renderRow(questions.get(i), i);
        }

        TextBlock note = TextBlock.layout(REVIEW_NOTE, PdfFont.OBLIQUE, 8f, CONTENT_WIDTH, 2f);
        if (flow.fits(8f + note.height())) {
            flow.advance(8f);
            flow.paragraph(note, MARGIN, RgbColor.SUBTITLE_TEXT);
        }
        log.debug("Laid out rubric '{}' with {} question(s) on {} page(s)",
                record.title(), questions.size(), flow.currentPage());
        return flow;
    }
}
