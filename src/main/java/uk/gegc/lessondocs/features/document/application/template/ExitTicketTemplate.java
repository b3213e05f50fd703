package uk.gegc.lessondocs.features.document.application.template;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.lessondocs.features.content.application.extraction.DiscussionQuestionExtractor;
import uk.gegc.lessondocs.features.content.application.extraction.HeadingMatcher;
import uk.gegc.lessondocs.features.content.application.extraction.SectionExtractor;
import uk.gegc.lessondocs.features.content.application.extraction.SectionSpec;
import uk.gegc.lessondocs.features.content.domain.model.ContentRecord;
import uk.gegc.lessondocs.features.content.domain.model.DocumentType;
import uk.gegc.lessondocs.features.document.application.DocumentImageLoader;
import uk.gegc.lessondocs.features.document.application.PageFrameFactory;
import uk.gegc.lessondocs.features.document.application.layout.AnswerBoxPlanner;
import uk.gegc.lessondocs.features.document.application.layout.DrawCommand;
import uk.gegc.lessondocs.features.document.application.layout.FrameStyle;
import uk.gegc.lessondocs.features.document.application.layout.PageFlow;
import uk.gegc.lessondocs.features.document.application.layout.PdfFont;
import uk.gegc.lessondocs.features.document.application.layout.RgbColor;
import uk.gegc.lessondocs.features.document.application.layout.TextBlock;
import uk.gegc.lessondocs.features.document.config.DocumentProperties;
import uk.gegc.lessondocs.features.document.domain.model.RenderPayload;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static uk.gegc.lessondocs.features.document.application.layout.PageGeometry.*;

/**
 * Student exit ticket: name and date lines, then one answer box per discussion question.
 * <p>
 * Box heights come from {@link AnswerBoxPlanner}. Questions that no longer fit continue on the next
 * page, where the boxes are planned again for the questions left.
 */
@Slf4j
@Component
public class ExitTicketTemplate extends AbstractDocumentTemplate {

    static final FrameStyle FRAME = new FrameStyle(RgbColor.of(0, 131, 143), RgbColor.of(180, 235, 240),
            "FOR STUDENT USE");

    static final String DIRECTIONS = "Answer each question in the box below it. Use complete sentences when possible.";
    static final float THUMBNAIL_WIDTH = 80f;
    static final float THUMBNAIL_HEIGHT = 60f;
    static final float PROMPT_FONT_SIZE = 10f;
    static final float PROMPT_LINE_GAP = 2f;
    static final RgbColor BOX_BORDER = RgbColor.of(180, 180, 180);
    static final RgbColor WRITING_LINE = RgbColor.of(189, 189, 189);

    private static final String DISCUSSION_KEY = "discussionQuestions";
    private static final List<SectionSpec> SPECS = List.of(
            SectionSpec.of(DISCUSSION_KEY, "Discussion Questions", HeadingMatcher.exact("Discussion Questions", 2, 3)));

    private final SectionExtractor sectionExtractor;
    private final DiscussionQuestionExtractor questionExtractor;
    private final DocumentImageLoader imageLoader;
    private final PageFrameFactory frameFactory;

    public ExitTicketTemplate(DocumentProperties properties,
                              SectionExtractor sectionExtractor,
                              DiscussionQuestionExtractor questionExtractor,
                              DocumentImageLoader imageLoader,
                              PageFrameFactory frameFactory) {
        super(properties);
        this.sectionExtractor = sectionExtractor;
        this.questionExtractor = questionExtractor;
        this.imageLoader = imageLoader;
        this.frameFactory = frameFactory;
    }

    @Override
    protected DocumentType type() {
        return DocumentType.EXIT_TICKET;
    }

    @Override
    protected PageFlow layout(RenderPayload payload) {
        ContentRecord record = payload.record();
        Map<String, String> sections = sectionExtractor.extract(record.rawBody(), SPECS);
        List<String> questions = questionExtractor.extract(sections.get(DISCUSSION_KEY));
        if (questions.isEmpty()) {
            log.warn("No discussion questions found for exit ticket '{}'", record.title());
        }

        BufferedImage thumbnail = imageLoader.loadPhoto(record.imageBytes(), record.title()).orElse(null);
        PageFlow flow = PageFlow.begin(frameFactory.create(record, FRAME, type().label()));
        paintStudentInfo(flow, thumbnail);
        flow.paragraph(DIRECTIONS, MARGIN, CONTENT_WIDTH, PdfFont.OBLIQUE, 9f, RgbColor.BODY_TEXT);
        flow.advance(4f);

        List<TextBlock> prompts = new ArrayList<>(questions.size());
        for (int i = 0; i < questions.size(); i++) {
            prompts.add(TextBlock.layout((i + 1) + ". " + questions.get(i), PdfFont.BOLD, PROMPT_FONT_SIZE,
                    CONTENT_WIDTH, PROMPT_LINE_GAP));
        }
        paintQuestions(flow, prompts);
        return flow;
    }

    private void paintStudentInfo(PageFlow flow, BufferedImage thumbnail) {
        float top = flow.cursorY();
        float lineEnd = PAGE_WIDTH - MARGIN - THUMBNAIL_WIDTH - 30;
        flow.draw(new DrawCommand.Text("Name:", MARGIN, top + 4, PdfFont.BOLD, 10f, RgbColor.HEADER_TEXT));
        flow.draw(new DrawCommand.Line(MARGIN + 42, top + 14, lineEnd, top + 14, 0.75f, WRITING_LINE));
        flow.draw(new DrawCommand.Text("Date:", MARGIN, top + 26, PdfFont.BOLD, 10f, RgbColor.HEADER_TEXT));
        flow.draw(new DrawCommand.Line(MARGIN + 36, top + 36, MARGIN + 200, top + 36, 0.75f, WRITING_LINE));

        float bottom = top + 46;
        if (thumbnail != null) {
            float scale = Math.min(THUMBNAIL_WIDTH / thumbnail.getWidth(), THUMBNAIL_HEIGHT / thumbnail.getHeight());
            float width = thumbnail.getWidth() * scale;
            float height = thumbnail.getHeight() * scale;
            float x = PAGE_WIDTH - MARGIN - THUMBNAIL_WIDTH + (THUMBNAIL_WIDTH - width) / 2;
            flow.draw(new DrawCommand.Image(thumbnail, x, top, width, height, false));
            bottom = Math.max(bottom, top + THUMBNAIL_HEIGHT + 8);
        }
        flow.moveTo(bottom + 8);
    }

    private void paintQuestions(PageFlow flow, List<TextBlock> prompts) {
        int next = 0;
        while (next < prompts.size()) {
            List<Float> heights = prompts.subList(next, prompts.size()).stream().map(TextBlock::height).toList();
            float boxHeight = AnswerBoxPlanner.boxHeight(heights, flow.remaining());
            int placedOnPage = 0;
            while (next < prompts.size()) {
                float needed = AnswerBoxPlanner.questionHeight(prompts.get(next).height(), boxHeight);
                if (!flow.fits(needed) && !(placedOnPage == 0 && flow.atPageTop())) {
                    break;
                }
                paintQuestion(flow, prompts.get(next), boxHeight);
                next++;
                placedOnPage++;
            }
            if (next < prompts.size()) {
                log.debug("Exit ticket continues on page {} with {} question(s) left",
                        flow.currentPage() + 1, prompts.size() - next);
                flow.breakPage();
            }
        }
    }

    private void paintQuestion(PageFlow flow, TextBlock prompt, float boxHeight) {
        float y = flow.cursorY();
        for (TextBlock.Line line : prompt.lines()) {
            flow.draw(new DrawCommand.Text(line.text(), MARGIN, y, PdfFont.BOLD, PROMPT_FONT_SIZE, RgbColor.HEADER_TEXT));
            y += prompt.advanceOf(line);
        }
        y += AnswerBoxPlanner.PROMPT_GAP;
        flow.draw(new DrawCommand.StrokeRect(MARGIN, y, CONTENT_WIDTH, boxHeight, 1f, BOX_BORDER));
        flow.moveTo(y + boxHeight + AnswerBoxPlanner.QUESTION_SPACING);
    }
}
