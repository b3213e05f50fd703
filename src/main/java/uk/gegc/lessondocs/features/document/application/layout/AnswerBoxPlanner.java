package uk.gegc.lessondocs.features.document.application.layout;

import java.util.List;

/**
 * Fixed-region layout policy: splits the space left on a page evenly between answer boxes.
 * <p>
 * For {@code n} questions with measured prompt heights, each box gets
 * {@code (available - sum(prompts) - n * (promptGap + spacing)) / n}, clamped to
 * [{@link #MIN_BOX_HEIGHT}, {@link #MAX_BOX_HEIGHT}]. Only the floor can make the boxes overflow the
 * page; the caller then continues on a fresh page and plans again for the questions left.
 */
public final class AnswerBoxPlanner {

    public static final float MIN_BOX_HEIGHT = 70f;
    public static final float MAX_BOX_HEIGHT = 150f;
    public static final float PROMPT_GAP = 4f;
    public static final float QUESTION_SPACING = 8f;

    private AnswerBoxPlanner() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static float boxHeight(List<Float> promptHeights, float available) {
        if (promptHeights == null || promptHeights.isEmpty()) {
            return 0f;
        }
        int count = promptHeights.size();
        float prompts = 0f;
        for (Float height : promptHeights) {
            prompts += height == null ? 0f : height;
        }
        float perBox = (available - prompts - count * (PROMPT_GAP + QUESTION_SPACING)) / count;
        return Math.max(MIN_BOX_HEIGHT, Math.min(MAX_BOX_HEIGHT, perBox));
    }

    /**
     * Vertical space one question takes: prompt, gap and box, without the trailing spacing.
     */
    public static float questionHeight(float promptHeight, float boxHeight) {
        return promptHeight + PROMPT_GAP + boxHeight;
    }
}
