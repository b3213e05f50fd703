package uk.gegc.lessondocs.features.content.application.extraction;

/**
 * Pair of adjacent grade levels sharing one variant of differentiated task text.
 */
public enum GradeBand {
    K_TO_2("K-2", "K[–-]2"),
    GRADES_3_TO_5("3-5", "3[–-]5");

    private final String label;
    private final String labelRegex;

    GradeBand(String label, String labelRegex) {
        this.label = label;
        this.labelRegex = labelRegex;
    }

    public String label() {
        return label;
    }

    String labelRegex() {
        return labelRegex;
    }
}
