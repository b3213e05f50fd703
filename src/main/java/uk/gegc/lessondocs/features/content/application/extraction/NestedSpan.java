package uk.gegc.lessondocs.features.content.application.extraction;

/**
 * Inline tagged spans the generator embeds inside a section body.
 */
public enum NestedSpan {
    PEDAGOGICAL_TIP("pedagogical-tip"),
    UDL_SUGGESTIONS("udl-suggestions");

    private final String tagName;

    NestedSpan(String tagName) {
        this.tagName = tagName;
    }

    public String tagName() {
        return tagName;
    }
}
