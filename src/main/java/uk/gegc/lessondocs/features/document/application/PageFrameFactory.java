package uk.gegc.lessondocs.features.document.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.lessondocs.features.content.domain.model.ContentRecord;
import uk.gegc.lessondocs.features.document.application.layout.DocumentHeader;
import uk.gegc.lessondocs.features.document.application.layout.FrameStyle;
import uk.gegc.lessondocs.features.document.application.layout.PageFrame;
import uk.gegc.lessondocs.features.document.config.DocumentProperties;

import java.awt.image.BufferedImage;
import java.time.Clock;
import java.time.Year;

/**
 * Builds the page frame of a render: header text, decoded logo and the footer attribution.
 */
@Component
@RequiredArgsConstructor
public class PageFrameFactory {

    private final DocumentImageLoader imageLoader;
    private final DocumentProperties properties;
    private final Clock clock;

    /**
     * Frame with the grade label as badge.
     */
    public PageFrame create(ContentRecord record, FrameStyle style, String documentLabel) {
        String grade = record.gradeLevel().label();
        return create(record, style, documentLabel, grade, grade + " " + documentLabel);
    }

    public PageFrame create(ContentRecord record, FrameStyle style, String documentLabel,
                            String badge, String continuationSuffix) {
        BufferedImage logo = imageLoader.loadLogo(record.logoBytes(), record.title()).orElse(null);
        DocumentHeader header = new DocumentHeader(
                record.title(),
                badge,
                record.category().label() + "  |  " + documentLabel,
                record.title() + " — " + continuationSuffix,
                logo
        );
        return new PageFrame(style, header, attribution());
    }

    String attribution() {
        return properties.getAttribution().replace("{year}", String.valueOf(Year.now(clock).getValue()));
    }
}
