package uk.gegc.lessondocs.features.document.application.layout;

import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Standard 14 Helvetica faces used by every template.
 * <p>
 * The PDFBox font objects are shared by all renders and cache widths in plain maps, so metric lookups
 * go through this enum and lock the font.
 */
@Slf4j
public enum PdfFont {
    REGULAR(PDType1Font.HELVETICA),
    BOLD(PDType1Font.HELVETICA_BOLD),
    OBLIQUE(PDType1Font.HELVETICA_OBLIQUE);

    /** Helvetica ascender in glyph units; the same for all three faces. */
    private static final float ASCENT = 718f;

    private final PDFont font;
    private final Map<Integer, Boolean> encodable = new ConcurrentHashMap<>();

    PdfFont(PDFont font) {
        this.font = font;
    }

    PDFont pdFont() {
        return font;
    }

    public float ascent(float fontSize) {
        return ASCENT / 1000f * fontSize;
    }

    public float width(String text, float fontSize) {
        if (text == null || text.isEmpty()) {
            return 0f;
        }
        try {
            synchronized (font) {
                return font.getStringWidth(text) / 1000f * fontSize;
            }
        } catch (IOException | IllegalArgumentException e) {
            log.debug("Width lookup failed for '{}', estimating: {}", text, e.getMessage());
            return text.length() * 0.5f * fontSize;
        }
    }

    /**
     * Drops characters WinAnsi Helvetica cannot show and maps a few common ones to close equivalents.
     */
    public String printable(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        StringBuilder out = new StringBuilder(text.length());
        text.codePoints().forEach(cp -> {
            String substitute = substitute(cp);
            if (substitute != null) {
                out.append(substitute);
            } else if (!Character.isISOControl(cp) && canEncode(cp)) {
                out.appendCodePoint(cp);
            }
        });
        return out.toString();
    }

    private static String substitute(int codePoint) {
        return switch (codePoint) {
            case '\t', '\u00A0', '\u2002', '\u2003', '\u2007', '\u2009', '\u202F' -> " ";
            case '\u2010', '\u2011', '\u2212' -> "-";
            case '\u2192' -> "->";
            case '\u2190' -> "<-";
            case '\u2264' -> "<=";
            case '\u2265' -> ">=";
            case '\u2248' -> "~";
            default -> null;
        };
    }

    private boolean canEncode(int codePoint) {
        return encodable.computeIfAbsent(codePoint, cp -> {
            try {
                synchronized (font) {
                    font.encode(new String(Character.toChars(cp)));
                }
                return true;
            } catch (IOException | IllegalArgumentException e) {
                log.debug("Dropping U+{} not encodable in {}", Integer.toHexString(cp).toUpperCase(), name());
                return false;
            }
        });
    }
}
