package uk.gegc.lessondocs.features.document.application.layout;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.graphics.image.JPEGFactory;
import org.apache.pdfbox.pdmodel.graphics.image.LosslessFactory;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Replays draw commands onto a PDFBox content stream, flipping top-down coordinates into PDF space.
 * Images are embedded once per document even when painted on several pages.
 */
public class PdfPainter {

    private final PDDocument document;
    private final float pageHeight;
    private final float jpegQuality;
    private final Map<BufferedImage, PDImageXObject> embedded = new IdentityHashMap<>();
    private PDPageContentStream stream;

    PdfPainter(PDDocument document, float pageHeight, float jpegQuality) {
        this.document = document;
        this.pageHeight = pageHeight;
        this.jpegQuality = jpegQuality;
    }

    void attach(PDPageContentStream contentStream) {
        this.stream = contentStream;
    }

    void fillRect(float x, float y, float width, float height, RgbColor color) throws IOException {
        stream.setNonStrokingColor(color.toAwt());
        stream.addRect(x, pageHeight - y - height, width, height);
        stream.fill();
    }

    void strokeRect(float x, float y, float width, float height, float lineWidth, RgbColor color) throws IOException {
        stream.setStrokingColor(color.toAwt());
        stream.setLineWidth(lineWidth);
        stream.addRect(x, pageHeight - y - height, width, height);
        stream.stroke();
    }

    void line(float x1, float y1, float x2, float y2, float lineWidth, RgbColor color) throws IOException {
        stream.setStrokingColor(color.toAwt());
        stream.setLineWidth(lineWidth);
        stream.moveTo(x1, pageHeight - y1);
        stream.lineTo(x2, pageHeight - y2);
        stream.stroke();
    }

    void text(String text, float x, float y, PdfFont font, float fontSize, RgbColor color) throws IOException {
        if (text == null || text.isEmpty()) {
            return;
        }
        stream.beginText();
        stream.setFont(font.pdFont(), fontSize);
        stream.setNonStrokingColor(color.toAwt());
        stream.newLineAtOffset(x, pageHeight - y - font.ascent(fontSize));
        stream.showText(font.printable(text));
        stream.endText();
    }

    void image(BufferedImage image, float x, float y, float width, float height, boolean lossless) throws IOException {
        PDImageXObject xObject = embedded.get(image);
        if (xObject == null) {
            xObject = lossless
                    ? LosslessFactory.createFromImage(document, image)
                    : JPEGFactory.createFromImage(document, image, jpegQuality);
            embedded.put(image, xObject);
        }
        stream.drawImage(xObject, x, pageHeight - y - height, width, height);
    }
}
