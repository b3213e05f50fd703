package uk.gegc.lessondocs.features.document.application.layout;

import java.awt.image.BufferedImage;
import java.io.IOException;

/**
 * One recorded paint operation on a page, in top-down page coordinates.
 * Commands are replayed onto PDFBox only when the whole document has been laid out.
 */
public interface DrawCommand {

    void paint(PdfPainter painter) throws IOException;

    record FillRect(float x, float y, float width, float height, RgbColor color) implements DrawCommand {
        @Override
        public void paint(PdfPainter painter) throws IOException {
            painter.fillRect(x, y, width, height, color);
        }
    }

    record StrokeRect(float x, float y, float width, float height, float lineWidth, RgbColor color) implements DrawCommand {
        @Override
        public void paint(PdfPainter painter) throws IOException {
            painter.strokeRect(x, y, width, height, lineWidth, color);
        }
    }

    record Line(float x1, float y1, float x2, float y2, float lineWidth, RgbColor color) implements DrawCommand {
        @Override
        public void paint(PdfPainter painter) throws IOException {
            painter.line(x1, y1, x2, y2, lineWidth, color);
        }
    }

    /**
     * Single line of text; {@code y} is the top of the line box.
     */
    record Text(String text, float x, float y, PdfFont font, float fontSize, RgbColor color) implements DrawCommand {
        @Override
        public void paint(PdfPainter painter) throws IOException {
            painter.text(text, x, y, font, fontSize, color);
        }
    }

    record Image(BufferedImage image, float x, float y, float width, float height, boolean lossless) implements DrawCommand {
        @Override
        public void paint(PdfPainter painter) throws IOException {
            painter.image(image, x, y, width, height, lossless);
        }
    }
}
