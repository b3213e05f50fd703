package uk.gegc.lessondocs.features.document.application.layout;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Multi-page canvas that records draw commands per page.
 * <p>
 * Any page can receive more commands at any time, which is how footers are stamped once the page
 * count is known. Nothing touches PDFBox until {@link #serialize(float)}.
 */
public class DocumentCanvas {

    private final List<List<DrawCommand>> pages = new ArrayList<>();

    /**
     * @return the 1-based index of the new page
     */
    public int addPage() {
        pages.add(new ArrayList<>());
        return pages.size();
    }

    public void draw(int pageIndex, DrawCommand command) {
        if (pageIndex < 1 || pageIndex > pages.size()) {
            throw new IndexOutOfBoundsException("No page " + pageIndex + " (page count " + pages.size() + ")");
        }
        pages.get(pageIndex - 1).add(command);
    }

    public int pageCount() {
        return pages.size();
    }

    public List<DrawCommand> commands(int pageIndex) {
        return Collections.unmodifiableList(pages.get(pageIndex - 1));
    }

    public byte[] serialize(float jpegQuality) throws IOException {
        try (PDDocument document = new PDDocument()) {
            PdfPainter painter = new PdfPainter(document, PageGeometry.PAGE_HEIGHT, jpegQuality);
            for (List<DrawCommand> commands : pages) {
                PDPage page = new PDPage(PDRectangle.LETTER);
                document.addPage(page);
                try (PDPageContentStream stream = new PDPageContentStream(document, page)) {
                    painter.attach(stream);
                    for (DrawCommand command : commands) {
                        command.paint(painter);
                    }
                }
            }
            ByteArrayOutputStream baos = new ByteArrayOutputStream();
            document.save(baos);
            return baos.toByteArray();
        }
    }
}
