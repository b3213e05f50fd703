package uk.gegc.lessondocs.features.backfill.infra;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import uk.gegc.lessondocs.features.content.domain.model.Category;
import uk.gegc.lessondocs.features.content.domain.model.ContentRecord;
import uk.gegc.lessondocs.features.content.domain.model.GradeLevel;
import uk.gegc.lessondocs.features.document.config.DocumentProperties;
import uk.gegc.lessondocs.features.document.domain.model.RenderedDocument;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("FileSystemDocumentSink Tests")
class FileSystemDocumentSinkTest {

    private static final ContentRecord RECORD = ContentRecord.of("Static Electricity", Category.PHYSICAL_SCIENCE,
            GradeLevel.SECOND_GRADE, "");

    @TempDir
    Path outputDir;

    private FileSystemDocumentSink sink;

    @BeforeEach
    void setUp() {
        DocumentProperties properties = new DocumentProperties();
        properties.getBackfill().setOutputDir(outputDir.toString());
        sink = new FileSystemDocumentSink(properties);
    }

    @Test
    @DisplayName("write: stores the document under its category directory")
    void write_storesUnderCategory() throws IOException {
        // When
        sink.write(RECORD, document("static-electricity-lesson-second-grade.pdf", "%PDF-1.4 first"));

        // Then
        Path written = outputDir.resolve("physical-science").resolve("static-electricity-lesson-second-grade.pdf");
        assertThat(written).exists();
        assertThat(Files.readString(written)).isEqualTo("%PDF-1.4 first");
        assertThat(outputDir.resolve("physical-science").resolve("static-electricity-lesson-second-grade.pdf.tmp"))
                .doesNotExist();
    }

    @Test
    @DisplayName("write: replaces an existing file")
    void write_replacesExisting() throws IOException {
        // Given
        sink.write(RECORD, document("static-electricity-lesson-second-grade.pdf", "%PDF-1.4 first"));

        // When
        sink.write(RECORD, document("static-electricity-lesson-second-grade.pdf", "%PDF-1.4 second"));

        // Then
        assertThat(Files.readString(outputDir.resolve("physical-science/static-electricity-lesson-second-grade.pdf")))
                .isEqualTo("%PDF-1.4 second");
    }

    @Test
    @DisplayName("write: refuses filenames that escape the category directory")
    void write_pathTraversal_rejected() {
        assertThatThrownBy(() -> sink.write(RECORD, document("../../escape.pdf", "%PDF")))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Refusing to write outside");
        assertThat(outputDir.getParent().resolve("escape.pdf")).doesNotExist();
    }

    @Test
    @DisplayName("write: a failing content stream leaves neither the file nor the temp file behind")
    void write_contentFails_tempFileRemoved() {
        // Given
        RenderedDocument broken = new RenderedDocument("static-electricity-rubric-second-grade.pdf", "application/pdf",
                FailingStream::new, 1024, 1);

        // When / Then
        assertThatThrownBy(() -> sink.write(RECORD, broken))
                .isInstanceOf(IOException.class)
                .hasMessage("Stream reset");
        Path categoryDir = outputDir.resolve("physical-science");
        assertThat(categoryDir.resolve("static-electricity-rubric-second-grade.pdf")).doesNotExist();
        assertThat(categoryDir.resolve("static-electricity-rubric-second-grade.pdf.tmp")).doesNotExist();
    }

    private static RenderedDocument document(String filename, String content) {
        byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
        return new RenderedDocument(filename, "application/pdf", () -> new ByteArrayInputStream(bytes), bytes.length, 1);
    }

    private static final class FailingStream extends InputStream {

        private int served;

        @Override
        public int read() throws IOException {
            if (served++ < 16) {
                return '%';
            }
            throw new IOException("Stream reset");
        }
    }
}
