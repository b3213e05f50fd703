package uk.gegc.lessondocs.features.backfill.infra;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.lessondocs.features.backfill.application.RenderedDocumentSink;
import uk.gegc.lessondocs.features.content.domain.model.ContentRecord;
import uk.gegc.lessondocs.features.document.config.DocumentProperties;
import uk.gegc.lessondocs.features.document.domain.model.RenderedDocument;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;

/**
 * Writes documents to {@code {output-dir}/{category}/{filename}}, replacing any previous file.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FileSystemDocumentSink implements RenderedDocumentSink {

    private final DocumentProperties properties;

    @Override
    public void write(ContentRecord record, RenderedDocument document) throws IOException {
        Path baseDir = Paths.get(properties.getBackfill().getOutputDir()).toAbsolutePath().normalize();
        Path categoryDir = baseDir.resolve(record.category().slug());
        Files.createDirectories(categoryDir);

        Path output = categoryDir.resolve(document.filename()).normalize();
        if (!output.startsWith(categoryDir)) {
            throw new IOException("Refusing to write outside " + categoryDir + ": " + document.filename());
        }
        Path tmp = categoryDir.resolve(document.filename() + ".tmp");
        try {
            try (InputStream content = document.contentSupplier().get()) {
                Files.copy(content, tmp, StandardCopyOption.REPLACE_EXISTING);
            }
            moveIntoPlace(tmp, output);
        } catch (IOException | RuntimeException e) {
            discard(tmp, e);
            throw e;
        }
        log.debug("Wrote {} ({} bytes)", output, document.contentLength());
    }

    private static void moveIntoPlace(Path tmp, Path output) throws IOException {
        try {
            Files.move(tmp, output, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, output, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void discard(Path tmp, Exception failure) {
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException cleanup) {
            failure.addSuppressed(cleanup);
        }
    }
}
