package uk.gegc.lessondocs.features.backfill.application.impl;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import uk.gegc.lessondocs.features.backfill.application.BackfillService;
import uk.gegc.lessondocs.features.backfill.application.RenderedDocumentSink;
import uk.gegc.lessondocs.features.backfill.domain.model.BackfillJob;
import uk.gegc.lessondocs.features.backfill.domain.model.BackfillResult;
import uk.gegc.lessondocs.features.backfill.domain.model.BackfillSummary;
import uk.gegc.lessondocs.features.document.application.DocumentRenderService;
import uk.gegc.lessondocs.features.document.config.DocumentProperties;
import uk.gegc.lessondocs.features.document.domain.model.RenderedDocument;
import uk.gegc.lessondocs.shared.exception.InvalidRubricDataException;
import uk.gegc.lessondocs.shared.exception.UnsupportedDocumentTypeException;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;

/**
 * Runs backfill jobs on the render pool. A job whose render throws is retried as a whole up to the
 * configured attempt count; a sink failure is reported once and not retried. Invalid rubric data and
 * unsupported types fail the same way on every attempt, so they are reported after the first.
 */
@Service
@Slf4j
public class BackfillServiceImpl implements BackfillService {

    private final DocumentRenderService renderService;
    private final RenderedDocumentSink sink;
    private final DocumentProperties properties;
    private final Executor renderTaskExecutor;
    private final Clock clock;

    public BackfillServiceImpl(DocumentRenderService renderService,
                               RenderedDocumentSink sink,
                               DocumentProperties properties,
                               @Qualifier("renderTaskExecutor") Executor renderTaskExecutor,
                               Clock clock) {
        this.renderService = renderService;
        this.sink = sink;
        this.properties = properties;
        this.renderTaskExecutor = renderTaskExecutor;
        this.clock = clock;
    }

    @Override
    public BackfillSummary run(List<BackfillJob> jobs) {
        Instant startTime = clock.instant();
        if (jobs == null || jobs.isEmpty()) {
            return BackfillSummary.of(List.of(), 0L);
        }
        log.info("Starting backfill of {} job(s)", jobs.size());

        List<CompletableFuture<BackfillResult>> futures = jobs.stream()
                .map(job -> CompletableFuture.supplyAsync(() -> runJob(job), renderTaskExecutor))
                .toList();

        List<BackfillResult> results = new ArrayList<>(jobs.size());
        for (int i = 0; i < futures.size(); i++) {
            results.add(await(futures.get(i), jobs.get(i)));
        }

        long durationMs = Duration.between(startTime, clock.instant()).toMillis();
        BackfillSummary summary = BackfillSummary.of(results, durationMs);
        log.info("Backfill completed: total={}, written={}, renderFailures={}, writeFailures={}, durationMs={}",
                summary.total(), summary.written(), summary.renderFailures(), summary.writeFailures(), durationMs);
        return summary;
    }

    BackfillResult runJob(BackfillJob job) {
        int maxAttempts = Math.max(1, properties.getBackfill().getMaxAttempts());
        RuntimeException lastFailure = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            RenderedDocument document;
            try {
                document = renderService.render(job.type(), job.payload());
            } catch (InvalidRubricDataException | UnsupportedDocumentTypeException e) {
                log.error("Backfill rejected {}: {}", job.describe(), e.getMessage());
                return BackfillResult.renderFailed(job, attempt, e.getMessage());
            } catch (RuntimeException e) {
                lastFailure = e;
                log.warn("Render attempt {}/{} failed for {}: {}", attempt, maxAttempts, job.describe(), e.getMessage());
                continue;
            }
            return write(job, document, attempt);
        }
        log.error("Backfill gave up on {} after {} attempt(s)", job.describe(), maxAttempts, lastFailure);
        return BackfillResult.renderFailed(job, maxAttempts, lastFailure.getMessage());
    }

    private BackfillResult write(BackfillJob job, RenderedDocument document, int attempts) {
        try {
            sink.write(job.payload().record(), document);
            return BackfillResult.written(job, attempts, document.filename());
        } catch (IOException | RuntimeException e) {
            log.error("Failed to write {} for {}", document.filename(), job.describe(), e);
            return BackfillResult.writeFailed(job, attempts, document.filename(), e.getMessage());
        }
    }

    private BackfillResult await(CompletableFuture<BackfillResult> future, BackfillJob job) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return BackfillResult.renderFailed(job, 0, "Interrupted while waiting for render");
        } catch (ExecutionException e) {
            log.error("Backfill unit {} failed unexpectedly", job.describe(), e.getCause());
            return BackfillResult.renderFailed(job, 0, e.getCause().getMessage());
        }
    }
}
