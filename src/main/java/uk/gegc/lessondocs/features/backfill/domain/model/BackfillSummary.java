package uk.gegc.lessondocs.features.backfill.domain.model;

import java.util.List;

public record BackfillSummary(
        int total,
        int written,
        int renderFailures,
        int writeFailures,
        long durationMs,
        List<BackfillResult> results
) {
    public static BackfillSummary of(List<BackfillResult> results, long durationMs) {
        int written = 0;
        int renderFailures = 0;
        int writeFailures = 0;
        for (BackfillResult result : results) {
            switch (result.status()) {
                case WRITTEN -> written++;
                case RENDER_FAILED -> renderFailures++;
                case WRITE_FAILED -> writeFailures++;
            }
        }
        return new BackfillSummary(results.size(), written, renderFailures, writeFailures, durationMs, List.copyOf(results));
    }
}
