package uk.gegc.lessondocs.features.backfill.application;

import uk.gegc.lessondocs.features.backfill.domain.model.BackfillJob;
import uk.gegc.lessondocs.features.backfill.domain.model.BackfillSummary;

import java.util.List;

public interface BackfillService {

    /**
     * Renders and writes every job, each as an independent unit. Never throws for a failing job; the
     * failure is reported in the summary.
     */
    BackfillSummary run(List<BackfillJob> jobs);
}
