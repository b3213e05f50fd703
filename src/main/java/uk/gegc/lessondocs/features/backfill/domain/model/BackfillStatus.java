package uk.gegc.lessondocs.features.backfill.domain.model;

public enum BackfillStatus {
    WRITTEN,
    RENDER_FAILED,
    WRITE_FAILED
}
