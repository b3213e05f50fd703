package uk.gegc.lessondocs.features.backfill.domain.model;

import uk.gegc.lessondocs.features.content.domain.model.DocumentType;

/**
 * Outcome of one backfill job.
 *
 * @param attempts render attempts made, including the successful one
 * @param filename written filename, null unless the document was rendered
 * @param error    last failure message, null on success
 */
public record BackfillResult(
        String title,
        DocumentType type,
        BackfillStatus status,
        int attempts,
        String filename,
        String error
) {
    public static BackfillResult written(BackfillJob job, int attempts, String filename) {
        return new BackfillResult(job.payload().record().title(), job.type(), BackfillStatus.WRITTEN, attempts, filename, null);
    }

    public static BackfillResult renderFailed(BackfillJob job, int attempts, String error) {
        return new BackfillResult(job.payload().record().title(), job.type(), BackfillStatus.RENDER_FAILED, attempts, null, error);
    }

    public static BackfillResult writeFailed(BackfillJob job, int attempts, String filename, String error) {
        return new BackfillResult(job.payload().record().title(), job.type(), BackfillStatus.WRITE_FAILED, attempts, filename, error);
    }

    public boolean succeeded() {
        return status == BackfillStatus.WRITTEN;
    }
}
