package archive.ingest.common;

/**
 * Outcome kinds of an archive request. Every caller of the ingestion pipelines is expected to handle each of them.
 */
public enum ArchiveFailureKind {
    /**
     * Archiving is disabled by configuration, or the service is not in an accepting state.
     * Reported before any bytes are moved.
     */
    CONFIGURATION_REJECTED(false),
    /**
     * No volume on the host can take the request. Reported before any bytes are moved.
     */
    NO_VOLUME_AVAILABLE(false),
    /**
     * Generic staging or fetch failure not related to disk space. Terminal for the attempt.
     */
    IO_FAILURE(false),
    /**
     * The local disk ran out of space. Terminal for the current target volume.
     */
    DISK_EXHAUSTED(false),
    /**
     * A partial transfer was interrupted; the partial staging file is kept and the request may be retried.
     */
    RESUMABLE(true),
    /**
     * A catalog write failed after the payload was durably placed: data is present, metadata is (partially) missing.
     */
    CATALOG_FAILURE(false);

    private final boolean retryable;

    ArchiveFailureKind(boolean retryable) {
        this.retryable = retryable;
    }

    /**
     * @return whether the same request may be retried against the same target and keep its on-disk state
     */
    public boolean isRetryable() {
        return retryable;
    }
}
