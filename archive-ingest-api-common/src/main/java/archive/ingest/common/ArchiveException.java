package archive.ingest.common;

import java.util.Objects;

/**
 * Signals a failure of one of the ingestion steps, classified by its {@link ArchiveFailureKind}.
 */
public class ArchiveException extends Exception {
    private final ArchiveFailureKind kind;

    public ArchiveException(ArchiveFailureKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind);
    }

    public ArchiveException(ArchiveFailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind);
    }

    public ArchiveFailureKind getKind() {
        return kind;
    }
}
