package archive.ingest.common;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Result of an archive request: either a success carrying a value, or a failure tagged with its
 * {@link ArchiveFailureKind}.
 * <p>
 * A failure may still report files that were fully committed before the failing step; partial batch
 * success is an accepted outcome, but it is never hidden.
 *
 * @param <T> type of the success value
 */
public final class ArchiveOutcome<T> {
    private final T value;
    private final ArchiveFailureKind failureKind;
    private final String message;
    private final Throwable cause;
    private final List<FileRecord> committedBeforeFailure;

    private ArchiveOutcome(T value, ArchiveFailureKind failureKind, String message, Throwable cause, List<FileRecord> committedBeforeFailure) {
        this.value = value;
        this.failureKind = failureKind;
        this.message = message;
        this.cause = cause;
        this.committedBeforeFailure = committedBeforeFailure;
    }

    public static <T> ArchiveOutcome<T> success(T value, String message) {
        return new ArchiveOutcome<>(Objects.requireNonNull(value), null, message, null, List.of());
    }

    public static <T> ArchiveOutcome<T> failure(ArchiveFailureKind kind, String message, Throwable cause) {
        return failure(kind, message, cause, List.of());
    }

    public static <T> ArchiveOutcome<T> failure(ArchiveFailureKind kind, String message, Throwable cause, List<FileRecord> committedBeforeFailure) {
        return new ArchiveOutcome<>(null, Objects.requireNonNull(kind), message, cause,
                Collections.unmodifiableList(List.copyOf(committedBeforeFailure)));
    }

    public static <T> ArchiveOutcome<T> failure(ArchiveException exception) {
        return failure(exception.getKind(), exception.getMessage(), exception.getCause());
    }

    public boolean isSuccess() {
        return failureKind == null;
    }

    /**
     * @return the success value
     * @throws IllegalStateException if this outcome is a failure
     */
    public T getValue() {
        if (!isSuccess()) {
            throw new IllegalStateException("Archive request failed (" + failureKind + "): " + message);
        }
        return value;
    }

    /**
     * @return the failure kind
     * @throws IllegalStateException if this outcome is a success
     */
    public ArchiveFailureKind getFailureKind() {
        if (isSuccess()) {
            throw new IllegalStateException("Archive request succeeded, no failure kind available");
        }
        return failureKind;
    }

    public String getMessage() {
        return message;
    }

    /**
     * @return the underlying cause of a failure, possibly null
     */
    public Throwable getCause() {
        return cause;
    }

    public List<FileRecord> getCommittedBeforeFailure() {
        return committedBeforeFailure;
    }

    @Override
    public String toString() {
        return "ArchiveOutcome{" +
                (isSuccess() ? "SUCCESS" : failureKind) +
                ", message='" + message + '\'' +
                (committedBeforeFailure.isEmpty() ? "" : ", committedBeforeFailure=" + committedBeforeFailure.size()) +
                '}';
    }
}
