package archive.ingest.server;

import archive.ingest.common.ArchiveFailureKind;

/**
 * Classifies a failed fetch attempt.
 * <ul>
 *     <li>the local disk is full: {@link ArchiveFailureKind#DISK_EXHAUSTED};</li>
 *     <li>any other error after data was received, in this or an earlier attempt: {@link ArchiveFailureKind#RESUMABLE};</li>
 *     <li>any other error before a single byte was received: {@link ArchiveFailureKind#IO_FAILURE}.</li>
 * </ul>
 */
public final class FetchFailureClassifier {

    public static ArchiveFailureKind classify(Throwable error, long startByte, long bytesReceived) {
        if (DiskSpaceErrors.isOutOfSpace(error)) {
            return ArchiveFailureKind.DISK_EXHAUSTED;
        }
        if (startByte > 0 || bytesReceived > 0) {
            return ArchiveFailureKind.RESUMABLE;
        }
        return ArchiveFailureKind.IO_FAILURE;
    }

    private FetchFailureClassifier() {
    }
}
