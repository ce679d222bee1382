package archive.ingest.server;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Estimates how many bytes the body of an archive request will have, to bound how much is read from it.
 */
public final class SizeEstimator {
    private static final Logger logger = LoggerFactory.getLogger(SizeEstimator.class);

    /**
     * Size assumed when the real size cannot be known in advance; reading then stops at the end of the stream.
     */
    public static final long UNKNOWN_SIZE = 100_000_000_000L;

    public static final String CONTENT_LENGTH = "Content-Length";

    /**
     * <ol>
     *     <li>HTTP pull: the {@code Content-Length} reported by the remote server, if any;</li>
     *     <li>any other pull: unknown;</li>
     *     <li>push: the length declared by the client, if any.</li>
     * </ol>
     *
     * @param request the archive request
     * @return the estimated size, or {@link #UNKNOWN_SIZE}
     */
    public static long estimate(ArchiveRequest request) {
        if (request.isHttpPull()) {
            return request.getSource().getHeader(CONTENT_LENGTH)
                    .map(SizeEstimator::parseLength)
                    .orElse(UNKNOWN_SIZE);
        }
        if (request.isArchivePull()) {
            return UNKNOWN_SIZE;
        }
        return request.getSource().getDeclaredLength().orElse(UNKNOWN_SIZE);
    }

    private static long parseLength(String value) {
        try {
            long length = Long.parseLong(value.trim());
            return length >= 0 ? length : UNKNOWN_SIZE;
        } catch (NumberFormatException e) {
            logger.warn("Ignoring invalid {} header: {}", CONTENT_LENGTH, value);
            return UNKNOWN_SIZE;
        }
    }

    private SizeEstimator() {
    }
}
