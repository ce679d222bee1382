package archive.ingest.common;

/**
 * Incremental checksum over a byte stream. Bytes are folded in the order they are written;
 * the resulting value only depends on the total byte content, not on how it was chunked.
 * <p>
 * Instances are not thread-safe.
 */
public interface ChecksumAccumulator {

    ChecksumAlgorithm getAlgorithm();

    void update(byte[] buffer, int offset, int length);

    default void update(int b) {
        update(new byte[]{(byte) b}, 0, 1);
    }

    /**
     * @return the number of bytes folded in so far
     */
    long getByteCount();

    /**
     * Returns the checksum of everything folded in so far, in the textual form that is recorded in the catalog.
     * Calling this method does not reset the accumulator.
     *
     * @return checksum value
     */
    String getValue();
}
