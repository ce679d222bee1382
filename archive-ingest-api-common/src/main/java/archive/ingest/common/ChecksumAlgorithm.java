package archive.ingest.common;

/**
 * Checksum algorithms supported for incremental computation while data is being written.
 * The tag is what gets recorded next to the checksum in the file record.
 */
public enum ChecksumAlgorithm {
    CRC32("StreamCrc32"),
    MD5("StreamMd5");

    private final String tag;

    ChecksumAlgorithm(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }
}
