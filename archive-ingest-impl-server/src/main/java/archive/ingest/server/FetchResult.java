package archive.ingest.server;

/**
 * Result of a completed (possibly resumed) fetch of a remote file.
 */
public class FetchResult {
    private final long ioTimeMillis;
    private final String checksum;
    private final long bytesReceived;
    private final long fileSize;

    public FetchResult(long ioTimeMillis, String checksum, long bytesReceived, long fileSize) {
        this.ioTimeMillis = ioTimeMillis;
        this.checksum = checksum;
        this.bytesReceived = bytesReceived;
        this.fileSize = fileSize;
    }

    public long getIoTimeMillis() {
        return ioTimeMillis;
    }

    /**
     * @return checksum over the complete file, including bytes fetched by earlier attempts
     */
    public String getChecksum() {
        return checksum;
    }

    /**
     * @return number of bytes received in this attempt
     */
    public long getBytesReceived() {
        return bytesReceived;
    }

    public long getFileSize() {
        return fileSize;
    }

    @Override
    public String toString() {
        return "FetchResult{" +
                "ioTimeMillis=" + ioTimeMillis +
                ", checksum='" + checksum + '\'' +
                ", bytesReceived=" + bytesReceived +
                ", fileSize=" + fileSize +
                '}';
    }
}
