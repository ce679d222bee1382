package archive.ingest.common;

import java.time.Instant;

/**
 * The durable catalog entry for one stored file version.
 * <p>
 * {@code (fileId, fileVersion)} is unique within the catalog. Records are append-only: once inserted,
 * the ingestion core never modifies them.
 */
public class FileRecord {

    /**
     * Compression tag for payloads stored verbatim.
     */
    public static final String NO_COMPRESSION = "NONE";

    private String volumeId;
    private String relativePath;
    private String fileId;
    private int fileVersion;
    private String format;
    private long fileSize;
    private long uncompressedFileSize;
    private String compression = NO_COMPRESSION;
    private String checksum;
    private String checksumAlgorithm;
    private FileStatus status;
    private Instant creationDate;
    private Instant ingestionDate;
    private long ioTimeMillis;

    public FileRecord() {
    }

    public String getVolumeId() {
        return volumeId;
    }

    public void setVolumeId(String volumeId) {
        this.volumeId = volumeId;
    }

    /**
     * @return path of the file relative to the mount point of its volume
     */
    public String getRelativePath() {
        return relativePath;
    }

    public void setRelativePath(String relativePath) {
        this.relativePath = relativePath;
    }

    public String getFileId() {
        return fileId;
    }

    public void setFileId(String fileId) {
        this.fileId = fileId;
    }

    public int getFileVersion() {
        return fileVersion;
    }

    public void setFileVersion(int fileVersion) {
        this.fileVersion = fileVersion;
    }

    /**
     * @return the MIME type of the file
     */
    public String getFormat() {
        return format;
    }

    public void setFormat(String format) {
        this.format = format;
    }

    public long getFileSize() {
        return fileSize;
    }

    public void setFileSize(long fileSize) {
        this.fileSize = fileSize;
    }

    public long getUncompressedFileSize() {
        return uncompressedFileSize;
    }

    public void setUncompressedFileSize(long uncompressedFileSize) {
        this.uncompressedFileSize = uncompressedFileSize;
    }

    public String getCompression() {
        return compression;
    }

    public void setCompression(String compression) {
        this.compression = compression;
    }

    public String getChecksum() {
        return checksum;
    }

    public void setChecksum(String checksum) {
        this.checksum = checksum;
    }

    public String getChecksumAlgorithm() {
        return checksumAlgorithm;
    }

    public void setChecksumAlgorithm(String checksumAlgorithm) {
        this.checksumAlgorithm = checksumAlgorithm;
    }

    public FileStatus getStatus() {
        return status;
    }

    public void setStatus(FileStatus status) {
        this.status = status;
    }

    public Instant getCreationDate() {
        return creationDate;
    }

    public void setCreationDate(Instant creationDate) {
        this.creationDate = creationDate;
    }

    public Instant getIngestionDate() {
        return ingestionDate;
    }

    public void setIngestionDate(Instant ingestionDate) {
        this.ingestionDate = ingestionDate;
    }

    /**
     * @return accumulated I/O time of the request at the moment the record was written, in milliseconds
     */
    public long getIoTimeMillis() {
        return ioTimeMillis;
    }

    public void setIoTimeMillis(long ioTimeMillis) {
        this.ioTimeMillis = ioTimeMillis;
    }

    @Override
    public String toString() {
        return "FileRecord{" +
                "volumeId='" + volumeId + '\'' +
                ", relativePath='" + relativePath + '\'' +
                ", fileId='" + fileId + '\'' +
                ", fileVersion=" + fileVersion +
                ", format='" + format + '\'' +
                ", fileSize=" + fileSize +
                ", checksum='" + checksum + '\'' +
                ", checksumAlgorithm='" + checksumAlgorithm + '\'' +
                ", status=" + status +
                '}';
    }
}
