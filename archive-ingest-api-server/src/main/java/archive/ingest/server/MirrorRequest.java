package archive.ingest.server;

import java.io.File;
import java.net.URI;
import java.util.Objects;

/**
 * A mirror archive request: replicates one file version of another archive instance.
 * <p>
 * The file information (ID, version, format) is cloned from the source archive. The staging file is
 * chosen by the caller and kept stable across attempts, so that an interrupted transfer can be resumed.
 */
public class MirrorRequest {
    private final URI sourceUri;
    private final File stagingFile;
    private final String fileId;
    private final int fileVersion;
    private final String format;
    private long ioTimeMillis;

    public MirrorRequest(URI sourceUri, File stagingFile, String fileId, int fileVersion, String format) {
        this.sourceUri = Objects.requireNonNull(sourceUri, "Source URI must not be null");
        this.stagingFile = Objects.requireNonNull(stagingFile, "Staging file must not be null");
        this.fileId = Objects.requireNonNull(fileId, "File ID must not be null");
        if (fileVersion < 1) {
            throw new IllegalArgumentException("File version must be positive: " + fileVersion);
        }
        this.fileVersion = fileVersion;
        this.format = format;
    }

    public URI getSourceUri() {
        return sourceUri;
    }

    public File getStagingFile() {
        return stagingFile;
    }

    public String getFileId() {
        return fileId;
    }

    public int getFileVersion() {
        return fileVersion;
    }

    public String getFormat() {
        return format;
    }

    public long getIoTimeMillis() {
        return ioTimeMillis;
    }

    public void addIoTime(long millis) {
        this.ioTimeMillis += millis;
    }

    @Override
    public String toString() {
        return "MirrorRequest{" +
                "sourceUri=" + sourceUri +
                ", stagingFile=" + stagingFile +
                ", fileId='" + fileId + '\'' +
                ", fileVersion=" + fileVersion +
                '}';
    }
}
