package archive.ingest.server;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * An archive request for the staged (single- or multi-file) ingestion pipeline.
 * <p>
 * The file URI either names a remote location to pull from (it has a scheme, e.g. {@code http://...} or
 * {@code file:/...}), or is the plain name of a file pushed in the request body.
 * <p>
 * Instances track the I/O time and number of bytes received during the request; they are confined to the
 * execution context handling the request.
 */
public class ArchiveRequest {
    private static final Pattern SCHEME = Pattern.compile("^[a-zA-Z][a-zA-Z0-9+.-]*:.*");
    private static final Pattern FILE_ID_PARAMETER = Pattern.compile("[?&]file_id=([^&]*)");
    private static final Pattern FILE_VERSION_PARAMETER = Pattern.compile("[?&]file_version=([^&]*)");

    private final String fileUri;
    private final String mimeType;
    private final ArchiveSource source;
    private String fileId;
    private Integer fileVersion;

    private long ioTimeMillis;
    private long bytesReceived;

    public ArchiveRequest(String fileUri, String mimeType, ArchiveSource source) {
        this.fileUri = Objects.requireNonNull(fileUri, "File URI must not be null");
        if (fileUri.isEmpty()) {
            throw new IllegalArgumentException("File URI must not be empty");
        }
        this.mimeType = mimeType;
        this.source = Objects.requireNonNull(source, "Source must not be null");
    }

    /**
     * Creates a request, taking the caller-declared file ID and version from the {@code file_id} and
     * {@code file_version} query parameters of the URI, where present.
     *
     * @param fileUri  file URI
     * @param mimeType MIME type, or null to determine it from the URI
     * @param source   request body
     * @return the request
     * @throws IllegalArgumentException if {@code file_version} is present but not a positive integer
     */
    public static ArchiveRequest fromUri(String fileUri, String mimeType, ArchiveSource source) {
        ArchiveRequest request = new ArchiveRequest(fileUri, mimeType, source);
        Matcher fileIdMatcher = FILE_ID_PARAMETER.matcher(fileUri);
        if (fileIdMatcher.find() && !fileIdMatcher.group(1).isEmpty()) {
            request.setFileId(URLDecoder.decode(fileIdMatcher.group(1), StandardCharsets.UTF_8));
        }
        Matcher fileVersionMatcher = FILE_VERSION_PARAMETER.matcher(fileUri);
        if (fileVersionMatcher.find()) {
            try {
                request.setFileVersion(Integer.parseInt(fileVersionMatcher.group(1)));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid file_version in URI: " + fileUri, e);
            }
        }
        return request;
    }

    public String getFileUri() {
        return fileUri;
    }

    /**
     * @return whether the data is pulled from a URI rather than pushed in the request body
     */
    public boolean isArchivePull() {
        return SCHEME.matcher(fileUri).matches();
    }

    public boolean isHttpPull() {
        return fileUri.startsWith("http://");
    }

    /**
     * @return the last path element of the file URI, ignoring any query string
     */
    public String getBaseName() {
        String path = fileUri;
        int query = path.indexOf('?');
        if (query >= 0) {
            path = path.substring(0, query);
        }
        while (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        String baseName = path.substring(path.lastIndexOf('/') + 1);
        int colon = baseName.lastIndexOf(':');
        return colon >= 0 ? baseName.substring(colon + 1) : baseName;
    }

    /**
     * @return the file URI without user information, for logging
     */
    public String getSafeFileUri() {
        return fileUri.replaceFirst("//[^/@]*@", "//***@");
    }

    /**
     * @return the MIME type, possibly null if the client did not declare one
     */
    public String getMimeType() {
        return mimeType;
    }

    public ArchiveSource getSource() {
        return source;
    }

    /**
     * @return the caller-declared file ID, or null
     */
    public String getFileId() {
        return fileId;
    }

    public void setFileId(String fileId) {
        this.fileId = fileId;
    }

    /**
     * @return the caller-declared file version, or null
     */
    public Integer getFileVersion() {
        return fileVersion;
    }

    public void setFileVersion(Integer fileVersion) {
        if (fileVersion != null && fileVersion < 1) {
            throw new IllegalArgumentException("File version must be positive: " + fileVersion);
        }
        this.fileVersion = fileVersion;
    }

    public long getIoTimeMillis() {
        return ioTimeMillis;
    }

    public void addIoTime(long millis) {
        this.ioTimeMillis += millis;
    }

    public long getBytesReceived() {
        return bytesReceived;
    }

    public void setBytesReceived(long bytesReceived) {
        this.bytesReceived = bytesReceived;
    }

    @Override
    public String toString() {
        return "ArchiveRequest{" +
                "fileUri='" + getSafeFileUri() + '\'' +
                ", mimeType='" + mimeType + '\'' +
                ", fileId='" + fileId + '\'' +
                ", fileVersion=" + fileVersion +
                '}';
    }
}
