package archive.ingest.common;

/**
 * Lifecycle status of a stored file version. {@code OK} is the only terminal success state produced by ingestion.
 */
public enum FileStatus {
    OK("00000000");

    private final String code;

    FileStatus(String code) {
        this.code = code;
    }

    /**
     * @return the status code as stored in the catalog
     */
    public String getCode() {
        return code;
    }
}
