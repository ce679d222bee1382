package archive.ingest.common;

/**
 * Method used by mirror ingestion to pull remote files.
 */
public enum FetchMethod {
    /**
     * Byte-range capable HTTP fetch: only the missing tail of a partial file is requested from the remote side.
     */
    HTTP,
    /**
     * Whole-file fetch: the remote file is always streamed from the start, bytes already on disk are skipped locally.
     */
    WHOLE_FILE
}
