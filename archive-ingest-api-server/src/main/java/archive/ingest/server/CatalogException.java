package archive.ingest.server;

/**
 * Signals that a catalog operation was rejected or failed.
 */
public class CatalogException extends RuntimeException {
    public CatalogException(String message) {
        super(message);
    }

    public CatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
