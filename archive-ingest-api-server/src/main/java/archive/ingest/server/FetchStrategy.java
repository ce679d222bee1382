package archive.ingest.server;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;

/**
 * Method to pull a remote file for mirror ingestion, starting at a given byte offset.
 * <p>
 * Whatever the underlying protocol, the returned stream MUST start exactly at {@code offset}: a strategy
 * that cannot request partial content from the remote side has to skip the leading bytes itself.
 */
public interface FetchStrategy {

    /**
     * @param source remote file
     * @param offset number of leading bytes to omit
     * @return a stream delivering the remote content from {@code offset} to the end
     * @throws IOException if the remote file cannot be opened or positioned
     */
    InputStream openFrom(URI source, long offset) throws IOException;
}
