package archive.ingest.server;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Readable body of an archive request: either the pushed request body, or the stream obtained by pulling a URI.
 */
public interface ArchiveSource extends Closeable {

    /**
     * Opens the stream. May only be called once.
     *
     * @return the data stream
     * @throws IOException if the stream cannot be opened
     */
    InputStream openStream() throws IOException;

    /**
     * @return the length declared by the sender, if any
     */
    OptionalLong getDeclaredLength();

    /**
     * Looks up a header of the underlying transport (case-insensitive).
     *
     * @param name header name
     * @return the header value, if present
     */
    default Optional<String> getHeader(String name) {
        return Optional.empty();
    }

    @Override
    default void close() throws IOException {
    }
}
