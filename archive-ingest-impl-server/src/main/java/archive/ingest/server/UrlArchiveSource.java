package archive.ingest.server;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URLConnection;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Pulls the data of an archive request from a URI, using the URL machinery of the JDK.
 * Headers (for instance {@code Content-Length} for {@code http://} URIs) are available once the stream is open.
 */
public class UrlArchiveSource implements ArchiveSource {
    private final URI uri;
    private URLConnection connection;
    private InputStream stream;

    public UrlArchiveSource(URI uri) {
        this.uri = Objects.requireNonNull(uri);
    }

    @Override
    public synchronized InputStream openStream() throws IOException {
        if (connection != null) {
            throw new IOException("Source " + uri + " was already opened");
        }
        connection = uri.toURL().openConnection();
        stream = connection.getInputStream();
        return stream;
    }

    @Override
    public OptionalLong getDeclaredLength() {
        return OptionalLong.empty();
    }

    @Override
    public synchronized Optional<String> getHeader(String name) {
        if (connection == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(connection.getHeaderField(name));
    }

    @Override
    public synchronized void close() throws IOException {
        if (stream != null) {
            stream.close();
        }
    }
}
