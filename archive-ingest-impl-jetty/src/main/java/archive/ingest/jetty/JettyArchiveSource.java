package archive.ingest.jetty;

import archive.ingest.server.ArchiveSource;
import org.eclipse.jetty.client.HttpClient;
import org.eclipse.jetty.client.api.Response;
import org.eclipse.jetty.http.HttpStatus;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Pulls the data of an {@code http://} archive request with a Jetty {@link HttpClient}.
 * The response headers, in particular {@code Content-Length}, are available once the stream is open.
 */
public class JettyArchiveSource implements ArchiveSource {
    private final HttpClient client;
    private final URI uri;
    private final long responseTimeoutMillis;
    private Response response;
    private InputStream content;

    public JettyArchiveSource(HttpClient client, URI uri) {
        this(client, uri, JettyHttpFetchStrategy.DEFAULT_RESPONSE_TIMEOUT_MILLIS);
    }

    public JettyArchiveSource(HttpClient client, URI uri, long responseTimeoutMillis) {
        this.client = Objects.requireNonNull(client);
        this.uri = Objects.requireNonNull(uri);
        this.responseTimeoutMillis = responseTimeoutMillis;
    }

    @Override
    public synchronized InputStream openStream() throws IOException {
        if (response != null) {
            throw new IOException("Source " + uri + " was already opened");
        }
        JettyResponses.StreamedResponse streamed = JettyResponses.send(client, uri, responseTimeoutMillis, request -> {
        });
        if (streamed.response.getStatus() != HttpStatus.OK_200) {
            streamed.content.close();
            throw new IOException("Unexpected HTTP status " + streamed.response.getStatus() + " from " + uri);
        }
        response = streamed.response;
        content = streamed.content;
        return content;
    }

    @Override
    public OptionalLong getDeclaredLength() {
        return OptionalLong.empty();
    }

    @Override
    public synchronized Optional<String> getHeader(String name) {
        if (response == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(response.getHeaders().get(name));
    }

    @Override
    public synchronized void close() throws IOException {
        if (content != null) {
            content.close();
        }
    }
}
