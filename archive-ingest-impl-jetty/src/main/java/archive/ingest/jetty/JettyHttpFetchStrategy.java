package archive.ingest.jetty;

import archive.ingest.server.FetchStrategy;
import archive.ingest.util.StreamUtils;
import org.eclipse.jetty.client.HttpClient;
import org.eclipse.jetty.http.HttpHeader;
import org.eclipse.jetty.http.HttpStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.util.Objects;

/**
 * Fetches remote files over HTTP with a Jetty {@link HttpClient}, requesting only the missing tail of the file
 * ({@code Range: bytes=<offset>-}). Servers that ignore the range answer with the complete file; the leading
 * bytes are then skipped locally.
 * <p>
 * The client is managed by the caller and must be started.
 */
public class JettyHttpFetchStrategy implements FetchStrategy {
    private static final Logger logger = LoggerFactory.getLogger(JettyHttpFetchStrategy.class);

    public static final long DEFAULT_RESPONSE_TIMEOUT_MILLIS = 60_000L;

    private final HttpClient client;
    private final long responseTimeoutMillis;

    public JettyHttpFetchStrategy(HttpClient client) {
        this(client, DEFAULT_RESPONSE_TIMEOUT_MILLIS);
    }

    public JettyHttpFetchStrategy(HttpClient client, long responseTimeoutMillis) {
        this.client = Objects.requireNonNull(client);
        if (responseTimeoutMillis <= 0) {
            throw new IllegalArgumentException("Response timeout must be greater than 0");
        }
        this.responseTimeoutMillis = responseTimeoutMillis;
    }

    @Override
    public InputStream openFrom(URI source, long offset) throws IOException {
        JettyResponses.StreamedResponse streamed = JettyResponses.send(client, source, responseTimeoutMillis, request -> {
            if (offset > 0) {
                request.headers(headers -> headers.put(HttpHeader.RANGE, "bytes=" + offset + "-"));
            }
        });
        int status = streamed.response.getStatus();
        InputStream content = streamed.content;
        try {
            if (status == HttpStatus.PARTIAL_CONTENT_206) {
                String contentRange = streamed.response.getHeaders().get(HttpHeader.CONTENT_RANGE);
                if (contentRange == null || !contentRange.trim().startsWith("bytes " + offset + "-")) {
                    throw new IOException("Unexpected Content-Range from " + source + " for offset " + offset + ": " + contentRange);
                }
                logger.debug("Fetching {} from byte {} (partial content)", source, offset);
                return content;
            }
            if (status == HttpStatus.OK_200) {
                if (offset > 0) {
                    logger.debug("{} does not support ranges, skipping {} bytes", source, offset);
                    StreamUtils.skipFully(content, offset);
                }
                return content;
            }
            throw new IOException("Unexpected HTTP status " + status + " from " + source);
        } catch (IOException e) {
            content.close();
            throw e;
        }
    }
}
