package archive.ingest.jetty;

import org.eclipse.jetty.client.HttpClient;
import org.eclipse.jetty.client.api.Request;
import org.eclipse.jetty.client.api.Response;
import org.eclipse.jetty.client.util.InputStreamResponseListener;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.net.URI;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

class JettyResponses {

    /**
     * A response whose status and headers are known, while its content is still streaming in.
     */
    static final class StreamedResponse {
        final Response response;
        final InputStream content;

        private StreamedResponse(Response response, InputStream content) {
            this.response = response;
            this.content = content;
        }
    }

    /**
     * Sends the request and waits for the response headers.
     */
    static StreamedResponse send(HttpClient client, URI uri, long responseTimeoutMillis,
                                 Consumer<Request> customizer) throws IOException {
        InputStreamResponseListener listener = new InputStreamResponseListener();
        Request request = client.newRequest(uri);
        customizer.accept(request);
        request.send(listener);
        try {
            Response response = listener.get(responseTimeoutMillis, TimeUnit.MILLISECONDS);
            return new StreamedResponse(response, listener.getInputStream());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            request.abort(e);
            InterruptedIOException interrupted = new InterruptedIOException("Interrupted while waiting for response from " + uri);
            interrupted.initCause(e);
            throw interrupted;
        } catch (TimeoutException e) {
            request.abort(e);
            throw new IOException("Timed out waiting for response from " + uri, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new IOException("Request to " + uri + " failed: " + cause.getMessage(), cause);
        }
    }

    private JettyResponses() {
    }
}
