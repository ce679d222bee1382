package archive.ingest.jetty;

import archive.ingest.common.FetchMethod;
import archive.ingest.server.FetchStrategy;
import archive.ingest.server.WholeFileFetchStrategy;
import org.eclipse.jetty.client.HttpClient;

public final class FetchStrategies {

    /**
     * @param method configured fetch method
     * @param client started Jetty client, used for {@link FetchMethod#HTTP}
     * @return the strategy implementing the method
     */
    public static FetchStrategy forMethod(FetchMethod method, HttpClient client) {
        switch (method) {
            case HTTP:
                return new JettyHttpFetchStrategy(client);
            case WHOLE_FILE:
                return new WholeFileFetchStrategy();
            default:
                throw new IllegalArgumentException("Unsupported fetch method: " + method);
        }
    }

    private FetchStrategies() {
    }
}
