package archive.ingest.server;

import java.util.List;
import java.util.Map;

/**
 * Hands newly archived files over to subscription delivery. Fire-and-forget from the ingestion core's
 * perspective: delivery problems are the notifier's concern.
 */
public interface SubscriptionNotifier {

    /**
     * Registers newly committed files for delivery to subscribers.
     *
     * @param fileVersions (fileId, fileVersion) pairs
     */
    void addSubscriptionInfo(List<Map.Entry<String, Integer>> fileVersions);

    /**
     * Triggers delivery of everything registered so far.
     */
    void triggerSubscriptionThread();
}
