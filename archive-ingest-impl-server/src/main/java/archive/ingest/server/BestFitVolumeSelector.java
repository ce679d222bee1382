package archive.ingest.server;

import archive.ingest.common.Volume;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Volume selection for mirror ingestion: among the non-completed volumes, the one with the most available space.
 * Ties keep the catalog order.
 */
public class BestFitVolumeSelector implements VolumeSelector {

    @Override
    public Optional<Volume> select(List<Volume> volumes) {
        // Stream.sorted is stable for ordered streams
        return volumes.stream()
                .filter(v -> !v.isCompleted())
                .sorted(Comparator.comparingLong(Volume::getAvailableSpace).reversed())
                .findFirst();
    }
}
