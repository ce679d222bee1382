package archive.ingest.server;

import archive.ingest.common.Volume;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Volume selection for staged archive requests: deterministic, following the configured order of slots
 * (the storage set). Slots not mentioned in the configuration come after the configured ones, in natural
 * slot ID order. The first volume that is not completed and still has space is chosen.
 */
public class StorageSetVolumeSelector implements VolumeSelector {
    private final List<String> slotOrder;

    public StorageSetVolumeSelector(List<String> slotOrder) {
        this.slotOrder = List.copyOf(Objects.requireNonNull(slotOrder));
    }

    @Override
    public Optional<Volume> select(List<Volume> volumes) {
        List<Volume> candidates = new ArrayList<>(volumes);
        candidates.sort(Comparator.comparingInt(this::rankOf).thenComparing(Volume::getSlotId));
        return candidates.stream()
                .filter(v -> !v.isCompleted() && v.getAvailableSpace() > 0)
                .findFirst();
    }

    private int rankOf(Volume volume) {
        int index = slotOrder.indexOf(volume.getSlotId());
        return index >= 0 ? index : slotOrder.size();
    }
}
