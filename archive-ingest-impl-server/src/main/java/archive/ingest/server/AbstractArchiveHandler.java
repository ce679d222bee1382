package archive.ingest.server;

import archive.ingest.common.ArchiveConfiguration;
import archive.ingest.common.ArchiveException;
import archive.ingest.common.ArchiveFailureKind;
import archive.ingest.common.FileRecord;
import archive.ingest.common.ServiceState;
import archive.ingest.common.Volume;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.AbstractMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Steps shared by the ingestion pipelines: admission, volume selection, volume completion, and notification.
 */
public abstract class AbstractArchiveHandler {
    private static final Logger logger = LoggerFactory.getLogger(AbstractArchiveHandler.class);

    protected final ArchiveConfiguration configuration;
    protected final ArchiveCatalogBackend catalog;
    protected final String hostId;
    protected final SubscriptionNotifier notifier;
    protected final FreeSpaceProbe freeSpaceProbe;
    protected final DiskResourceLocks locks;
    protected final Clock clock;

    protected AbstractArchiveHandler(ArchiveConfiguration configuration, ArchiveCatalogBackend catalog, String hostId,
                                     SubscriptionNotifier notifier, FreeSpaceProbe freeSpaceProbe,
                                     DiskResourceLocks locks, Clock clock) {
        this.configuration = Objects.requireNonNull(configuration);
        this.catalog = Objects.requireNonNull(catalog);
        this.hostId = Objects.requireNonNull(hostId);
        this.notifier = Objects.requireNonNull(notifier);
        this.freeSpaceProbe = Objects.requireNonNull(freeSpaceProbe);
        this.locks = Objects.requireNonNull(locks);
        this.clock = Objects.requireNonNull(clock);
    }

    /**
     * Admits the request and selects the target volume. Has no side effects.
     *
     * @throws ArchiveException {@link ArchiveFailureKind#CONFIGURATION_REJECTED} or {@link ArchiveFailureKind#NO_VOLUME_AVAILABLE}
     */
    protected Volume selectVolume(ServiceState state, VolumeSelector selector) throws ArchiveException {
        if (!configuration.isAllowArchiveRequests()) {
            throw new ArchiveException(ArchiveFailureKind.CONFIGURATION_REJECTED, "Archive requests are disabled on host " + hostId);
        }
        if (state == null || !state.isAccepting()) {
            throw new ArchiveException(ArchiveFailureKind.CONFIGURATION_REJECTED, "Archive requests are not accepted in state " + state);
        }
        List<Volume> volumes;
        try {
            volumes = catalog.getVolumes(hostId);
        } catch (CatalogException e) {
            throw new ArchiveException(ArchiveFailureKind.CATALOG_FAILURE, "Failed to list volumes of host " + hostId + ": " + e.getMessage(), e);
        }
        Optional<Volume> volume = selector.select(volumes);
        if (volume.isEmpty()) {
            throw new ArchiveException(ArchiveFailureKind.NO_VOLUME_AVAILABLE, "No volume available for archiving on host " + hostId);
        }
        logger.debug("Selected volume {} (slot {}) on host {}", volume.get().getVolumeId(), volume.get().getSlotId(), hostId);
        return volume.get();
    }

    /**
     * @return the current catalog state of the volume, or the given instance if the catalog does not list it
     */
    protected Volume refresh(Volume volume) {
        return catalog.getVolumes(hostId).stream()
                .filter(v -> v.getVolumeId().equals(volume.getVolumeId()))
                .findFirst()
                .orElse(volume);
    }

    /**
     * Flags the volume as completed if its free space dropped below the configured threshold.
     *
     * @throws CatalogException if the completion cannot be recorded
     */
    protected void checkVolumeCompletion(Volume volume) {
        long available;
        try {
            available = freeSpaceProbe.getAvailableBytes(Paths.get(volume.getMountPoint()));
        } catch (IOException e) {
            logger.warn("Unable to determine free space of volume {} at {}", volume.getVolumeId(), volume.getMountPoint(), e);
            return;
        }
        if (available < configuration.getFreeSpaceDiskChangeBytes()) {
            logger.info("Free space of volume {} ({} bytes) is below {} MB, marking volume as completed",
                    volume.getVolumeId(), available, configuration.getFreeSpaceDiskChangeMb());
            markCompleted(volume);
        }
    }

    protected void markCompleted(Volume volume) {
        volume.setCompleted(true);
        volume.setCompletionDate(clock.instant());
        catalog.updateVolume(volume);
    }

    /**
     * Registers the files for subscription delivery and triggers it. Notification problems are logged only.
     */
    protected void notifySubscribers(List<FileRecord> records) {
        List<Map.Entry<String, Integer>> fileVersions = records.stream()
                .map(r -> new AbstractMap.SimpleImmutableEntry<>(r.getFileId(), r.getFileVersion()))
                .collect(Collectors.toList());
        try {
            notifier.addSubscriptionInfo(fileVersions);
            notifier.triggerSubscriptionThread();
            logger.debug("Triggered subscription delivery for {}", fileVersions);
        } catch (RuntimeException e) {
            logger.warn("Failed to notify subscribers of {}", fileVersions, e);
        }
    }

    protected static ArchiveFailureKind kindOf(IOException e) {
        return DiskSpaceErrors.isOutOfSpace(e) ? ArchiveFailureKind.DISK_EXHAUSTED : ArchiveFailureKind.IO_FAILURE;
    }

    public String getHostId() {
        return hostId;
    }
}
