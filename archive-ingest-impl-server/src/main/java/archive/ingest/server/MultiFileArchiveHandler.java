package archive.ingest.server;

import archive.ingest.common.ArchiveConfiguration;
import archive.ingest.common.ArchiveException;
import archive.ingest.common.ArchiveFailureKind;
import archive.ingest.common.ArchiveOutcome;
import archive.ingest.common.FileRecord;
import archive.ingest.common.MultiFileArchiveResult;
import archive.ingest.common.ServiceState;
import archive.ingest.common.StagedFile;
import archive.ingest.common.Volume;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.List;
import java.util.Objects;

/**
 * Archives the body of a request, single file or (nested) multipart container, into one volume of this host.
 * <p>
 * Steps: volume selection, staging (under the disk lock of the volume's slot), persistence of the container
 * tree, commit of the files, volume completion check, subscriber notification.
 */
public class MultiFileArchiveHandler extends AbstractArchiveHandler {
    private static final Logger logger = LoggerFactory.getLogger(MultiFileArchiveHandler.class);

    private final VolumeSelector volumeSelector;
    private final StagingWriter stagingWriter;
    private final ContainerHierarchyManager containers;
    private final MetadataCommitter committer;

    public MultiFileArchiveHandler(ArchiveConfiguration configuration, ArchiveCatalogBackend catalog, String hostId,
                                   SubscriptionNotifier notifier, DiskResourceLocks locks) {
        this(configuration, catalog, hostId, notifier, new FileStoreFreeSpaceProbe(), locks,
                new StorageSetVolumeSelector(configuration.getStorageSetSlots()), Clock.systemUTC());
    }

    public MultiFileArchiveHandler(ArchiveConfiguration configuration, ArchiveCatalogBackend catalog, String hostId,
                                   SubscriptionNotifier notifier, FreeSpaceProbe freeSpaceProbe, DiskResourceLocks locks,
                                   VolumeSelector volumeSelector, Clock clock) {
        super(configuration, catalog, hostId, notifier, freeSpaceProbe, locks, clock);
        this.volumeSelector = Objects.requireNonNull(volumeSelector);
        this.stagingWriter = new StagingWriter(configuration.getBlockSize(), configuration.getChecksumAlgorithm(), locks);
        this.containers = new ContainerHierarchyManager(catalog, clock);
        this.committer = new MetadataCommitter(catalog, hostId, containers, new DatePartitionedPathScheme(),
                configuration.getChecksumAlgorithm(), clock);
    }

    /**
     * Archives a request.
     *
     * @param request the request
     * @param state   current state of the service
     * @return the committed files with their container tree, or the failure
     */
    public ArchiveOutcome<MultiFileArchiveResult> archiveMultiFile(ArchiveRequest request, ServiceState state) {
        logger.info("Archive request for {} (mime type {})", request.getSafeFileUri(), request.getMimeType());
        List<FileRecord> records = List.of();
        try {
            Volume volume = selectVolume(state, volumeSelector);
            StagingResult staging = stage(request, volume);
            persistContainers(staging);
            records = committer.commit(request, staging, volume);

            volume = refresh(volume);
            checkVolumeCompletion(volume);
            notifySubscribers(records);

            String message = "Successfully archived " + records.size() + " file(s) from " + request.getSafeFileUri();
            logger.info("{} into volume {} ({} bytes/s)", message, volume.getVolumeId(), Math.round(staging.getIngestRate()));
            return ArchiveOutcome.success(new MultiFileArchiveResult(records, staging.getRootContainer(), volume, staging.getIngestRate()), message);
        } catch (CommitException e) {
            logger.warn("Archiving {} failed ({}) after {} committed file(s): {}",
                    request.getSafeFileUri(), e.getKind(), e.getCommittedFiles().size(), e.getMessage());
            return ArchiveOutcome.failure(e.getKind(), e.getMessage(), e.getCause(), e.getCommittedFiles());
        } catch (ArchiveException e) {
            logger.warn("Archiving {} failed ({}): {}", request.getSafeFileUri(), e.getKind(), e.getMessage());
            return ArchiveOutcome.failure(e.getKind(), e.getMessage(), e.getCause(), records);
        } catch (CatalogException e) {
            // only reachable after all files were committed
            logger.error("Catalog update failed after archiving {}", request.getSafeFileUri(), e);
            return ArchiveOutcome.failure(ArchiveFailureKind.CATALOG_FAILURE, e.getMessage(), e, records);
        }
    }

    private StagingResult stage(ArchiveRequest request, Volume volume) throws ArchiveException {
        Path stagingDirectory = Paths.get(volume.getMountPoint()).resolve(configuration.getStagingDirectoryName());
        try {
            return stagingWriter.write(request, stagingDirectory, volume.getSlotId());
        } catch (IOException e) {
            throw new ArchiveException(kindOf(e), "Failed to stage " + request.getSafeFileUri() + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ArchiveException(ArchiveFailureKind.IO_FAILURE, "Interrupted while staging " + request.getSafeFileUri(), e);
        }
    }

    private void persistContainers(StagingResult staging) throws ArchiveException {
        try {
            containers.createContainers(staging.getRootContainer(), null);
        } catch (CatalogException e) {
            for (StagedFile file : staging.getStagedFiles()) {
                try {
                    Files.deleteIfExists(file.getStagingPath());
                } catch (IOException deleteError) {
                    e.addSuppressed(deleteError);
                }
            }
            logger.error("Failed to persist container tree of {}", staging.getRootContainer(), e);
            throw new ArchiveException(ArchiveFailureKind.CATALOG_FAILURE, "Failed to create containers: " + e.getMessage(), e);
        }
    }
}
