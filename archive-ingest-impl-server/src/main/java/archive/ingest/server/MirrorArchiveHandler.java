package archive.ingest.server;

import archive.ingest.common.ArchiveConfiguration;
import archive.ingest.common.ArchiveException;
import archive.ingest.common.ArchiveFailureKind;
import archive.ingest.common.ArchiveOutcome;
import archive.ingest.common.FileRecord;
import archive.ingest.common.ServiceState;
import archive.ingest.common.TransferState;
import archive.ingest.common.Volume;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Replicates one file version of another archive instance into the volume of this host with the most free space.
 * <p>
 * Interrupted transfers are resumable: the partial staging file is kept, and the next attempt continues at its
 * current size. Permanent transfer failures remove the partial file; a full disk additionally flags the volume as
 * completed, so the next attempt goes to another volume. Once the file is completely fetched, the staging file
 * is kept whatever fails afterwards.
 */
public class MirrorArchiveHandler extends AbstractArchiveHandler {
    private static final Logger logger = LoggerFactory.getLogger(MirrorArchiveHandler.class);

    private final VolumeSelector volumeSelector;
    private final ResumableFetch fetch;
    private final DatePartitionedPathScheme pathScheme = new DatePartitionedPathScheme();

    public MirrorArchiveHandler(ArchiveConfiguration configuration, ArchiveCatalogBackend catalog, String hostId,
                                SubscriptionNotifier notifier, DiskResourceLocks locks, FetchStrategy fetchStrategy) {
        this(configuration, catalog, hostId, notifier, new FileStoreFreeSpaceProbe(), locks, fetchStrategy,
                new BestFitVolumeSelector(), Clock.systemUTC());
    }

    public MirrorArchiveHandler(ArchiveConfiguration configuration, ArchiveCatalogBackend catalog, String hostId,
                                SubscriptionNotifier notifier, FreeSpaceProbe freeSpaceProbe, DiskResourceLocks locks,
                                FetchStrategy fetchStrategy, VolumeSelector volumeSelector, Clock clock) {
        super(configuration, catalog, hostId, notifier, freeSpaceProbe, locks, clock);
        this.volumeSelector = Objects.requireNonNull(volumeSelector);
        this.fetch = new ResumableFetch(fetchStrategy, configuration.getBlockSize(), configuration.getChecksumAlgorithm());
    }

    /**
     * Archives a mirror request, resuming at the current size of its staging file.
     */
    public ArchiveOutcome<FileRecord> archiveMirror(MirrorRequest request, ServiceState state) {
        return archiveMirror(request, state, TransferState.of(request.getStagingFile()).getOffset());
    }

    /**
     * Archives a mirror request.
     *
     * @param request   the request
     * @param state     current state of the service
     * @param startByte current size of the staging file
     * @return the record of the mirrored file, or the failure
     * @throws IllegalArgumentException if {@code startByte} is not the current size of the staging file
     */
    public ArchiveOutcome<FileRecord> archiveMirror(MirrorRequest request, ServiceState state, long startByte) {
        logger.info("Mirror archive request for {} version {} from {}, start byte {}",
                request.getFileId(), request.getFileVersion(), request.getSourceUri(), startByte);
        TransferState transfer = TransferState.of(request.getStagingFile());
        if (transfer.getOffset() != startByte) {
            throw new IllegalArgumentException("Start byte " + startByte + " does not match size " + transfer.getOffset()
                    + " of staging file " + request.getStagingFile());
        }
        Volume volume = null;
        FileRecord record = null;
        boolean fetched = false;
        try {
            volume = selectVolume(state, volumeSelector);
            FetchResult result = fetchUnderLock(request, volume, startByte);
            fetched = true;
            transfer.advanceTo(result.getFileSize());
            transfer.complete(result.getChecksum());
            request.addIoTime(result.getIoTimeMillis());

            record = commit(request, transfer, volume);
            volume = refresh(volume);
            checkVolumeCompletion(volume);
            notifySubscribers(List.of(record));
            return ArchiveOutcome.success(record, "Successfully mirrored " + request.getFileId() + " version " + request.getFileVersion());
        } catch (ArchiveException e) {
            handleFailure(e, request, volume, fetched);
            return ArchiveOutcome.failure(e);
        } catch (CatalogException e) {
            // only reachable after the file was committed
            logger.error("Catalog update failed after mirroring {}", request.getFileId(), e);
            return ArchiveOutcome.failure(ArchiveFailureKind.CATALOG_FAILURE, e.getMessage(), e, record != null ? List.of(record) : List.of());
        }
    }

    private FetchResult fetchUnderLock(MirrorRequest request, Volume volume, long startByte) throws ArchiveException {
        try (DiskResourceLocks.DiskResourceLock ignored = locks.acquire(volume.getSlotId())) {
            return fetch.fetch(request.getSourceUri(), request.getStagingFile(), startByte);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            // nothing was transferred in this attempt
            ArchiveFailureKind kind = startByte > 0 ? ArchiveFailureKind.RESUMABLE : ArchiveFailureKind.IO_FAILURE;
            throw new ArchiveException(kind, "Interrupted while waiting for disk access to volume " + volume.getVolumeId(), e);
        }
    }

    private FileRecord commit(MirrorRequest request, TransferState transfer, Volume volume) throws ArchiveException {
        Instant ingestionDate = clock.instant();
        String relativePath = pathScheme.relativePath(ingestionDate, request.getFileVersion(), baseNameOf(request.getFileId()));
        Path target = Paths.get(volume.getMountPoint()).resolve(relativePath);
        long start = System.currentTimeMillis();
        try {
            MetadataCommitter.moveFile(transfer.getStagingFile().toPath(), target);
        } catch (IOException e) {
            ArchiveFailureKind kind = MetadataCommitter.moveFailureKind(e);
            if (kind == ArchiveFailureKind.CATALOG_FAILURE) {
                logger.error("Mirrored file {} version {} is already archived at {}", request.getFileId(), request.getFileVersion(), target);
                throw new ArchiveException(kind, "File " + request.getFileId() + " version " + request.getFileVersion()
                        + " is already archived at " + target, e);
            }
            throw new ArchiveException(kind, "Failed to move " + transfer.getStagingFile() + " to " + target + ": " + e, e);
        }
        request.addIoTime(System.currentTimeMillis() - start);

        String format = request.getFormat() != null ? request.getFormat() : MimeTypes.guess(request.getFileId());
        FileRecord record = MetadataCommitter.newRecord(volume.getVolumeId(), relativePath, request.getFileId(),
                request.getFileVersion(), format, transfer.getOffset(), transfer.getChecksum(),
                configuration.getChecksumAlgorithm(), ingestionDate, request.getIoTimeMillis());
        try {
            catalog.insertFileRecord(hostId, record);
            catalog.recordFileStored(volume.getVolumeId(), record.getFileSize());
        } catch (CatalogException e) {
            logger.error("Catalog update failed for mirrored file {} version {}: data is stored at {}, but its metadata is incomplete",
                    request.getFileId(), request.getFileVersion(), target, e);
            throw new ArchiveException(ArchiveFailureKind.CATALOG_FAILURE, "Catalog update failed for file " + request.getFileId()
                    + " version " + request.getFileVersion() + " stored at " + target + ": " + e.getMessage(), e);
        }
        logger.info("Mirrored file {} version {} to volume {} ({} bytes)",
                request.getFileId(), request.getFileVersion(), volume.getVolumeId(), record.getFileSize());
        return record;
    }

    /**
     * @param fetched whether the complete file was fetched; a complete staging file is never deleted
     */
    private void handleFailure(ArchiveException e, MirrorRequest request, Volume volume, boolean fetched) {
        File stagingFile = request.getStagingFile();
        if (fetched && stagingFile.isFile()) {
            logger.warn("Mirroring {} failed after the transfer ({}), keeping {} bytes in {}: {}",
                    request.getFileId(), e.getKind(), stagingFile.length(), stagingFile, e.getMessage());
            if (e.getKind() == ArchiveFailureKind.DISK_EXHAUSTED && volume != null) {
                markCompletedQuietly(volume);
            }
            return;
        }
        switch (e.getKind()) {
            case RESUMABLE:
                logger.warn("Mirroring {} interrupted, keeping {} bytes in {} for resumption: {}",
                        request.getFileId(), stagingFile.length(), stagingFile, e.getMessage());
                break;
            case IO_FAILURE:
                logger.warn("Mirroring {} failed permanently: {}", request.getFileId(), e.getMessage());
                deleteStagingFile(stagingFile);
                break;
            case DISK_EXHAUSTED:
                logger.warn("Mirroring {} failed, volume {} is out of space: {}", request.getFileId(),
                        volume != null ? volume.getVolumeId() : null, e.getMessage());
                deleteStagingFile(stagingFile);
                if (volume != null) {
                    markCompletedQuietly(volume);
                }
                break;
            default:
                logger.warn("Mirroring {} failed ({}): {}", request.getFileId(), e.getKind(), e.getMessage());
        }
    }

    private void markCompletedQuietly(Volume volume) {
        try {
            markCompleted(volume);
        } catch (CatalogException catalogError) {
            logger.error("Failed to mark volume {} as completed", volume.getVolumeId(), catalogError);
        }
    }

    private static void deleteStagingFile(File stagingFile) {
        try {
            Files.deleteIfExists(stagingFile.toPath());
        } catch (IOException e) {
            logger.warn("Failed to delete staging file {}", stagingFile, e);
        }
    }

    private static String baseNameOf(String fileId) {
        String baseName = fileId.substring(fileId.lastIndexOf('/') + 1);
        return baseName.isEmpty() ? fileId.replace('/', '_') : baseName;
    }
}
