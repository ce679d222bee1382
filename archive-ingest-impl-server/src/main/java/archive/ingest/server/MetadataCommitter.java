package archive.ingest.server;

import archive.ingest.common.ArchiveFailureKind;
import archive.ingest.common.ChecksumAlgorithm;
import archive.ingest.common.FileRecord;
import archive.ingest.common.FileStatus;
import archive.ingest.common.StagedFile;
import archive.ingest.common.Volume;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Moves staged files to their final location and records them in the catalog, one file after the other.
 * <p>
 * A failure stops the commit: files committed before stay committed, staged files not yet moved are deleted,
 * and container sizes are written for what was committed. A catalog failure after a file was moved leaves the
 * file in place without (complete) metadata; this is logged with the path of the file.
 */
public class MetadataCommitter {
    private static final Logger logger = LoggerFactory.getLogger(MetadataCommitter.class);

    private final ArchiveCatalogBackend catalog;
    private final String hostId;
    private final ContainerHierarchyManager containers;
    private final DatePartitionedPathScheme pathScheme;
    private final ChecksumAlgorithm checksumAlgorithm;
    private final Clock clock;

    public MetadataCommitter(ArchiveCatalogBackend catalog, String hostId, ContainerHierarchyManager containers,
                             DatePartitionedPathScheme pathScheme, ChecksumAlgorithm checksumAlgorithm, Clock clock) {
        this.catalog = Objects.requireNonNull(catalog);
        this.hostId = Objects.requireNonNull(hostId);
        this.containers = Objects.requireNonNull(containers);
        this.pathScheme = Objects.requireNonNull(pathScheme);
        this.checksumAlgorithm = Objects.requireNonNull(checksumAlgorithm);
        this.clock = Objects.requireNonNull(clock);
    }

    /**
     * Commits all staged files of a request. The containers of the staging result must already be persisted.
     *
     * @param request the archive request (caller-declared ID, version and MIME type; accumulates I/O time)
     * @param staging the staged files
     * @param volume  the target volume
     * @return the records of the committed files, in staging order
     * @throws CommitException if a file could not be committed
     */
    public List<FileRecord> commit(ArchiveRequest request, StagingResult staging, Volume volume) throws CommitException {
        List<StagedFile> stagedFiles = staging.getStagedFiles();
        boolean singleFile = stagedFiles.size() == 1;
        List<FileRecord> committed = new ArrayList<>();
        Map<Integer, Long> containerSizes = new HashMap<>();
        int next = 0;
        try {
            for (; next < stagedFiles.size(); next++) {
                StagedFile staged = stagedFiles.get(next);
                String fileId = singleFile && request.getFileId() != null ? request.getFileId() : staged.getFileName();
                FileRecord record = commitFile(request, staged, fileId, volume, committed);
                committed.add(record);
                containerSizes.merge(staged.getContainer().getIndex(), staged.getSize(), Long::sum);
            }
        } catch (CommitException e) {
            deleteStagedFiles(stagedFiles.subList(next + 1, stagedFiles.size()));
            writeContainerSizes(staging, containerSizes, e, committed);
            throw e;
        }
        writeContainerSizes(staging, containerSizes, null, committed);
        return committed;
    }

    private FileRecord commitFile(ArchiveRequest request, StagedFile staged, String fileId, Volume volume,
                                  List<FileRecord> committed) throws CommitException {
        int fileVersion;
        try {
            fileVersion = request.getFileVersion() != null ? request.getFileVersion() : catalog.getNextFileVersion(fileId);
        } catch (CatalogException e) {
            deleteStagedFiles(List.of(staged));
            throw new CommitException(ArchiveFailureKind.CATALOG_FAILURE,
                    "Failed to determine version of file " + fileId + ": " + e.getMessage(), e, committed);
        }

        Instant ingestionDate = clock.instant();
        String relativePath = pathScheme.relativePath(ingestionDate, fileVersion, staged.getFileName());
        Path target = Paths.get(volume.getMountPoint()).resolve(relativePath);
        long start = System.currentTimeMillis();
        try {
            moveFile(staged.getStagingPath(), target);
        } catch (IOException e) {
            deleteStagedFiles(List.of(staged));
            ArchiveFailureKind kind = moveFailureKind(e);
            if (kind == ArchiveFailureKind.CATALOG_FAILURE) {
                logger.error("File {} version {} is already archived at {}", fileId, fileVersion, target);
                throw new CommitException(kind, "File " + fileId + " version " + fileVersion + " is already archived at " + target, e, committed);
            }
            throw new CommitException(kind, "Failed to move " + staged.getStagingPath() + " to " + target + ": " + e, e, committed);
        }
        request.addIoTime(System.currentTimeMillis() - start);
        logger.debug("Moved {} to {}", staged.getStagingPath(), target);

        FileRecord record = newRecord(volume.getVolumeId(), relativePath, fileId, fileVersion, formatOf(request, staged),
                staged.getSize(), staged.getChecksum(), checksumAlgorithm, ingestionDate, request.getIoTimeMillis());
        try {
            catalog.insertFileRecord(hostId, record);
            catalog.addFileToContainer(staged.getContainer().getContainerId(), fileId, fileVersion);
            catalog.recordFileStored(volume.getVolumeId(), staged.getSize());
        } catch (CatalogException e) {
            logger.error("Catalog update failed for file {} version {}: data is stored at {}, but its metadata is incomplete",
                    fileId, fileVersion, target, e);
            throw new CommitException(ArchiveFailureKind.CATALOG_FAILURE,
                    "Catalog update failed for file " + fileId + " version " + fileVersion + " stored at " + target + ": " + e.getMessage(),
                    e, committed);
        }
        logger.info("Archived file {} version {} to volume {} ({} bytes)", fileId, fileVersion, volume.getVolumeId(), staged.getSize());
        return record;
    }

    static FileRecord newRecord(String volumeId, String relativePath, String fileId, int fileVersion, String format,
                                long fileSize, String checksum, ChecksumAlgorithm checksumAlgorithm,
                                Instant ingestionDate, long ioTimeMillis) {
        FileRecord record = new FileRecord();
        record.setVolumeId(volumeId);
        record.setRelativePath(relativePath);
        record.setFileId(fileId);
        record.setFileVersion(fileVersion);
        record.setFormat(format);
        record.setFileSize(fileSize);
        record.setUncompressedFileSize(fileSize);
        record.setCompression(FileRecord.NO_COMPRESSION);
        record.setChecksum(checksum);
        record.setChecksumAlgorithm(checksumAlgorithm.getTag());
        record.setStatus(FileStatus.OK);
        record.setCreationDate(ingestionDate);
        record.setIngestionDate(ingestionDate);
        record.setIoTimeMillis(ioTimeMillis);
        return record;
    }

    private String formatOf(ArchiveRequest request, StagedFile staged) {
        String mimeType = request.getMimeType();
        if (mimeType != null && !mimeType.isBlank() && !StagingWriter.isMultipart(mimeType)) {
            return mimeType;
        }
        return MimeTypes.guess(staged.getFileName());
    }

    /**
     * Classifies a failed {@link #moveFile(Path, Path) move}. The target path is derived from the file version, so
     * an existing target means that the version was already archived on that day: a uniqueness violation.
     *
     * @param e the move failure
     * @return {@link ArchiveFailureKind#CATALOG_FAILURE} for an existing target,
     * {@link ArchiveFailureKind#DISK_EXHAUSTED} for a full disk, {@link ArchiveFailureKind#IO_FAILURE} otherwise
     */
    static ArchiveFailureKind moveFailureKind(IOException e) {
        if (e instanceof FileAlreadyExistsException) {
            return ArchiveFailureKind.CATALOG_FAILURE;
        }
        return DiskSpaceErrors.isOutOfSpace(e) ? ArchiveFailureKind.DISK_EXHAUSTED : ArchiveFailureKind.IO_FAILURE;
    }

    /**
     * Moves a file to a target that must not exist yet, atomically where the filesystem supports it.
     *
     * @throws FileAlreadyExistsException if the target exists
     */
    static void moveFile(Path source, Path target) throws IOException {
        Files.createDirectories(target.getParent());
        if (Files.exists(target)) {
            throw new FileAlreadyExistsException(target.toString());
        }
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target);
        }
    }

    private void writeContainerSizes(StagingResult staging, Map<Integer, Long> containerSizes, CommitException failure,
                                     List<FileRecord> committed) throws CommitException {
        try {
            containers.updateContainerSizes(staging.getRootContainer(), containerSizes);
        } catch (CatalogException e) {
            if (failure != null) {
                failure.addSuppressed(e);
                return;
            }
            logger.error("Failed to update container sizes of {}", staging.getRootContainer(), e);
            throw new CommitException(ArchiveFailureKind.CATALOG_FAILURE,
                    "Failed to update container sizes: " + e.getMessage(), e, committed);
        }
    }

    private static void deleteStagedFiles(List<StagedFile> files) {
        for (StagedFile file : files) {
            try {
                Files.deleteIfExists(file.getStagingPath());
            } catch (IOException e) {
                logger.warn("Failed to delete staging file {}", file.getStagingPath(), e);
            }
        }
    }
}
