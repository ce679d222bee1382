package archive.ingest.server;

import archive.ingest.common.FileRecord;
import archive.ingest.common.Volume;

import java.time.Instant;
import java.util.List;

/**
 * Catalog backend used on the server side. The catalog holds the authoritative metadata of volumes,
 * containers and stored files.
 * <p>
 * Each individual method is expected to be atomic; the ingestion core does not wrap sequences of calls
 * into a common transaction. Implementations signal rejected or failed writes with a {@link CatalogException}.
 * Implementations must bind all values as statement parameters, never by concatenating them into queries.
 */
public interface ArchiveCatalogBackend {

    /**
     * Lists the volumes of a host, in catalog order.
     *
     * @param hostId host identifier
     * @return copies of the volumes of the host
     */
    List<Volume> getVolumes(String hostId);

    /**
     * Persists a new container.
     *
     * @param name          container name
     * @param parentId      ID of the (already persisted) parent container, or null for a root container
     * @param size          initial size
     * @param ingestionDate moment of creation
     * @return the catalog-issued container ID
     */
    String createContainer(String name, String parentId, long size, Instant ingestionDate);

    void setContainerSize(String containerId, long size);

    void addFileToContainer(String containerId, String fileId, int fileVersion);

    /**
     * Determines the version a new file with the given ID would get: one more than the latest known version,
     * or 1 if the file ID is unknown.
     *
     * @param fileId logical file identifier
     * @return next version number
     */
    int getNextFileVersion(String fileId);

    /**
     * Inserts a file record.
     *
     * @param hostId host storing the file
     * @param record the record
     * @throws CatalogException if the record could not be inserted, in particular if
     *                          {@code (fileId, fileVersion)} already exists
     */
    void insertFileRecord(String hostId, FileRecord record);

    /**
     * Accounts for a newly stored file: increments bytes stored and number of files, and decrements the available space.
     *
     * @param volumeId  the volume
     * @param fileSize  size of the stored file
     */
    void recordFileStored(String volumeId, long fileSize);

    /**
     * Writes the completion state of a volume.
     *
     * @param volume the volume, whose ID identifies the row to update
     */
    void updateVolume(Volume volume);
}
