package archive.ingest.common;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Settings of the ingestion pipelines. All properties have defaults, so an empty JSON object
 * is a valid configuration.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ArchiveConfiguration {

    public static final int DEFAULT_BLOCK_SIZE = 65536;
    public static final String DEFAULT_STAGING_DIRECTORY_NAME = "staging";

    private static final ObjectReader READER = new ObjectMapper().readerFor(ArchiveConfiguration.class);

    @JsonProperty("blockSize")
    private int blockSize = DEFAULT_BLOCK_SIZE;

    @JsonProperty("allowArchiveRequests")
    private boolean allowArchiveRequests = true;

    @JsonProperty("freeSpaceDiskChangeMb")
    private long freeSpaceDiskChangeMb = 0;

    @JsonProperty("fetchMethod")
    private FetchMethod fetchMethod = FetchMethod.HTTP;

    @JsonProperty("mutexDiskAccess")
    private boolean mutexDiskAccess = true;

    @JsonProperty("checksumAlgorithm")
    private ChecksumAlgorithm checksumAlgorithm = ChecksumAlgorithm.CRC32;

    @JsonProperty("stagingDirectoryName")
    private String stagingDirectoryName = DEFAULT_STAGING_DIRECTORY_NAME;

    @JsonProperty("storageSetSlots")
    private List<String> storageSetSlots = new ArrayList<>();

    public ArchiveConfiguration() {
    }

    /**
     * Reads a configuration from a JSON document.
     *
     * @param json the JSON input, closed by this method
     * @return the configuration
     * @throws IOException if the input cannot be read or is not a valid configuration
     */
    public static ArchiveConfiguration fromJson(InputStream json) throws IOException {
        try (json) {
            ArchiveConfiguration configuration = READER.readValue(json);
            return configuration.validate();
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid archive configuration: " + e.getMessage(), e);
        }
    }

    private ArchiveConfiguration validate() {
        setBlockSize(blockSize);
        setFreeSpaceDiskChangeMb(freeSpaceDiskChangeMb);
        setStagingDirectoryName(stagingDirectoryName);
        Objects.requireNonNull(fetchMethod, "fetchMethod must not be null");
        Objects.requireNonNull(checksumAlgorithm, "checksumAlgorithm must not be null");
        if (storageSetSlots == null) {
            storageSetSlots = new ArrayList<>();
        }
        return this;
    }

    /**
     * @return number of bytes per read/write chunk
     */
    public int getBlockSize() {
        return blockSize;
    }

    public ArchiveConfiguration setBlockSize(int blockSize) {
        if (blockSize < 1) {
            throw new IllegalArgumentException("blockSize must be greater than 0");
        }
        this.blockSize = blockSize;
        return this;
    }

    public boolean isAllowArchiveRequests() {
        return allowArchiveRequests;
    }

    public ArchiveConfiguration setAllowArchiveRequests(boolean allowArchiveRequests) {
        this.allowArchiveRequests = allowArchiveRequests;
        return this;
    }

    /**
     * @return threshold of free space (in MB) below which a volume is flagged as completed
     */
    public long getFreeSpaceDiskChangeMb() {
        return freeSpaceDiskChangeMb;
    }

    public ArchiveConfiguration setFreeSpaceDiskChangeMb(long freeSpaceDiskChangeMb) {
        if (freeSpaceDiskChangeMb < 0) {
            throw new IllegalArgumentException("freeSpaceDiskChangeMb must not be negative");
        }
        this.freeSpaceDiskChangeMb = freeSpaceDiskChangeMb;
        return this;
    }

    public long getFreeSpaceDiskChangeBytes() {
        return freeSpaceDiskChangeMb * 1024L * 1024L;
    }

    public FetchMethod getFetchMethod() {
        return fetchMethod;
    }

    public ArchiveConfiguration setFetchMethod(FetchMethod fetchMethod) {
        this.fetchMethod = Objects.requireNonNull(fetchMethod);
        return this;
    }

    /**
     * @return whether writes to the same volume slot are serialized
     */
    public boolean isMutexDiskAccess() {
        return mutexDiskAccess;
    }

    public ArchiveConfiguration setMutexDiskAccess(boolean mutexDiskAccess) {
        this.mutexDiskAccess = mutexDiskAccess;
        return this;
    }

    public ChecksumAlgorithm getChecksumAlgorithm() {
        return checksumAlgorithm;
    }

    public ArchiveConfiguration setChecksumAlgorithm(ChecksumAlgorithm checksumAlgorithm) {
        this.checksumAlgorithm = Objects.requireNonNull(checksumAlgorithm);
        return this;
    }

    /**
     * @return name of the staging directory, relative to a volume's mount point
     */
    public String getStagingDirectoryName() {
        return stagingDirectoryName;
    }

    public ArchiveConfiguration setStagingDirectoryName(String stagingDirectoryName) {
        Objects.requireNonNull(stagingDirectoryName, "stagingDirectoryName must not be null");
        if (stagingDirectoryName.isBlank() || stagingDirectoryName.contains("..")) {
            throw new IllegalArgumentException("Invalid staging directory name: " + stagingDirectoryName);
        }
        this.stagingDirectoryName = stagingDirectoryName;
        return this;
    }

    /**
     * @return slot IDs in order of preference for multi-file requests; empty means natural slot order
     */
    public List<String> getStorageSetSlots() {
        return storageSetSlots;
    }

    public ArchiveConfiguration setStorageSetSlots(List<String> storageSetSlots) {
        this.storageSetSlots = new ArrayList<>(Objects.requireNonNull(storageSetSlots));
        return this;
    }

    @Override
    public String toString() {
        return "ArchiveConfiguration{" +
                "blockSize=" + blockSize +
                ", allowArchiveRequests=" + allowArchiveRequests +
                ", freeSpaceDiskChangeMb=" + freeSpaceDiskChangeMb +
                ", fetchMethod=" + fetchMethod +
                ", mutexDiskAccess=" + mutexDiskAccess +
                ", checksumAlgorithm=" + checksumAlgorithm +
                ", stagingDirectoryName='" + stagingDirectoryName + '\'' +
                ", storageSetSlots=" + storageSetSlots +
                '}';
    }
}
