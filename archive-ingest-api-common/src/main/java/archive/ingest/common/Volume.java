package archive.ingest.common;

import java.time.Instant;
import java.util.Objects;

/**
 * A managed storage location (mount point) of a host, tracked with capacity and completion state.
 * <p>
 * Volumes are created and listed by the catalog; the ingestion core only ever updates their counters
 * after a successful commit, or flags them as completed when their free space runs low. They are never deleted.
 */
public class Volume {

    private String volumeId;
    private String hostId;
    private String mountPoint;
    private String slotId;
    private long availableSpace;
    private long bytesStored;
    private long numberOfFiles;
    private boolean completed;
    private Instant completionDate;

    /**
     * Default constructor for serialization/deserialization.
     */
    public Volume() {
    }

    public Volume(String volumeId, String hostId, String mountPoint, String slotId, long availableSpace) {
        this.volumeId = Objects.requireNonNull(volumeId, "Volume ID must not be null");
        this.hostId = hostId;
        this.mountPoint = Objects.requireNonNull(mountPoint, "Mount point must not be null");
        this.slotId = Objects.requireNonNull(slotId, "Slot ID must not be null");
        this.availableSpace = availableSpace;
    }

    /**
     * Copy constructor; catalogs hand out copies so that callers cannot mutate the stored state by accident.
     *
     * @param other volume to copy
     */
    public Volume(Volume other) {
        this.volumeId = other.volumeId;
        this.hostId = other.hostId;
        this.mountPoint = other.mountPoint;
        this.slotId = other.slotId;
        this.availableSpace = other.availableSpace;
        this.bytesStored = other.bytesStored;
        this.numberOfFiles = other.numberOfFiles;
        this.completed = other.completed;
        this.completionDate = other.completionDate;
    }

    public String getVolumeId() {
        return volumeId;
    }

    public void setVolumeId(String volumeId) {
        this.volumeId = volumeId;
    }

    public String getHostId() {
        return hostId;
    }

    public void setHostId(String hostId) {
        this.hostId = hostId;
    }

    public String getMountPoint() {
        return mountPoint;
    }

    public void setMountPoint(String mountPoint) {
        this.mountPoint = mountPoint;
    }

    public String getSlotId() {
        return slotId;
    }

    public void setSlotId(String slotId) {
        this.slotId = slotId;
    }

    /**
     * @return the available space in bytes
     */
    public long getAvailableSpace() {
        return availableSpace;
    }

    public void setAvailableSpace(long availableSpace) {
        this.availableSpace = availableSpace;
    }

    public long getBytesStored() {
        return bytesStored;
    }

    public void setBytesStored(long bytesStored) {
        this.bytesStored = bytesStored;
    }

    public long getNumberOfFiles() {
        return numberOfFiles;
    }

    public void setNumberOfFiles(long numberOfFiles) {
        this.numberOfFiles = numberOfFiles;
    }

    public boolean isCompleted() {
        return completed;
    }

    public void setCompleted(boolean completed) {
        this.completed = completed;
    }

    public Instant getCompletionDate() {
        return completionDate;
    }

    public void setCompletionDate(Instant completionDate) {
        this.completionDate = completionDate;
    }

    @Override
    public String toString() {
        return "Volume{" +
                "volumeId='" + volumeId + '\'' +
                ", hostId='" + hostId + '\'' +
                ", mountPoint='" + mountPoint + '\'' +
                ", slotId='" + slotId + '\'' +
                ", availableSpace=" + availableSpace +
                ", bytesStored=" + bytesStored +
                ", numberOfFiles=" + numberOfFiles +
                ", completed=" + completed +
                '}';
    }
}
