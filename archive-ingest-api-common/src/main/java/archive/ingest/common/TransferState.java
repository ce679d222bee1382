package archive.ingest.common;

import java.io.File;
import java.util.Objects;

/**
 * State of a (possibly resumed) mirror transfer: the staging file and how much of it is already on disk.
 * <p>
 * The offset is always the size of the partial staging file, and it never decreases across resumptions.
 */
public class TransferState {
    private final File stagingFile;
    private long offset;
    private String checksum;

    private TransferState(File stagingFile, long offset) {
        this.stagingFile = stagingFile;
        this.offset = offset;
    }

    /**
     * Determines the current state from the staging file on disk (offset 0 if it does not exist).
     *
     * @param stagingFile the staging file
     * @return the current transfer state
     */
    public static TransferState of(File stagingFile) {
        Objects.requireNonNull(stagingFile);
        return new TransferState(stagingFile, stagingFile.isFile() ? stagingFile.length() : 0L);
    }

    public File getStagingFile() {
        return stagingFile;
    }

    public long getOffset() {
        return offset;
    }

    /**
     * Advances the offset after more bytes were written.
     *
     * @param newOffset the new offset
     * @throws IllegalArgumentException if the new offset is smaller than the current one
     */
    public void advanceTo(long newOffset) {
        if (newOffset < offset) {
            throw new IllegalArgumentException("Transfer offset must not decrease: " + offset + " -> " + newOffset);
        }
        this.offset = newOffset;
    }

    public boolean isResumption() {
        return offset > 0;
    }

    public String getChecksum() {
        return checksum;
    }

    public void complete(String checksum) {
        this.checksum = Objects.requireNonNull(checksum);
    }

    @Override
    public String toString() {
        return "TransferState{" +
                "stagingFile=" + stagingFile +
                ", offset=" + offset +
                ", checksum='" + checksum + '\'' +
                '}';
    }
}
