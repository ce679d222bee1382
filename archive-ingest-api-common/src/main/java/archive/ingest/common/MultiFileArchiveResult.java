package archive.ingest.common;

import java.util.List;
import java.util.Objects;

/**
 * Success value of a multi-file archive request.
 */
public class MultiFileArchiveResult {
    private final List<FileRecord> committedFiles;
    private final Container rootContainer;
    private final Volume volume;
    private final double ingestRate;

    public MultiFileArchiveResult(List<FileRecord> committedFiles, Container rootContainer, Volume volume, double ingestRate) {
        this.committedFiles = List.copyOf(committedFiles);
        this.rootContainer = Objects.requireNonNull(rootContainer);
        this.volume = Objects.requireNonNull(volume);
        this.ingestRate = ingestRate;
    }

    public List<FileRecord> getCommittedFiles() {
        return committedFiles;
    }

    public Container getRootContainer() {
        return rootContainer;
    }

    public Volume getVolume() {
        return volume;
    }

    /**
     * @return bytes per second read from the request body during staging
     */
    public double getIngestRate() {
        return ingestRate;
    }
}
