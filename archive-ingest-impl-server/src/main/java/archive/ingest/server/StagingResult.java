package archive.ingest.server;

import archive.ingest.common.Container;
import archive.ingest.common.StagedFile;

import java.util.List;

/**
 * Outcome of the write phase of a multi-file archive request.
 */
public class StagingResult {
    private final long elapsedMillis;
    private final Container rootContainer;
    private final List<StagedFile> stagedFiles;
    private final long bytesRead;

    public StagingResult(long elapsedMillis, Container rootContainer, List<StagedFile> stagedFiles, long bytesRead) {
        this.elapsedMillis = elapsedMillis;
        this.rootContainer = rootContainer;
        this.stagedFiles = List.copyOf(stagedFiles);
        this.bytesRead = bytesRead;
    }

    public long getElapsedMillis() {
        return elapsedMillis;
    }

    public Container getRootContainer() {
        return rootContainer;
    }

    /**
     * @return the staged files, in the order they appeared in the request
     */
    public List<StagedFile> getStagedFiles() {
        return stagedFiles;
    }

    public long getBytesRead() {
        return bytesRead;
    }

    /**
     * @return bytes per second, or 0 if no measurable time elapsed
     */
    public double getIngestRate() {
        return elapsedMillis > 0 ? bytesRead * 1000.0 / elapsedMillis : 0.0;
    }

    @Override
    public String toString() {
        return "StagingResult{" +
                "elapsedMillis=" + elapsedMillis +
                ", rootContainer=" + (rootContainer != null ? rootContainer.getName() : null) +
                ", stagedFiles=" + stagedFiles.size() +
                ", bytesRead=" + bytesRead +
                '}';
    }
}
