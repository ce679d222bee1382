package archive.ingest.common;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A file written to the staging area, waiting to be moved to its final destination.
 * Only exists between the end of the write phase and the move.
 */
public class StagedFile {
    private final Path stagingPath;
    private final String fileName;
    private final Container container;
    private final String checksum;
    private final long size;

    /**
     * @param stagingPath absolute path of the staging file
     * @param fileName    logical file name as declared by the client
     * @param container   innermost container enclosing the file
     * @param checksum    checksum accumulated while writing
     * @param size        number of bytes written
     */
    public StagedFile(Path stagingPath, String fileName, Container container, String checksum, long size) {
        this.stagingPath = Objects.requireNonNull(stagingPath);
        this.fileName = Objects.requireNonNull(fileName);
        this.container = Objects.requireNonNull(container);
        this.checksum = checksum;
        this.size = size;
    }

    public Path getStagingPath() {
        return stagingPath;
    }

    public String getFileName() {
        return fileName;
    }

    public Container getContainer() {
        return container;
    }

    public String getChecksum() {
        return checksum;
    }

    public long getSize() {
        return size;
    }

    @Override
    public String toString() {
        return "StagedFile{" +
                "stagingPath=" + stagingPath +
                ", fileName='" + fileName + '\'' +
                ", container=" + container.getName() +
                ", checksum='" + checksum + '\'' +
                ", size=" + size +
                '}';
    }
}
