package archive.ingest.server;

import archive.ingest.common.ChecksumAccumulator;
import archive.ingest.common.ChecksumAlgorithm;
import archive.ingest.common.Container;
import archive.ingest.common.StagedFile;
import archive.ingest.data.FileChunk;
import archive.ingest.data.FileChunkOutputStream;
import archive.ingest.server.multipart.MultipartHandler;
import archive.ingest.server.multipart.MultipartParseException;
import archive.ingest.util.Checksums;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * A {@link MultipartHandler} that writes every file of a request into its own staging file,
 * accumulating its checksum on the way, and builds the container tree as containers are announced.
 * <p>
 * A file announced outside of any container gets a root container of its own name.
 */
public class FilesystemWriterHandler implements MultipartHandler {
    private static final Logger logger = LoggerFactory.getLogger(FilesystemWriterHandler.class);

    static final String STAGING_NAME_SEPARATOR = "___";

    private final Path stagingDirectory;
    private final ChecksumAlgorithm checksumAlgorithm;

    private final Deque<Container> openContainers = new ArrayDeque<>();
    private final List<StagedFile> stagedFiles = new ArrayList<>();
    private Container root;
    private int nextContainerIndex;

    private String currentFileName;
    private Path currentPath;
    private FileChunkOutputStream currentOutput;
    private ChecksumAccumulator currentChecksum;

    private long checksumTimeNanos;
    private long writingTimeNanos;

    public FilesystemWriterHandler(Path stagingDirectory, ChecksumAlgorithm checksumAlgorithm) {
        this.stagingDirectory = Objects.requireNonNull(stagingDirectory);
        this.checksumAlgorithm = Objects.requireNonNull(checksumAlgorithm);
    }

    @Override
    public void startContainer(String name) throws IOException {
        Container container = new Container(nextContainerIndex++, name);
        if (openContainers.isEmpty()) {
            if (root != null) {
                throw new MultipartParseException("Request contains more than one root container: " + root.getName() + ", " + name);
            }
            root = container;
        } else {
            openContainers.peek().addChild(container);
        }
        openContainers.push(container);
    }

    @Override
    public void endContainer() throws IOException {
        if (openContainers.isEmpty()) {
            throw new MultipartParseException("End of container without matching start");
        }
        openContainers.pop();
    }

    @Override
    public void startFile(String fileName) throws IOException {
        if (currentOutput != null) {
            throw new MultipartParseException("File " + fileName + " started before end of file " + currentFileName);
        }
        String baseName = toBaseName(fileName);
        if (openContainers.isEmpty() && root == null) {
            startContainer(baseName);
        }
        currentFileName = baseName;
        currentPath = stagingDirectory.resolve(UUID.randomUUID() + STAGING_NAME_SEPARATOR + baseName);
        currentChecksum = Checksums.newAccumulator(checksumAlgorithm);
        currentOutput = FileChunk.getOutputStream(currentPath.toFile(), 0);
        logger.debug("Writing file {} to staging file {}", baseName, currentPath);
    }

    @Override
    public void fileData(byte[] buffer, int offset, int length) throws IOException {
        long start = System.nanoTime();
        currentChecksum.update(buffer, offset, length);
        long checksumDone = System.nanoTime();
        currentOutput.write(buffer, offset, length);
        writingTimeNanos += System.nanoTime() - checksumDone;
        checksumTimeNanos += checksumDone - start;
    }

    @Override
    public void endFile() throws IOException {
        long start = System.nanoTime();
        currentOutput.close();
        writingTimeNanos += System.nanoTime() - start;
        Container container = openContainers.isEmpty() ? root : openContainers.peek();
        StagedFile staged = new StagedFile(currentPath, currentFileName, container, currentChecksum.getValue(), currentOutput.getBytesWritten());
        stagedFiles.add(staged);
        logger.debug("Staged {}", staged);
        currentOutput = null;
        currentPath = null;
        currentChecksum = null;
        currentFileName = null;
    }

    /**
     * Closes any file still being written and deletes all staging files of this request.
     */
    public void discard() {
        if (currentOutput != null) {
            try {
                currentOutput.close();
            } catch (IOException e) {
                logger.debug("Failed to close staging file {}: {}", currentPath, e.toString());
            }
            deleteQuietly(currentPath);
            currentOutput = null;
        }
        for (StagedFile file : stagedFiles) {
            deleteQuietly(file.getStagingPath());
        }
        stagedFiles.clear();
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            logger.warn("Failed to delete staging file {}", path, e);
        }
    }

    private static String toBaseName(String fileName) throws MultipartParseException {
        String baseName = fileName.substring(Math.max(fileName.lastIndexOf('/'), fileName.lastIndexOf('\\')) + 1);
        if (baseName.isEmpty() || baseName.equals(".") || baseName.equals("..")) {
            throw new MultipartParseException("Invalid file name: " + fileName);
        }
        return baseName;
    }

    /**
     * @return the root container, or null if nothing was announced yet
     */
    public Container getRoot() {
        return root;
    }

    public List<StagedFile> getStagedFiles() {
        return Collections.unmodifiableList(stagedFiles);
    }

    public long getChecksumTimeMillis() {
        return checksumTimeNanos / 1_000_000L;
    }

    public long getWritingTimeMillis() {
        return writingTimeNanos / 1_000_000L;
    }
}
