package archive.ingest.server;

import archive.ingest.common.ArchiveException;
import archive.ingest.common.ArchiveFailureKind;
import archive.ingest.common.ChecksumAccumulator;
import archive.ingest.common.ChecksumAlgorithm;
import archive.ingest.data.ChecksumCalculatingInputStream;
import archive.ingest.data.ChecksumCalculatingOutputStream;
import archive.ingest.data.FileChunk;
import archive.ingest.util.Checksums;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Files;
import java.util.Objects;

/**
 * Fetches a remote file into a staging file, continuing a previous partial transfer if there is one.
 * <p>
 * The checksum always covers the complete file: bytes already on disk are read back into the checksum
 * before new bytes are appended, so a resumed transfer yields the same checksum as an uninterrupted one.
 */
public class ResumableFetch {
    private static final Logger logger = LoggerFactory.getLogger(ResumableFetch.class);

    private final FetchStrategy strategy;
    private final int blockSize;
    private final ChecksumAlgorithm checksumAlgorithm;

    public ResumableFetch(FetchStrategy strategy, int blockSize, ChecksumAlgorithm checksumAlgorithm) {
        this.strategy = Objects.requireNonNull(strategy);
        if (blockSize < 1) {
            throw new IllegalArgumentException("Block size must be greater than 0");
        }
        this.blockSize = blockSize;
        this.checksumAlgorithm = Objects.requireNonNull(checksumAlgorithm);
    }

    /**
     * @param source      remote file
     * @param stagingFile local staging file
     * @param startByte   current size of the staging file (0 if it does not exist)
     * @return the fetch result
     * @throws IllegalArgumentException if {@code startByte} is not the current size of the staging file
     * @throws ArchiveException         classified by {@link FetchFailureClassifier} if the transfer fails
     */
    public FetchResult fetch(URI source, File stagingFile, long startByte) throws ArchiveException {
        long currentSize = stagingFile.isFile() ? stagingFile.length() : 0L;
        if (startByte != currentSize) {
            throw new IllegalArgumentException("Start byte " + startByte + " does not match size " + currentSize + " of staging file " + stagingFile);
        }
        logger.debug("Fetching {} into {}, starting at byte {}", source, stagingFile, startByte);

        ChecksumAccumulator checksum = Checksums.newAccumulator(checksumAlgorithm);
        long start = System.currentTimeMillis();
        long bytesReceived = 0;
        try {
            File parent = stagingFile.getAbsoluteFile().getParentFile();
            if (parent != null) {
                Files.createDirectories(parent.toPath());
            }
            if (startByte > 0) {
                readIntoChecksum(stagingFile, startByte, checksum);
            }
            try (InputStream in = strategy.openFrom(source, startByte);
                 ChecksumCalculatingOutputStream out = new ChecksumCalculatingOutputStream(FileChunk.getOutputStream(stagingFile, startByte), checksum)) {
                byte[] buffer = new byte[blockSize];
                int n;
                while ((n = in.read(buffer)) != -1) {
                    out.write(buffer, 0, n);
                    bytesReceived += n;
                }
            }
        } catch (IOException e) {
            ArchiveFailureKind kind = FetchFailureClassifier.classify(e, startByte, bytesReceived);
            logger.warn("Fetching {} failed after {} bytes (start byte {}), classified as {}: {}",
                    source, bytesReceived, startByte, kind, e.toString());
            throw new ArchiveException(kind, "Failed to fetch " + source + ": " + e.getMessage(), e);
        }
        long ioTime = System.currentTimeMillis() - start;
        FetchResult result = new FetchResult(ioTime, checksum.getValue(), bytesReceived, startByte + bytesReceived);
        logger.debug("Fetched {}: {}", source, result);
        return result;
    }

    private void readIntoChecksum(File stagingFile, long length, ChecksumAccumulator checksum) throws IOException {
        try (InputStream head = new ChecksumCalculatingInputStream(FileChunk.getHeadInputStream(stagingFile, length), checksum)) {
            byte[] buffer = new byte[blockSize];
            while (head.read(buffer) != -1) {
                // consumed for the checksum only
            }
        }
    }
}
