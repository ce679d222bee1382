package archive.ingest.server;

import archive.ingest.common.ChecksumAlgorithm;
import archive.ingest.server.multipart.MimeMultipartParser;
import archive.ingest.server.multipart.MultipartParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * Writes the body of an archive request into the staging area of a volume, in a single pass.
 * <p>
 * Multipart bodies are split into one staging file per body part; any other body is staged as one file.
 * On failure, all staging files written for the request are deleted before the exception propagates.
 */
public class StagingWriter {
    private static final Logger logger = LoggerFactory.getLogger(StagingWriter.class);

    private final int blockSize;
    private final ChecksumAlgorithm checksumAlgorithm;
    private final DiskResourceLocks locks;

    public StagingWriter(int blockSize, ChecksumAlgorithm checksumAlgorithm, DiskResourceLocks locks) {
        if (blockSize < 1) {
            throw new IllegalArgumentException("Block size must be greater than 0");
        }
        this.blockSize = blockSize;
        this.checksumAlgorithm = Objects.requireNonNull(checksumAlgorithm);
        this.locks = Objects.requireNonNull(locks);
    }

    /**
     * Stages the request body.
     *
     * @param request          the archive request; its received byte count and I/O time are updated
     * @param stagingDirectory directory to write to, created if needed
     * @param slotId           slot of the target volume, used for disk access serialization
     * @return the staging result
     * @throws IOException          if reading or writing fails, or the body is malformed
     * @throws InterruptedException if interrupted while waiting for the disk lock
     */
    public StagingResult write(ArchiveRequest request, Path stagingDirectory, String slotId) throws IOException, InterruptedException {
        Files.createDirectories(stagingDirectory);
        FilesystemWriterHandler handler = new FilesystemWriterHandler(stagingDirectory, checksumAlgorithm);
        long start = System.currentTimeMillis();
        MimeMultipartParser parser;
        try (DiskResourceLocks.DiskResourceLock ignored = locks.acquire(slotId);
             InputStream body = request.getSource().openStream()) {
            // response headers of pulled sources are only known once the stream is open
            long remainingSize = SizeEstimator.estimate(request);
            logger.debug("Staging {} into {}, expected size: {}", request.getSafeFileUri(), stagingDirectory, remainingSize);
            parser = new MimeMultipartParser(handler, body, remainingSize, blockSize);
            if (isMultipart(request.getMimeType())) {
                parser.parse();
            } else {
                parser.parseSingleFile(request.getBaseName());
            }
            if (handler.getRoot() == null) {
                throw new MultipartParseException("Request body contains no container");
            }
        } catch (IOException | InterruptedException | RuntimeException e) {
            handler.discard();
            throw e;
        }
        long elapsed = System.currentTimeMillis() - start;
        request.setBytesReceived(parser.getBytesRead());
        request.addIoTime(elapsed);

        StagingResult result = new StagingResult(elapsed, handler.getRoot(), handler.getStagedFiles(), parser.getBytesRead());
        logger.debug("Staged {} file(s), {} bytes in {} ms (reading: {} ms, checksum: {} ms, writing: {} ms)",
                result.getStagedFiles().size(), result.getBytesRead(), elapsed,
                parser.getReadingTimeMillis(), handler.getChecksumTimeMillis(), handler.getWritingTimeMillis());
        return result;
    }

    static boolean isMultipart(String mimeType) {
        return mimeType != null && mimeType.trim().toLowerCase(Locale.ROOT).startsWith("multipart/");
    }
}
