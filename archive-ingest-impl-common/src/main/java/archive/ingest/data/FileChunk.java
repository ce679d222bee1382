package archive.ingest.data;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;

/**
 * Factory methods for streams over the head or the tail of a file, as needed to resume interrupted transfers.
 */
public class FileChunk {

    /**
     * Returns an {@link OutputStream} continuing a file exactly where it ends.
     * <p>
     * An offset of 0 creates the file, or truncates it if it exists. Any other offset must be equal to
     * the current file size: data is never skipped, and bytes already on disk are never overwritten.
     *
     * @param file   the file to write to
     * @param offset the position to begin writing
     * @return a {@link FileChunkOutputStream}
     * @throws IOException              if the file cannot be opened
     * @throws IllegalArgumentException if the offset does not match the size of the file
     */
    public static FileChunkOutputStream getOutputStream(File file, long offset) throws IOException {
        if (offset < 0) {
            throw new IllegalArgumentException("Offset must be non-negative");
        }
        if (offset > 0) {
            long size = file.isFile() ? file.length() : 0L;
            if (size != offset) {
                throw new IllegalArgumentException("Offset " + offset + " does not match current size " + size + " of " + file);
            }
        }
        return new FileChunkOutputStream(file, offset);
    }

    /**
     * Returns an {@link InputStream} over the first {@code length} bytes of a file.
     *
     * @param file   the file to read
     * @param length number of bytes to read
     * @return a bounded {@link InputStream}
     * @throws IOException              if the file cannot be opened
     * @throws IllegalArgumentException if the file is shorter than {@code length}
     */
    public static InputStream getHeadInputStream(File file, long length) throws IOException {
        if (length < 0 || length > file.length()) {
            throw new IllegalArgumentException("Cannot read " + length + " bytes from " + file + " (size " + file.length() + ")");
        }
        return new SizeLimitedInputStream(Files.newInputStream(file.toPath()), length);
    }

    // Utility class
    private FileChunk() {}
}
