package archive.ingest.data;

import archive.ingest.common.ChecksumAccumulator;

import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Objects;

/**
 * Folds every byte written into a {@link ChecksumAccumulator} before passing it on.
 * The accumulator may already contain data (e.g. the head of a resumed file); the resulting
 * checksum then covers that data followed by everything written through this stream.
 */
@SuppressWarnings("NullableProblems") // silence IntelliJ-specific bogus warning
public class ChecksumCalculatingOutputStream extends FilterOutputStream {

    private final ChecksumAccumulator accumulator;
    private long bytesWritten;
    private boolean closed = false;

    public ChecksumCalculatingOutputStream(OutputStream out, ChecksumAccumulator accumulator) {
        super(Objects.requireNonNull(out));
        this.accumulator = Objects.requireNonNull(accumulator);
    }

    @Override
    public void write(int b) throws IOException {
        out.write(b);
        accumulator.update(b);
        bytesWritten++;
    }

    @Override
    public void write(byte[] b, int off, int len) throws IOException {
        out.write(b, off, len);
        accumulator.update(b, off, len);
        bytesWritten += len;
    }

    /**
     * @return number of bytes written through this stream (not counting data the accumulator held before)
     */
    public long getBytesWritten() {
        return bytesWritten;
    }

    public String getChecksum() {
        if (!closed) {
            throw new IllegalStateException("Stream must be closed before requesting checksum");
        }
        return accumulator.getValue();
    }

    @Override
    public void close() throws IOException {
        if (!closed) {
            closed = true;
            super.close();
        }
    }
}
