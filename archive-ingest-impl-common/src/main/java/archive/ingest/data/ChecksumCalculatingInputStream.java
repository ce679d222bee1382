package archive.ingest.data;

import archive.ingest.common.ChecksumAccumulator;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

/**
 * Folds every byte read into a {@link ChecksumAccumulator}.
 */
@SuppressWarnings("NullableProblems") // silence IntelliJ-specific bogus warning
public class ChecksumCalculatingInputStream extends FilterInputStream {

    private final ChecksumAccumulator accumulator;

    public ChecksumCalculatingInputStream(InputStream in, ChecksumAccumulator accumulator) {
        super(Objects.requireNonNull(in));
        this.accumulator = Objects.requireNonNull(accumulator);
    }

    @Override
    public int read() throws IOException {
        int b = in.read();
        if (b != -1) {
            accumulator.update(b);
        }
        return b;
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        int n = in.read(b, off, len);
        if (n > 0) {
            accumulator.update(b, off, n);
        }
        return n;
    }

    // skipped bytes would be missing from the checksum
    @Override
    public long skip(long n) throws IOException {
        byte[] buffer = new byte[(int) Math.min(8192, Math.max(n, 1))];
        long skipped = 0;
        while (skipped < n) {
            int read = read(buffer, 0, (int) Math.min(buffer.length, n - skipped));
            if (read == -1) {
                break;
            }
            skipped += read;
        }
        return skipped;
    }

    @Override
    public boolean markSupported() {
        return false;
    }

    public ChecksumAccumulator getAccumulator() {
        return accumulator;
    }
}
