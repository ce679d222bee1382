package archive.ingest.data;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

/**
 * An InputStream decorator delivering at most a given total number of bytes, and keeping
 * track of how many bytes were actually read.
 * <p>
 * Once the limit is reached, the stream reports end-of-input even if the delegate has more data.
 * If the delegate ends earlier, so does this stream.
 */
@SuppressWarnings("NullableProblems")
public class SizeLimitedInputStream extends InputStream {
    private final InputStream delegate;
    private final long limit;
    private long bytesRead = 0;

    /**
     * @param delegate the underlying input stream to wrap (must not be null)
     * @param limit    the maximum number of bytes to deliver (must be ≥ 0)
     */
    public SizeLimitedInputStream(InputStream delegate, long limit) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
        if (limit < 0) throw new IllegalArgumentException("limit must be >= 0");
        this.limit = limit;
    }

    @Override
    public int read() throws IOException {
        if (bytesRead >= limit) {
            return -1;
        }
        int b = delegate.read();
        if (b != -1) {
            bytesRead++;
        }
        return b;
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        if (len == 0) {
            return 0;
        }
        long remaining = limit - bytesRead;
        if (remaining <= 0) {
            return -1;
        }
        int n = delegate.read(b, off, (int) Math.min(len, remaining));
        if (n > 0) {
            bytesRead += n;
        }
        return n;
    }

    @Override
    public int available() throws IOException {
        return (int) Math.min(delegate.available(), limit - bytesRead);
    }

    @Override
    public void close() throws IOException {
        delegate.close();
    }

    /**
     * @return the number of bytes delivered so far
     */
    public long getBytesRead() {
        return bytesRead;
    }

    public long getLimit() {
        return limit;
    }
}
