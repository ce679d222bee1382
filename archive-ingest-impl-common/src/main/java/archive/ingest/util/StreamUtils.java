package archive.ingest.util;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;

public final class StreamUtils {

    /**
     * Skips exactly {@code n} bytes, reading through the stream where {@link InputStream#skip(long)} makes no progress.
     *
     * @param input the stream
     * @param n     number of bytes to skip
     * @throws EOFException if the stream ends before {@code n} bytes were skipped
     * @throws IOException  on read errors
     */
    public static void skipFully(InputStream input, long n) throws IOException {
        long remaining = n;
        byte[] buffer = null;
        while (remaining > 0) {
            long skipped = input.skip(remaining);
            if (skipped > 0) {
                remaining -= skipped;
                continue;
            }
            if (buffer == null) {
                buffer = new byte[(int) Math.min(8192, remaining)];
            }
            int read = input.read(buffer, 0, (int) Math.min(buffer.length, remaining));
            if (read < 0) {
                throw new EOFException("Unexpected end of stream, " + remaining + " of " + n + " bytes left to skip");
            }
            remaining -= read;
        }
    }

    private StreamUtils() {
    }
}
