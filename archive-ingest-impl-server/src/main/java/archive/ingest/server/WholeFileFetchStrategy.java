package archive.ingest.server;

import archive.ingest.util.StreamUtils;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;

/**
 * Fetches with the plain URL machinery of the JDK: the remote file is always opened from its beginning, and
 * the leading bytes are skipped locally.
 */
public class WholeFileFetchStrategy implements FetchStrategy {

    @Override
    public InputStream openFrom(URI source, long offset) throws IOException {
        InputStream in = source.toURL().openStream();
        try {
            StreamUtils.skipFully(in, offset);
        } catch (IOException e) {
            in.close();
            throw e;
        }
        return in;
    }
}
