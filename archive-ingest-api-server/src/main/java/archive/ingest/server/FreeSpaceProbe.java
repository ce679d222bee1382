package archive.ingest.server;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Reports the space physically available on the filesystem hosting a path.
 */
@FunctionalInterface
public interface FreeSpaceProbe {
    long getAvailableBytes(Path path) throws IOException;
}
