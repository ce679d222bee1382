package archive.ingest.server;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reports the usable space of the file store a path lives on.
 */
public class FileStoreFreeSpaceProbe implements FreeSpaceProbe {

    @Override
    public long getAvailableBytes(Path path) throws IOException {
        return Files.getFileStore(path).getUsableSpace();
    }
}
