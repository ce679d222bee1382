package archive.ingest.server.test;

import archive.ingest.common.Volume;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.stream.Stream;

/**
 * Creates volumes whose mount points are subdirectories of a temporary directory, and deletes everything on cleanup.
 */
public class TestingVolumes {
    private static final Logger logger = LoggerFactory.getLogger(TestingVolumes.class);

    public static final String HOST_ID = "test-host";

    private final Path baseDirectory;

    public TestingVolumes() throws IOException {
        baseDirectory = Files.createTempDirectory("archive-ingest-test-");
        logger.info("Created temporary directory: {}", baseDirectory);
    }

    public Volume create(String volumeId, String slotId, long availableSpace) throws IOException {
        Path mountPoint = Files.createDirectories(baseDirectory.resolve(volumeId));
        return new Volume(volumeId, HOST_ID, mountPoint.toString(), slotId, availableSpace);
    }

    public Path getBaseDirectory() {
        return baseDirectory;
    }

    /**
     * Recursively deletes the temporary directory and all of its contents.
     */
    public void cleanup() throws IOException {
        if (!Files.exists(baseDirectory)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(baseDirectory)) {
            paths.sorted(Comparator.reverseOrder()) // children before parents
                    .forEach(p -> {
                        try {
                            Files.delete(p);
                        } catch (IOException e) {
                            throw new RuntimeException("Failed to delete: " + p, e);
                        }
                    });
        }
    }
}
