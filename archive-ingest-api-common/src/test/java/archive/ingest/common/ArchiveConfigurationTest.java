package archive.ingest.common;

import org.junit.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.Assert.*;

public class ArchiveConfigurationTest {

    private static InputStream json(String json) {
        return new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    public void testDefaults() throws IOException {
        ArchiveConfiguration configuration = ArchiveConfiguration.fromJson(json("{}"));
        assertEquals(ArchiveConfiguration.DEFAULT_BLOCK_SIZE, configuration.getBlockSize());
        assertTrue(configuration.isAllowArchiveRequests());
        assertTrue(configuration.isMutexDiskAccess());
        assertEquals(0, configuration.getFreeSpaceDiskChangeBytes());
        assertEquals(FetchMethod.HTTP, configuration.getFetchMethod());
        assertEquals(ChecksumAlgorithm.CRC32, configuration.getChecksumAlgorithm());
        assertEquals("staging", configuration.getStagingDirectoryName());
        assertEquals(List.of(), configuration.getStorageSetSlots());
    }

    @Test
    public void testReadFromJson() throws IOException {
        ArchiveConfiguration configuration = ArchiveConfiguration.fromJson(json("{"
                + "\"blockSize\": 4096,"
                + "\"allowArchiveRequests\": false,"
                + "\"freeSpaceDiskChangeMb\": 2,"
                + "\"fetchMethod\": \"WHOLE_FILE\","
                + "\"mutexDiskAccess\": false,"
                + "\"checksumAlgorithm\": \"MD5\","
                + "\"stagingDirectoryName\": \".incoming\","
                + "\"storageSetSlots\": [\"slot-2\", \"slot-1\"],"
                + "\"somethingElse\": 42"
                + "}"));
        assertEquals(4096, configuration.getBlockSize());
        assertFalse(configuration.isAllowArchiveRequests());
        assertEquals(2L * 1024 * 1024, configuration.getFreeSpaceDiskChangeBytes());
        assertEquals(FetchMethod.WHOLE_FILE, configuration.getFetchMethod());
        assertFalse(configuration.isMutexDiskAccess());
        assertEquals(ChecksumAlgorithm.MD5, configuration.getChecksumAlgorithm());
        assertEquals(".incoming", configuration.getStagingDirectoryName());
        assertEquals(List.of("slot-2", "slot-1"), configuration.getStorageSetSlots());
    }

    @Test
    public void testInvalidValuesRejected() {
        assertThrows(IOException.class, () -> ArchiveConfiguration.fromJson(json("{\"blockSize\": 0}")));
        assertThrows(IOException.class, () -> ArchiveConfiguration.fromJson(json("{\"freeSpaceDiskChangeMb\": -1}")));
        assertThrows(IOException.class, () -> ArchiveConfiguration.fromJson(json("{\"stagingDirectoryName\": \"../x\"}")));
        assertThrows(IOException.class, () -> ArchiveConfiguration.fromJson(json("{\"fetchMethod\": \"FTP\"}")));
        assertThrows(IOException.class, () -> ArchiveConfiguration.fromJson(json("not json")));
        assertThrows(IllegalArgumentException.class, () -> new ArchiveConfiguration().setBlockSize(-5));
    }
}
