package archive.ingest.server;

import archive.ingest.common.ArchiveFailureKind;
import org.junit.Test;

import java.io.IOException;
import java.io.UncheckedIOException;

import static org.junit.Assert.*;

public class FetchFailureClassifierTest {

    @Test
    public void testClassification() {
        IOException generic = new IOException("Connection reset");
        assertEquals(ArchiveFailureKind.IO_FAILURE, FetchFailureClassifier.classify(generic, 0, 0));
        assertEquals(ArchiveFailureKind.RESUMABLE, FetchFailureClassifier.classify(generic, 0, 1));
        assertEquals(ArchiveFailureKind.RESUMABLE, FetchFailureClassifier.classify(generic, 100, 0));

        IOException full = new IOException("write failed: No space left on device");
        assertEquals(ArchiveFailureKind.DISK_EXHAUSTED, FetchFailureClassifier.classify(full, 0, 0));
        assertEquals(ArchiveFailureKind.DISK_EXHAUSTED, FetchFailureClassifier.classify(full, 100, 50));
    }

    @Test
    public void testOutOfSpaceInCauseChain() {
        Exception wrapped = new UncheckedIOException("write failed", new IOException("There is not enough space on the disk"));
        assertTrue(DiskSpaceErrors.isOutOfSpace(wrapped));
        assertFalse(DiskSpaceErrors.isOutOfSpace(new IllegalStateException("No space left on device")));
        assertFalse(DiskSpaceErrors.isOutOfSpace(new IOException((String) null)));
        assertFalse(DiskSpaceErrors.isOutOfSpace(null));
    }
}
