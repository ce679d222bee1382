package archive.ingest.common;

import org.junit.Test;

import java.io.IOException;
import java.time.Instant;
import java.util.List;

import static org.junit.Assert.*;

public class ArchiveOutcomeTest {

    private static FileRecord record(String fileId, int version) {
        FileRecord record = new FileRecord();
        record.setFileId(fileId);
        record.setFileVersion(version);
        record.setRelativePath("2024-05-17/" + version + "/" + fileId);
        record.setFileSize(1024);
        record.setChecksum("12345");
        record.setChecksumAlgorithm(ChecksumAlgorithm.CRC32.getTag());
        record.setIngestionDate(Instant.parse("2024-05-17T10:15:30Z"));
        return record;
    }

    @Test
    public void testSuccess() {
        ArchiveOutcome<String> outcome = ArchiveOutcome.success("done", "Archived");
        assertTrue(outcome.isSuccess());
        assertEquals("done", outcome.getValue());
        assertEquals(List.of(), outcome.getCommittedBeforeFailure());
        assertThrows(IllegalStateException.class, outcome::getFailureKind);
    }

    @Test
    public void testFailureKeepsCommittedFiles() {
        IOException cause = new IOException("boom");
        ArchiveOutcome<String> outcome = ArchiveOutcome.failure(ArchiveFailureKind.CATALOG_FAILURE, "Catalog down", cause, List.of(record("a", 1)));
        assertFalse(outcome.isSuccess());
        assertEquals(ArchiveFailureKind.CATALOG_FAILURE, outcome.getFailureKind());
        assertSame(cause, outcome.getCause());
        assertEquals(1, outcome.getCommittedBeforeFailure().size());
        assertThrows(IllegalStateException.class, outcome::getValue);

        ArchiveOutcome<Void> fromException = ArchiveOutcome.failure(new ArchiveException(ArchiveFailureKind.RESUMABLE, "try again"));
        assertEquals(ArchiveFailureKind.RESUMABLE, fromException.getFailureKind());
        assertTrue(fromException.getFailureKind().isRetryable());
        assertEquals("try again", fromException.getMessage());
    }

    @Test
    public void testStatusReplyJson() {
        Volume volume = new Volume("vol-1", "host-1", "/mnt/vol-1", "slot-1", 1000);
        ArchiveStatusReply success = ArchiveStatusReply.of(ArchiveOutcome.success("ok", "Archived 1 file"), "host-1", volume, List.of(record("a", 1)));
        ArchiveStatusReply parsed = ArchiveStatusReply.fromString(success.toString());
        assertEquals(ArchiveStatusReply.STATUS_SUCCESS, parsed.status);
        assertNull(parsed.failureKind);
        assertEquals("vol-1", parsed.volumeId);
        assertEquals(1, parsed.files.size());
        assertEquals("a", parsed.files.get(0).fileId);
        assertEquals("2024-05-17/1/a", parsed.files.get(0).relativePath);
        assertEquals("StreamCrc32", parsed.files.get(0).checksumAlgorithm);
        assertEquals("2024-05-17T10:15:30Z", parsed.files.get(0).ingestionDate);
        assertFalse(success.toString().contains("failureKind"));

        ArchiveOutcome<String> failed = ArchiveOutcome.failure(ArchiveFailureKind.CATALOG_FAILURE, "Catalog down", null, List.of(record("b", 2)));
        ArchiveStatusReply failure = ArchiveStatusReply.fromString(ArchiveStatusReply.of(failed, "host-1", null, List.of(record("ignored", 1))).toString());
        assertEquals(ArchiveStatusReply.STATUS_FAILURE, failure.status);
        assertEquals("CATALOG_FAILURE", failure.failureKind);
        assertNull(failure.volumeId);
        assertEquals(1, failure.files.size());
        assertEquals("b", failure.files.get(0).fileId);
    }
}
