package archive.ingest.server;

import archive.ingest.common.ArchiveConfiguration;
import archive.ingest.common.ArchiveFailureKind;
import archive.ingest.common.ArchiveOutcome;
import archive.ingest.common.FileRecord;
import archive.ingest.common.ServiceState;
import archive.ingest.common.Volume;
import archive.ingest.server.test.FailingInputStream;
import archive.ingest.server.test.InMemoryArchiveCatalog;
import archive.ingest.server.test.MultipartBodies;
import archive.ingest.server.test.RecordingSubscriptionNotifier;
import archive.ingest.server.test.TestingVolumes;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.AbstractMap;
import java.util.Arrays;
import java.util.List;
import java.util.zip.CRC32;

import static org.junit.Assert.*;

public class MirrorArchiveHandlerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-17T10:15:30Z"), ZoneOffset.UTC);
    private static final URI SOURCE = URI.create("http://remote.example.org:7777/RETRIEVE?file_id=X90/X1&file_version=2");

    private TestingVolumes volumes;
    private InMemoryArchiveCatalog catalog;
    private RecordingSubscriptionNotifier notifier;
    private MirrorArchiveHandler handler;
    private byte[] data;
    private File stagingFile;

    // failure injected into the next fetch: fail once this many bytes of the remote file were delivered, -1 for none
    private long failAt = -1;
    private String failMessage = "Connection reset";

    @Before
    public void setUp() throws IOException {
        volumes = new TestingVolumes();
        catalog = new InMemoryArchiveCatalog();
        notifier = new RecordingSubscriptionNotifier();
        catalog.addVolume(volumes.create("vol-small", "slot-1", 1_000L));
        catalog.addVolume(volumes.create("vol-large", "slot-2", 5_000L));
        data = MultipartBodies.randomBytes(500, 7);
        stagingFile = volumes.getBaseDirectory().resolve("mirror-staging").resolve("X1.part").toFile();

        FetchStrategy strategy = (source, offset) -> {
            InputStream in = new ByteArrayInputStream(data, (int) offset, data.length - (int) offset);
            return failAt >= 0 ? new FailingInputStream(in, failAt - offset, failMessage) : in;
        };
        handler = new MirrorArchiveHandler(new ArchiveConfiguration(), catalog, TestingVolumes.HOST_ID, notifier,
                path -> Long.MAX_VALUE, new DiskResourceLocks(), strategy, new BestFitVolumeSelector(), CLOCK);
    }

    @After
    public void tearDown() throws IOException {
        volumes.cleanup();
    }

    private MirrorRequest request() {
        return new MirrorRequest(SOURCE, stagingFile, "X90/X1", 2, "image/x-fits");
    }

    private static String crc32(byte[] bytes) {
        CRC32 crc = new CRC32();
        crc.update(bytes);
        return Long.toString(crc.getValue());
    }

    @Test
    public void testInterruptedTransferIsResumed() throws IOException {
        failAt = 300;
        ArchiveOutcome<FileRecord> interrupted = handler.archiveMirror(request(), ServiceState.ONLINE_IDLE, 0);

        assertEquals(ArchiveFailureKind.RESUMABLE, interrupted.getFailureKind());
        assertTrue(interrupted.getFailureKind().isRetryable());
        assertEquals(300, stagingFile.length());
        assertTrue(catalog.records.isEmpty());
        assertEquals(0, notifier.triggers.get());

        failAt = -1;
        ArchiveOutcome<FileRecord> resumed = handler.archiveMirror(request(), ServiceState.ONLINE_IDLE, 300);

        assertTrue(resumed.toString(), resumed.isSuccess());
        FileRecord record = resumed.getValue();
        assertEquals(crc32(data), record.getChecksum());
        assertEquals(500, record.getFileSize());
        assertEquals("X90/X1", record.getFileId());
        assertEquals(2, record.getFileVersion());
        assertEquals("image/x-fits", record.getFormat());
        assertEquals("vol-large", record.getVolumeId());
        assertEquals("2024-05-17/2/X1", record.getRelativePath());
        assertFalse(stagingFile.exists());

        Volume large = catalog.getVolume("vol-large");
        assertArrayEquals(data, Files.readAllBytes(Paths.get(large.getMountPoint()).resolve(record.getRelativePath())));
        assertEquals(500, large.getBytesStored());
        assertEquals(1, large.getNumberOfFiles());
        assertEquals(List.of(new AbstractMap.SimpleImmutableEntry<>("X90/X1", 2)), notifier.registered);
        assertEquals(1, notifier.triggers.get());
    }

    @Test
    public void testStartByteDerivedFromStagingFile() throws IOException {
        Files.createDirectories(stagingFile.getParentFile().toPath());
        Files.write(stagingFile.toPath(), Arrays.copyOf(data, 123));

        ArchiveOutcome<FileRecord> outcome = handler.archiveMirror(request(), ServiceState.ONLINE_IDLE);

        assertTrue(outcome.toString(), outcome.isSuccess());
        assertEquals(crc32(data), outcome.getValue().getChecksum());
        assertEquals(500, outcome.getValue().getFileSize());
    }

    @Test
    public void testStartByteMustMatchStagingFile() {
        assertThrows(IllegalArgumentException.class, () -> handler.archiveMirror(request(), ServiceState.ONLINE_IDLE, 100));
    }

    @Test
    public void testFailureWithoutDataIsPermanent() {
        failAt = 0;

        ArchiveOutcome<FileRecord> outcome = handler.archiveMirror(request(), ServiceState.ONLINE_IDLE, 0);

        assertEquals(ArchiveFailureKind.IO_FAILURE, outcome.getFailureKind());
        assertFalse(outcome.getFailureKind().isRetryable());
        assertFalse(stagingFile.exists());
    }

    @Test
    public void testOutOfSpaceCompletesVolume() {
        failAt = 200;
        failMessage = "No space left on device";

        ArchiveOutcome<FileRecord> outcome = handler.archiveMirror(request(), ServiceState.ONLINE_IDLE, 0);

        assertEquals(ArchiveFailureKind.DISK_EXHAUSTED, outcome.getFailureKind());
        assertFalse(stagingFile.exists());
        Volume large = catalog.getVolume("vol-large");
        assertTrue(large.isCompleted());
        assertEquals(CLOCK.instant(), large.getCompletionDate());

        // the next attempt goes to the other volume
        failAt = -1;
        ArchiveOutcome<FileRecord> retry = handler.archiveMirror(request(), ServiceState.ONLINE_IDLE, 0);
        assertTrue(retry.toString(), retry.isSuccess());
        assertEquals("vol-small", retry.getValue().getVolumeId());
    }

    @Test
    public void testNoVolumeAvailable() {
        for (String volumeId : List.of("vol-small", "vol-large")) {
            Volume volume = catalog.getVolume(volumeId);
            volume.setCompleted(true);
            catalog.updateVolume(volume);
        }

        ArchiveOutcome<FileRecord> outcome = handler.archiveMirror(request(), ServiceState.ONLINE_IDLE, 0);

        assertEquals(ArchiveFailureKind.NO_VOLUME_AVAILABLE, outcome.getFailureKind());
        assertFalse(stagingFile.exists());
    }

    @Test
    public void testOfflineServiceRejects() {
        ArchiveOutcome<FileRecord> outcome = handler.archiveMirror(request(), ServiceState.OFFLINE, 0);

        assertEquals(ArchiveFailureKind.CONFIGURATION_REJECTED, outcome.getFailureKind());
    }

    @Test
    public void testDuplicateIsCatalogFailure() {
        assertTrue(handler.archiveMirror(request(), ServiceState.ONLINE_IDLE, 0).isSuccess());

        // the same file version mirrored again on another day
        Clock nextDay = Clock.fixed(CLOCK.instant().plusSeconds(86_400), ZoneOffset.UTC);
        MirrorArchiveHandler laterHandler = new MirrorArchiveHandler(new ArchiveConfiguration(), catalog, TestingVolumes.HOST_ID,
                notifier, path -> Long.MAX_VALUE, new DiskResourceLocks(),
                (source, offset) -> new ByteArrayInputStream(data, (int) offset, data.length - (int) offset),
                new BestFitVolumeSelector(), nextDay);
        ArchiveOutcome<FileRecord> duplicate = laterHandler.archiveMirror(request(), ServiceState.ONLINE_IDLE, 0);

        assertEquals(ArchiveFailureKind.CATALOG_FAILURE, duplicate.getFailureKind());
        assertEquals(1, catalog.records.size());
        Volume large = catalog.getVolume("vol-large");
        assertTrue(Files.exists(Paths.get(large.getMountPoint()).resolve("2024-05-18/2/X1")));
    }

    @Test
    public void testSameDayDuplicateKeepsStagingFile() throws IOException {
        assertTrue(handler.archiveMirror(request(), ServiceState.ONLINE_IDLE, 0).isSuccess());
        Volume large = catalog.getVolume("vol-large");
        byte[] archived = Files.readAllBytes(Paths.get(large.getMountPoint()).resolve("2024-05-17/2/X1"));

        ArchiveOutcome<FileRecord> duplicate = handler.archiveMirror(request(), ServiceState.ONLINE_IDLE, 0);

        assertEquals(ArchiveFailureKind.CATALOG_FAILURE, duplicate.getFailureKind());
        assertEquals(1, catalog.records.size());
        // the fetched copy stays in place, as does the archived one
        assertArrayEquals(data, Files.readAllBytes(stagingFile.toPath()));
        assertArrayEquals(archived, Files.readAllBytes(Paths.get(large.getMountPoint()).resolve("2024-05-17/2/X1")));
        assertFalse(catalog.getVolume("vol-large").isCompleted());
        assertEquals(1, notifier.triggers.get());
    }
}
