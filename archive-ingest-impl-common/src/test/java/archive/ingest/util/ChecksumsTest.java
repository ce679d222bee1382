package archive.ingest.util;

import archive.ingest.common.ChecksumAccumulator;
import archive.ingest.common.ChecksumAlgorithm;
import archive.ingest.data.ChecksumCalculatingInputStream;
import archive.ingest.data.ChecksumCalculatingOutputStream;
import org.junit.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.zip.CRC32;

import static org.junit.Assert.*;

public class ChecksumsTest {

    private static final byte[] DATA = "The quick brown fox jumps over the lazy dog".getBytes(StandardCharsets.US_ASCII);

    @Test
    public void testCrc32MatchesJdk() {
        ChecksumAccumulator accumulator = Checksums.newAccumulator(ChecksumAlgorithm.CRC32);
        accumulator.update(DATA, 0, DATA.length);
        CRC32 crc = new CRC32();
        crc.update(DATA);
        assertEquals(Long.toString(crc.getValue()), accumulator.getValue());
        assertEquals("1095738169", accumulator.getValue());
        assertEquals(DATA.length, accumulator.getByteCount());
    }

    @Test
    public void testMd5KnownValue() {
        ChecksumAccumulator accumulator = Checksums.newAccumulator(ChecksumAlgorithm.MD5);
        accumulator.update(DATA, 0, DATA.length);
        assertEquals("9e107d9d372bb6826bd81d3542a419d6", accumulator.getValue());
        // reading the value must not reset the accumulator
        assertEquals("9e107d9d372bb6826bd81d3542a419d6", accumulator.getValue());
    }

    @Test
    public void testChunkingDoesNotMatter() {
        for (ChecksumAlgorithm algorithm : ChecksumAlgorithm.values()) {
            ChecksumAccumulator whole = Checksums.newAccumulator(algorithm);
            whole.update(DATA, 0, DATA.length);

            ChecksumAccumulator pieces = Checksums.newAccumulator(algorithm);
            pieces.update(DATA, 0, 10);
            pieces.update(DATA[10]);
            pieces.update(DATA, 11, DATA.length - 11);

            assertEquals(algorithm.name(), whole.getValue(), pieces.getValue());
        }
    }

    @Test
    public void testStreamsShareOneAccumulator() throws IOException {
        // head read from an existing file, tail written afterwards: same result as a single pass
        ChecksumAccumulator accumulator = Checksums.newAccumulator(ChecksumAlgorithm.CRC32);
        try (InputStream in = new ChecksumCalculatingInputStream(new ByteArrayInputStream(DATA, 0, 20), accumulator)) {
            assertEquals(20, in.skip(20));
        }
        ChecksumCalculatingOutputStream out = new ChecksumCalculatingOutputStream(new ByteArrayOutputStream(), accumulator);
        try (out) {
            out.write(DATA, 20, DATA.length - 20);
        }
        assertEquals(DATA.length - 20, out.getBytesWritten());

        ChecksumAccumulator single = Checksums.newAccumulator(ChecksumAlgorithm.CRC32);
        single.update(DATA, 0, DATA.length);
        assertEquals(single.getValue(), out.getChecksum());
    }

    @Test(expected = IllegalStateException.class)
    public void testChecksumRequiresClose() throws IOException {
        OutputStream out = new ChecksumCalculatingOutputStream(new ByteArrayOutputStream(), Checksums.newAccumulator(ChecksumAlgorithm.MD5));
        out.write(1);
        ((ChecksumCalculatingOutputStream) out).getChecksum();
    }
}
