package archive.ingest.data;

import org.junit.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;

import static org.junit.Assert.assertEquals;

public class SizeLimitedInputStreamTest {

    private static byte[] createData(int size) {
        byte[] data = new byte[size];
        for (int i = 0; i < size; i++) data[i] = (byte) i;
        return data;
    }

    @Test
    public void testStopsAtLimit() throws IOException {
        byte[] original = createData(100);
        SizeLimitedInputStream limited = new SizeLimitedInputStream(new ByteArrayInputStream(original), 30);

        byte[] buffer = new byte[50]; // deliberately larger than limit
        int total = 0;
        int read;
        while ((read = limited.read(buffer)) != -1) {
            for (int i = 0; i < read; i++) {
                assertEquals(original[total + i], buffer[i]);
            }
            total += read;
        }

        assertEquals(30, total);
        assertEquals(30, limited.getBytesRead());
        assertEquals(-1, limited.read());
    }

    @Test
    public void testDelegateEndingBeforeLimit() throws IOException {
        // "unknown size" is modeled as a huge limit: the stream must simply end with its delegate
        SizeLimitedInputStream limited = new SizeLimitedInputStream(new ByteArrayInputStream(createData(25)), 100_000_000_000L);
        byte[] all = limited.readAllBytes();
        assertEquals(25, all.length);
        assertEquals(25, limited.getBytesRead());
    }

    @Test
    public void testSingleByteReads() throws IOException {
        InputStream limited = new SizeLimitedInputStream(new ByteArrayInputStream(new byte[]{42, 43, 44}), 2);
        assertEquals(42, limited.read());
        assertEquals(43, limited.read());
        assertEquals(-1, limited.read());
    }

    @Test
    public void testZeroLimit() throws IOException {
        SizeLimitedInputStream limited = new SizeLimitedInputStream(new ByteArrayInputStream(createData(5)), 0);
        assertEquals(-1, limited.read(new byte[5], 0, 5));
        assertEquals(0, limited.getBytesRead());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeLimitThrows() {
        new SizeLimitedInputStream(new ByteArrayInputStream(new byte[0]), -1);
    }

    @SuppressWarnings("resource")
    @Test(expected = NullPointerException.class)
    public void testNullDelegateThrows() {
        new SizeLimitedInputStream(null, 10);
    }
}
