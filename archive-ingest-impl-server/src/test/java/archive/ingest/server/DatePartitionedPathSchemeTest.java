package archive.ingest.server;

import org.junit.Test;

import java.time.Instant;

import static org.junit.Assert.*;

public class DatePartitionedPathSchemeTest {

    @Test
    public void testRelativePathUsesUtcDate() {
        DatePartitionedPathScheme scheme = new DatePartitionedPathScheme();
        assertEquals("2024-05-17/1/obs.fits", scheme.relativePath(Instant.parse("2024-05-17T23:59:59Z"), 1, "obs.fits"));
        assertEquals("2024-05-18/12/obs.fits", scheme.relativePath(Instant.parse("2024-05-18T00:00:00Z"), 12, "obs.fits"));
    }

    @Test
    public void testMimeTypeGuess() {
        assertEquals("image/x-fits", MimeTypes.guess("OBS.FITS"));
        assertEquals("application/x-gfits", MimeTypes.guess("obs.fits.gz"));
        assertEquals("application/gzip", MimeTypes.guess("logs.gz"));
        assertEquals(MimeTypes.DEFAULT, MimeTypes.guess("README"));
    }
}
