package archive.ingest.server;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Places stored files under {@code <YYYY-MM-DD>/<version>/<fileName>}, relative to the mount point of their volume.
 * The date is the ingestion date in UTC.
 */
public class DatePartitionedPathScheme {
    private static final DateTimeFormatter DATE = DateTimeFormatter.ISO_LOCAL_DATE.withZone(ZoneOffset.UTC);

    public String relativePath(Instant ingestionDate, int fileVersion, String fileName) {
        return DATE.format(ingestionDate) + "/" + fileVersion + "/" + fileName;
    }
}
