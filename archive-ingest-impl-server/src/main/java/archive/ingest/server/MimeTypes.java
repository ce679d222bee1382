package archive.ingest.server;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Determines the MIME type of a file from its name, for clients that do not declare one.
 */
public final class MimeTypes {
    public static final String DEFAULT = "application/octet-stream";

    // longest extensions first
    private static final Map<String, String> BY_EXTENSION = new LinkedHashMap<>();

    static {
        BY_EXTENSION.put(".fits.gz", "application/x-gfits");
        BY_EXTENSION.put(".fits.z", "application/x-cfits");
        BY_EXTENSION.put(".tar.gz", "application/x-gtar");
        BY_EXTENSION.put(".fits", "image/x-fits");
        BY_EXTENSION.put(".fit", "image/x-fits");
        BY_EXTENSION.put(".tar", "application/x-tar");
        BY_EXTENSION.put(".gz", "application/gzip");
        BY_EXTENSION.put(".zip", "application/zip");
        BY_EXTENSION.put(".txt", "text/plain");
        BY_EXTENSION.put(".log", "text/plain");
        BY_EXTENSION.put(".csv", "text/csv");
        BY_EXTENSION.put(".xml", "text/xml");
        BY_EXTENSION.put(".json", "application/json");
        BY_EXTENSION.put(".pdf", "application/pdf");
        BY_EXTENSION.put(".png", "image/png");
        BY_EXTENSION.put(".jpg", "image/jpeg");
        BY_EXTENSION.put(".jpeg", "image/jpeg");
    }

    public static String guess(String fileName) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, String> entry : BY_EXTENSION.entrySet()) {
            if (lower.endsWith(entry.getKey())) {
                return entry.getValue();
            }
        }
        return DEFAULT;
    }

    private MimeTypes() {
    }
}
