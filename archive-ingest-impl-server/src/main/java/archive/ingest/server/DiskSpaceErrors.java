package archive.ingest.server;

import java.io.IOException;
import java.util.Locale;

/**
 * Recognizes I/O errors caused by a full disk.
 */
public final class DiskSpaceErrors {
    private static final String[] OUT_OF_SPACE_MESSAGES = {
            "no space left on device",
            "not enough space on the disk",
    };

    /**
     * @param error any error
     * @return whether an {@link IOException} in the cause chain reports a full disk
     */
    public static boolean isOutOfSpace(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth++ < 32) {
            if (current instanceof IOException && current.getMessage() != null) {
                String message = current.getMessage().toLowerCase(Locale.ROOT);
                for (String outOfSpace : OUT_OF_SPACE_MESSAGES) {
                    if (message.contains(outOfSpace)) {
                        return true;
                    }
                }
            }
            current = current.getCause();
        }
        return false;
    }

    private DiskSpaceErrors() {
    }
}
