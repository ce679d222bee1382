package archive.ingest.server.multipart;

import java.io.IOException;

/**
 * Indicates that a request body does not follow the expected multipart structure.
 */
public class MultipartParseException extends IOException {
    public MultipartParseException(String message) {
        super(message);
    }
}
