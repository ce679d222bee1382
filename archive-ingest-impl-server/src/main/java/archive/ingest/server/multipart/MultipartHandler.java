package archive.ingest.server.multipart;

import java.io.IOException;

/**
 * Receives the structure and content of a (possibly nested) multipart archive request, in document order.
 * <p>
 * Calls are properly nested: every {@code startContainer} is matched by an {@code endContainer}, every
 * {@code startFile} by an {@code endFile}, and {@code fileData} is only called between the two.
 */
public interface MultipartHandler {

    void startContainer(String name) throws IOException;

    void endContainer() throws IOException;

    void startFile(String fileName) throws IOException;

    /**
     * Passes the next chunk of the current file. The buffer is reused after the call returns.
     */
    void fileData(byte[] buffer, int offset, int length) throws IOException;

    void endFile() throws IOException;
}
