package archive.ingest.server.multipart;

import archive.ingest.data.SizeLimitedInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Streaming parser for (nested) MIME multipart archive requests.
 * <p>
 * The body is read in a single pass, and at most {@code maxBytes} bytes are consumed. An entity whose
 * content type is {@code multipart/*} becomes a container, named by the {@code container_name} parameter of
 * its {@code Content-Disposition} header; any other entity becomes a file, named by the {@code filename}
 * parameter. File content is passed to the {@link MultipartHandler} as it is read, without buffering whole parts.
 * <p>
 * Instances are single-use.
 */
public class MimeMultipartParser {
    private static final Logger logger = LoggerFactory.getLogger(MimeMultipartParser.class);

    private static final byte[] DASH_DASH = {'-', '-'};
    private static final int MAX_HEADER_LINE_LENGTH = 8192;
    private static final int MIN_BUFFER_SIZE = 1024;

    private static final DataSink DISCARD = (buffer, offset, length) -> {
    };

    private final MultipartHandler handler;
    private final SizeLimitedInputStream input;
    private final byte[] buffer;
    private int position;
    private int limit;
    private boolean endOfInput;
    private long readingTimeNanos;

    /**
     * @param handler   receiver of the parsed structure
     * @param input     the request body
     * @param maxBytes  maximum number of bytes to consume from the body
     * @param blockSize number of bytes to read at once
     */
    public MimeMultipartParser(MultipartHandler handler, InputStream input, long maxBytes, int blockSize) {
        this.handler = Objects.requireNonNull(handler);
        this.input = new SizeLimitedInputStream(input, maxBytes);
        if (blockSize < 1) {
            throw new IllegalArgumentException("Block size must be greater than 0");
        }
        this.buffer = new byte[Math.max(blockSize, MIN_BUFFER_SIZE)];
    }

    /**
     * Parses the body as a MIME entity (headers, then content).
     *
     * @throws MultipartParseException if the body is not a well-formed archive request
     * @throws IOException             if reading, or one of the handler callbacks, fails
     */
    public void parse() throws IOException {
        parseEntity(null);
        logger.debug("Parsed multipart body: {} bytes read", getBytesRead());
    }

    /**
     * Treats the whole body as the content of a single file, placed in a container of the same name.
     *
     * @param fileName name of the file and of its container
     * @throws IOException if reading, or one of the handler callbacks, fails
     */
    public void parseSingleFile(String fileName) throws IOException {
        handler.startContainer(fileName);
        handler.startFile(fileName);
        copyUntil(null, handler::fileData);
        handler.endFile();
        handler.endContainer();
    }

    public long getBytesRead() {
        return input.getBytesRead();
    }

    /**
     * @return time spent waiting for the body, in milliseconds
     */
    public long getReadingTimeMillis() {
        return readingTimeNanos / 1_000_000L;
    }

    private void parseEntity(byte[] outerDelimiter) throws IOException {
        MimeHeaders headers = readHeaders();
        if (headers.isMultipart()) {
            String boundary = headers.getContentTypeParameter("boundary");
            if (boundary == null || boundary.isEmpty()) {
                throw new MultipartParseException("Multipart entity without boundary: " + headers);
            }
            String containerName = headers.getDispositionParameter("container_name");
            if (containerName == null || containerName.isEmpty()) {
                throw new MultipartParseException("Multipart entity without container name: " + headers);
            }
            parseContainer(containerName, boundary);
            // epilogue
            boolean found = copyUntil(outerDelimiter, DISCARD);
            if (outerDelimiter != null && !found) {
                throw new MultipartParseException("Unexpected end of input after container " + containerName);
            }
        } else {
            String fileName = headers.getDispositionParameter("filename");
            if (fileName == null || fileName.isEmpty()) {
                throw new MultipartParseException("Body part without file name: " + headers);
            }
            handler.startFile(fileName);
            boolean found = copyUntil(outerDelimiter, handler::fileData);
            if (outerDelimiter != null && !found) {
                throw new MultipartParseException("Unexpected end of input in file " + fileName);
            }
            handler.endFile();
        }
    }

    private void parseContainer(String name, String boundary) throws IOException {
        byte[] dashBoundary = ("--" + boundary).getBytes(StandardCharsets.ISO_8859_1);
        byte[] delimiter = ("\r\n--" + boundary).getBytes(StandardCharsets.ISO_8859_1);
        logger.debug("Start of container {}", name);
        handler.startContainer(name);
        // the first boundary may directly follow the headers, otherwise there is a preamble
        if (!consumeIfNext(dashBoundary) && !copyUntil(delimiter, DISCARD)) {
            throw new MultipartParseException("No body part found in container " + name);
        }
        while (!consumeIfNext(DASH_DASH)) {
            // rest of the boundary line (transport padding)
            if (readLine() == null) {
                throw new MultipartParseException("Unexpected end of input after boundary in container " + name);
            }
            parseEntity(delimiter);
        }
        handler.endContainer();
        logger.debug("End of container {}", name);
    }

    private MimeHeaders readHeaders() throws IOException {
        List<String> lines = new ArrayList<>();
        String line;
        while ((line = readLine()) != null) {
            if (line.isEmpty()) {
                return MimeHeaders.parse(lines);
            }
            lines.add(line);
        }
        throw new MultipartParseException("Unexpected end of input in entity headers");
    }

    // Returns null at end of input, otherwise the line without its terminator.
    private String readLine() throws IOException {
        ByteArrayOutputStream line = new ByteArrayOutputStream();
        while (true) {
            if (position >= limit && !fill()) {
                return line.size() == 0 ? null : toLine(line);
            }
            byte b = buffer[position++];
            if (b == '\n') {
                return toLine(line);
            }
            line.write(b);
            if (line.size() > MAX_HEADER_LINE_LENGTH) {
                throw new MultipartParseException("Header line exceeds " + MAX_HEADER_LINE_LENGTH + " bytes");
            }
        }
    }

    private static String toLine(ByteArrayOutputStream bytes) {
        String line = new String(bytes.toByteArray(), StandardCharsets.ISO_8859_1);
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }

    private boolean consumeIfNext(byte[] expected) throws IOException {
        while (limit - position < expected.length) {
            if (!fill()) {
                return false;
            }
        }
        for (int i = 0; i < expected.length; i++) {
            if (buffer[position + i] != expected[i]) {
                return false;
            }
        }
        position += expected.length;
        return true;
    }

    /**
     * Passes all bytes up to the next occurrence of the delimiter to the sink, and consumes the delimiter.
     * A null delimiter copies everything up to the end of input.
     *
     * @return true if the delimiter was found, false if the end of input was reached first
     */
    private boolean copyUntil(byte[] delimiter, DataSink sink) throws IOException {
        if (delimiter == null) {
            do {
                if (position < limit) {
                    sink.write(buffer, position, limit - position);
                    position = limit;
                }
            } while (fill());
            return false;
        }
        while (true) {
            int index = indexOf(delimiter);
            if (index >= 0) {
                if (index > position) {
                    sink.write(buffer, position, index - position);
                }
                position = index + delimiter.length;
                return true;
            }
            // the tail may be the beginning of a delimiter
            int safeEnd = Math.max(position, limit - delimiter.length + 1);
            if (safeEnd > position) {
                sink.write(buffer, position, safeEnd - position);
                position = safeEnd;
            }
            if (!fill()) {
                if (position < limit) {
                    sink.write(buffer, position, limit - position);
                    position = limit;
                }
                return false;
            }
        }
    }

    private int indexOf(byte[] pattern) {
        int last = limit - pattern.length;
        outer:
        for (int i = position; i <= last; i++) {
            for (int j = 0; j < pattern.length; j++) {
                if (buffer[i + j] != pattern[j]) {
                    continue outer;
                }
            }
            return i;
        }
        return -1;
    }

    // Compacts the buffer and reads more data; returns false at end of input.
    private boolean fill() throws IOException {
        if (endOfInput) {
            return false;
        }
        if (position > 0) {
            System.arraycopy(buffer, position, buffer, 0, limit - position);
            limit -= position;
            position = 0;
        }
        if (limit == buffer.length) {
            throw new MultipartParseException("Boundary too long for block size " + buffer.length);
        }
        long start = System.nanoTime();
        int n = input.read(buffer, limit, buffer.length - limit);
        readingTimeNanos += System.nanoTime() - start;
        if (n < 0) {
            endOfInput = true;
            return false;
        }
        limit += n;
        return true;
    }

    @FunctionalInterface
    private interface DataSink {
        void write(byte[] buffer, int offset, int length) throws IOException;
    }
}
