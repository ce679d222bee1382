package archive.ingest.server.multipart;

import archive.ingest.server.test.MultipartBodies;
import org.junit.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static archive.ingest.server.test.MultipartBodies.container;
import static archive.ingest.server.test.MultipartBodies.file;
import static org.junit.Assert.*;

public class MimeMultipartParserTest {

    private static class RecordingHandler implements MultipartHandler {
        final List<String> events = new ArrayList<>();
        final Map<String, byte[]> files = new LinkedHashMap<>();
        private String currentFile;
        private ByteArrayOutputStream currentContent;

        @Override
        public void startContainer(String name) {
            events.add("start " + name);
        }

        @Override
        public void endContainer() {
            events.add("end");
        }

        @Override
        public void startFile(String fileName) {
            events.add("file " + fileName);
            currentFile = fileName;
            currentContent = new ByteArrayOutputStream();
        }

        @Override
        public void fileData(byte[] buffer, int offset, int length) {
            currentContent.write(buffer, offset, length);
        }

        @Override
        public void endFile() {
            files.put(currentFile, currentContent.toByteArray());
        }
    }

    private RecordingHandler parse(byte[] body, int blockSize) throws IOException {
        RecordingHandler handler = new RecordingHandler();
        new MimeMultipartParser(handler, new ByteArrayInputStream(body), Long.MAX_VALUE, blockSize).parse();
        return handler;
    }

    @Test
    public void testNestedContainers() throws IOException {
        byte[] f1 = MultipartBodies.randomBytes(100, 1);
        byte[] f2 = MultipartBodies.randomBytes(200, 2);
        byte[] body = container("A", "outer-boundary",
                file("f1", f1),
                container("B", "inner-boundary", file("f2", f2)));

        RecordingHandler handler = parse(body, 64);

        assertEquals(List.of("start A", "file f1", "start B", "file f2", "end", "end"), handler.events);
        assertArrayEquals(f1, handler.files.get("f1"));
        assertArrayEquals(f2, handler.files.get("f2"));
    }

    @Test
    public void testLargePartsAcrossBufferBoundaries() throws IOException {
        // content containing near-miss delimiter sequences
        ByteArrayOutputStream content = new ByteArrayOutputStream();
        for (int i = 0; i < 500; i++) {
            content.writeBytes(("line " + i + "\r\n--bound\r\n-").getBytes(StandardCharsets.ISO_8859_1));
        }
        byte[] large = content.toByteArray();
        byte[] body = container("root", "boundary", file("large.txt", large), file("empty.txt", new byte[0]));

        RecordingHandler handler = parse(body, 1);

        assertArrayEquals(large, handler.files.get("large.txt"));
        assertEquals(0, handler.files.get("empty.txt").length);
        assertEquals(List.of("start root", "file large.txt", "file empty.txt", "end"), handler.events);
    }

    @Test
    public void testPreambleAndEpilogueAreDiscarded() throws IOException {
        String body = "Content-Type: multipart/mixed; boundary=xyz\r\n" +
                "Content-Disposition: attachment; container_name=c\r\n" +
                "\r\n" +
                "This is the preamble.\r\n" +
                "--xyz\r\n" +
                "Content-Disposition: attachment; filename=\"a.txt\"\r\n" +
                "\r\n" +
                "hello\r\n" +
                "--xyz--\r\n" +
                "This is the epilogue.\r\n";

        RecordingHandler handler = parse(body.getBytes(StandardCharsets.ISO_8859_1), 16);

        assertEquals(List.of("start c", "file a.txt", "end"), handler.events);
        assertEquals("hello", new String(handler.files.get("a.txt"), StandardCharsets.ISO_8859_1));
    }

    @Test
    public void testMaxBytesLimitsReading() throws IOException {
        byte[] body = container("root", "b", file("a", "abc".getBytes(StandardCharsets.ISO_8859_1)));
        byte[] withTrailer = Arrays.copyOf(body, body.length + 100);
        RecordingHandler handler = new RecordingHandler();
        MimeMultipartParser parser = new MimeMultipartParser(handler, new ByteArrayInputStream(withTrailer), body.length, 1024);

        parser.parse();

        assertEquals(body.length, parser.getBytesRead());
    }

    @Test
    public void testSingleFile() throws IOException {
        byte[] content = MultipartBodies.randomBytes(3000, 3);
        RecordingHandler handler = new RecordingHandler();
        MimeMultipartParser parser = new MimeMultipartParser(handler, new ByteArrayInputStream(content), Long.MAX_VALUE, 512);

        parser.parseSingleFile("data.bin");

        assertEquals(List.of("start data.bin", "file data.bin", "end"), handler.events);
        assertArrayEquals(content, handler.files.get("data.bin"));
        assertEquals(3000, parser.getBytesRead());
    }

    @Test
    public void testMissingBoundary() {
        String body = "Content-Type: multipart/mixed\r\n" +
                "Content-Disposition: attachment; container_name=c\r\n\r\n";
        assertThrows(MultipartParseException.class, () -> parse(body.getBytes(StandardCharsets.ISO_8859_1), 64));
    }

    @Test
    public void testMissingFileName() {
        byte[] part = ("Content-Type: text/plain\r\n\r\nno name").getBytes(StandardCharsets.ISO_8859_1);
        byte[] body = container("c", "b", part);
        assertThrows(MultipartParseException.class, () -> parse(body, 64));
    }

    @Test
    public void testPrematureEndOfInput() {
        byte[] body = container("c", "b", file("a.txt", MultipartBodies.randomBytes(1000, 4)));
        byte[] truncated = Arrays.copyOf(body, 600);
        MultipartParseException e = assertThrows(MultipartParseException.class, () -> parse(truncated, 64));
        assertTrue(e.getMessage(), e.getMessage().contains("a.txt"));
    }
}
