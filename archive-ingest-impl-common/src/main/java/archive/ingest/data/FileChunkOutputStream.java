package archive.ingest.data;

import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.StandardOpenOption;

/**
 * An {@link OutputStream} writing to a {@link File} from a given position onwards, using a {@link FileChannel}.
 * <p>
 * Position 0 truncates the file. Content is forced to the storage device when the stream is closed, so a
 * successfully closed stream means the data is durable.
 */
@SuppressWarnings("NullableProblems") // silence IntelliJ-specific bogus warning
public class FileChunkOutputStream extends OutputStream {

    private final FileChannel channel;
    private final long startPosition;
    private long position;
    private boolean closed = false;

    FileChunkOutputStream(File file, long startPosition) throws IOException {
        if (startPosition == 0) {
            this.channel = FileChannel.open(file.toPath(), StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING);
        } else {
            this.channel = FileChannel.open(file.toPath(), StandardOpenOption.WRITE);
        }
        try {
            channel.position(startPosition);
        } catch (IOException e) {
            channel.close();
            throw e;
        }
        this.startPosition = startPosition;
        this.position = startPosition;
    }

    @Override
    public void write(int b) throws IOException {
        write(new byte[]{(byte) b}, 0, 1);
    }

    @Override
    public void write(byte[] b, int off, int len) throws IOException {
        ByteBuffer buffer = ByteBuffer.wrap(b, off, len);
        while (buffer.hasRemaining()) {
            position += channel.write(buffer);
        }
    }

    /**
     * @return the position where the next byte will be written, i.e. the file size so far
     */
    public long getPosition() {
        return position;
    }

    /**
     * @return number of bytes written through this stream
     */
    public long getBytesWritten() {
        return position - startPosition;
    }

    @Override
    public void close() throws IOException {
        if (!closed) {
            closed = true;
            try {
                channel.force(true);
            } finally {
                channel.close();
            }
        }
    }
}
