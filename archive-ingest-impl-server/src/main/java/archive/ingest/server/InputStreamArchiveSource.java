package archive.ingest.server;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.TreeMap;

/**
 * The body of a pushed archive request, as handed over by the transport layer.
 */
public class InputStreamArchiveSource implements ArchiveSource {
    private final InputStream input;
    private final long declaredLength;
    private final Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    private boolean opened;

    /**
     * @param input          the request body
     * @param declaredLength length declared by the client, or a negative value if unknown
     */
    public InputStreamArchiveSource(InputStream input, long declaredLength) {
        this(input, declaredLength, Map.of());
    }

    public InputStreamArchiveSource(InputStream input, long declaredLength, Map<String, String> headers) {
        this.input = Objects.requireNonNull(input);
        this.declaredLength = declaredLength;
        this.headers.putAll(headers);
    }

    @Override
    public synchronized InputStream openStream() throws IOException {
        if (opened) {
            throw new IOException("Request body was already consumed");
        }
        opened = true;
        return input;
    }

    @Override
    public OptionalLong getDeclaredLength() {
        return declaredLength >= 0 ? OptionalLong.of(declaredLength) : OptionalLong.empty();
    }

    @Override
    public Optional<String> getHeader(String name) {
        return Optional.ofNullable(headers.get(name.toLowerCase(Locale.ROOT)));
    }

    @Override
    public void close() throws IOException {
        input.close();
    }
}
