package archive.ingest.server.multipart;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Header fields of one MIME entity, with lookup of header parameters such as
 * {@code boundary} or {@code filename}.
 */
public class MimeHeaders {
    public static final String CONTENT_TYPE = "content-type";
    public static final String CONTENT_DISPOSITION = "content-disposition";

    private final Map<String, String> fields;

    private MimeHeaders(Map<String, String> fields) {
        this.fields = fields;
    }

    /**
     * Parses header lines (without line terminators). Lines starting with whitespace continue the previous field.
     *
     * @param lines the raw header lines
     * @return the parsed headers
     * @throws MultipartParseException if a line is not a valid header field
     */
    public static MimeHeaders parse(List<String> lines) throws MultipartParseException {
        Map<String, String> fields = new LinkedHashMap<>();
        String lastName = null;
        for (String line : lines) {
            if (!line.isEmpty() && (line.charAt(0) == ' ' || line.charAt(0) == '\t')) {
                if (lastName == null) {
                    throw new MultipartParseException("Continuation line without header field: " + line);
                }
                fields.put(lastName, fields.get(lastName) + " " + line.trim());
                continue;
            }
            int colon = line.indexOf(':');
            if (colon <= 0) {
                throw new MultipartParseException("Invalid header line: " + line);
            }
            lastName = line.substring(0, colon).trim().toLowerCase(Locale.ROOT);
            fields.put(lastName, line.substring(colon + 1).trim());
        }
        return new MimeHeaders(fields);
    }

    public String get(String name) {
        return fields.get(name.toLowerCase(Locale.ROOT));
    }

    /**
     * @return the media type of the entity ({@code type/subtype}, lower case), or null if not declared
     */
    public String getMediaType() {
        String contentType = get(CONTENT_TYPE);
        if (contentType == null) {
            return null;
        }
        int semicolon = contentType.indexOf(';');
        return (semicolon >= 0 ? contentType.substring(0, semicolon) : contentType).trim().toLowerCase(Locale.ROOT);
    }

    public boolean isMultipart() {
        String mediaType = getMediaType();
        return mediaType != null && mediaType.startsWith("multipart/");
    }

    public String getContentTypeParameter(String parameter) {
        return getParameter(get(CONTENT_TYPE), parameter);
    }

    public String getDispositionParameter(String parameter) {
        return getParameter(get(CONTENT_DISPOSITION), parameter);
    }

    /**
     * Extracts a parameter from a structured header value like {@code attachment; filename="a b.fits"}.
     * Parameter names are case-insensitive, values may be quoted.
     *
     * @param headerValue the full header value, may be null
     * @param parameter   the parameter name
     * @return the parameter value, or null if absent
     */
    public static String getParameter(String headerValue, String parameter) {
        if (headerValue == null) {
            return null;
        }
        List<String> parts = splitUnquoted(headerValue);
        for (int i = 1; i < parts.size(); i++) {
            String part = parts.get(i).trim();
            int equals = part.indexOf('=');
            if (equals <= 0) {
                continue;
            }
            if (part.substring(0, equals).trim().equalsIgnoreCase(parameter)) {
                return unquote(part.substring(equals + 1).trim());
            }
        }
        return null;
    }

    private static List<String> splitUnquoted(String value) {
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '"') {
                quoted = !quoted;
            } else if (c == ';' && !quoted) {
                parts.add(current.toString());
                current.setLength(0);
                continue;
            }
            current.append(c);
        }
        parts.add(current.toString());
        return parts;
    }

    private static String unquote(String value) {
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            return value.substring(1, value.length() - 1).replace("\\\"", "\"");
        }
        return value;
    }

    @Override
    public String toString() {
        return "MimeHeaders" + fields;
    }
}
