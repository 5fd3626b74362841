package api.impl;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/** Reads one HTTP/1.1 request (request line, headers, Content-Length body) off a socket stream. */
public final class HttpRequestReader {

    /** Longest request or header line, CRLF excluded. */
    public static final int MAX_LINE_BYTES = 8 * 1024;
    public static final int MAX_HEADERS = 100;
    /** Largest Content-Length accepted. */
    public static final int MAX_BODY_BYTES = 1024 * 1024;

    /** Request exceeds one of the size limits; nothing past the offending part has been read. */
    public static class RequestTooLargeException extends IOException {
        public RequestTooLargeException(String message) {
            super(message);
        }
    }

    private HttpRequestReader() {}

    /**
     * @param out used only to answer {@code Expect: 100-continue}
     * @return the request, or null when the request line is missing or empty
     * @throws RequestTooLargeException when a line, the header count or Content-Length is over its limit
     */
    public static MinimalHttpRequest read(InputStream in, OutputStream out) throws IOException {
        String start = readLineAscii(in); // e.g. "PUT /test_resource HTTP/1.1"
        if (start == null || start.isEmpty()) return null;

        String[] p = start.split(" ", 3);
        String method = p[0];
        String target = p.length > 1 ? p[1] : "/";
        String ver    = p.length > 2 ? p[2] : "HTTP/1.1";

        Map<String,String> headers = new LinkedHashMap<>();
        String line;
        int count = 0;
        while ((line = readLineAscii(in)) != null && !line.isEmpty()) {
            if (++count > MAX_HEADERS) throw new RequestTooLargeException("too many headers");
            int idx = line.indexOf(':');
            if (idx > 0) {
                headers.put(line.substring(0, idx).trim().toLowerCase(), line.substring(idx + 1).trim());
            }
        }

        int len = contentLength(headers.get("content-length"));

        String expect = headers.get("expect");
        if (expect != null && expect.equalsIgnoreCase("100-continue")) {
            OutputStreamWriter w100 = new OutputStreamWriter(out, StandardCharsets.US_ASCII);
            w100.write("HTTP/1.1 100 Continue\r\n\r\n");
            w100.flush();
        }

        byte[] body = in.readNBytes(len);

        return new MinimalHttpRequest(method, target, ver, headers, body);
    }

    /** Missing or non-numeric means no body; negative counts as 0. */
    static int contentLength(String raw) throws RequestTooLargeException {
        if (raw == null) return 0;
        long len;
        try { len = Long.parseLong(raw.trim()); }
        catch (NumberFormatException e) {
            if (raw.trim().matches("\\d+")) throw new RequestTooLargeException("body too large");
            return 0;
        }
        if (len > MAX_BODY_BYTES) throw new RequestTooLargeException("body too large");
        return (int) Math.max(0L, len);
    }

    /** Reads up to CRLF; a bare LF also ends the line. Returns null at end of stream with nothing read. */
    static String readLineAscii(InputStream in) throws IOException {
        ByteArrayOutputStream buf = new ByteArrayOutputStream(128);
        int b;
        while ((b = in.read()) != -1) {
            if (b == '\n') {
                byte[] bytes = buf.toByteArray();
                int len = bytes.length;
                if (len > 0 && bytes[len - 1] == '\r') len--;
                return new String(bytes, 0, len, StandardCharsets.US_ASCII);
            }
            // one byte of slack for the CR
            if (buf.size() > MAX_LINE_BYTES) throw new RequestTooLargeException("line too long");
            buf.write(b);
        }
        return (buf.size() == 0) ? null : buf.toString(StandardCharsets.US_ASCII);
    }
}
