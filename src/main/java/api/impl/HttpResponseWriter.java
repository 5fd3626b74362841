package api.impl;

import api.interfaces.http.HttpResponse;
import com.google.gson.JsonObject;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

public final class HttpResponseWriter {

    private HttpResponseWriter() {}

    /**
     * Writes status line, headers and body in one go.
     * <p>
     * Fills in what the handler left out: {@code Connection: close}, {@code Content-Length}, and
     * for a non-empty body without a content type, JSON. Header names are matched ignoring case.
     */
    public static void write(OutputStream out, HttpResponseImpl res) throws IOException {
        byte[] body = res.body();
        if (!hasHeader(res, "Connection")) res.header("Connection", "close");
        if (!hasHeader(res, "Content-Length")) res.header("Content-Length", String.valueOf(body.length));
        if (body.length > 0 && !hasHeader(res, "Content-Type")) res.header("Content-Type", HttpResponse.JSON_UTF8);

        StringBuilder head = new StringBuilder(128);
        head.append("HTTP/1.1 ").append(res.status()).append(' ').append(res.reason()).append("\r\n");
        for (Map.Entry<String, String> e : res.headers().entrySet()) {
            head.append(e.getKey()).append(": ").append(e.getValue()).append("\r\n");
        }
        head.append("\r\n");

        out.write(head.toString().getBytes(StandardCharsets.US_ASCII));
        out.write(body);
        out.flush();
    }

    /** {@code {"error": message}} for requests rejected before any handler runs. */
    public static void writeJsonError(OutputStream out, int code, String message) throws IOException {
        JsonObject err = new JsonObject();
        err.addProperty("error", message);
        HttpResponseImpl res = new HttpResponseImpl();
        res.json(code, err.toString());
        write(out, res);
    }

    /** Short text/plain reply, used for an empty request line. */
    public static void writePlain(OutputStream out, int code, String body) throws IOException {
        HttpResponseImpl res = new HttpResponseImpl();
        res.status(code, null);
        res.header("Content-Type", "text/plain; charset=utf-8");
        res.body(body);
        write(out, res);
    }

    private static boolean hasHeader(HttpResponseImpl res, String name) {
        for (String k : res.headers().keySet()) {
            if (k.equalsIgnoreCase(name)) return true;
        }
        return false;
    }
}
