package api.impl;

import api.interfaces.http.HttpRequest;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public class MinimalHttpRequest implements HttpRequest {
    private final String method;
    private final String path;
    private final String version;
    private final Map<String,String> headers;
    private final Map<String,String> query;
    private final byte[] body;

    /**
     * @param target raw request target from the request line, e.g. {@code /test_resource?first=a}
     */
    public MinimalHttpRequest(String method, String target, String version,
                              Map<String,String> headers, byte[] body){
        this.method = method;
        this.version = version;
        this.headers = headers == null ? Collections.emptyMap() : headers;
        this.body = body == null ? new byte[0] : body;

        String t = (target == null || target.isEmpty()) ? "/" : target;
        int q = t.indexOf('?');
        this.path = q < 0 ? t : t.substring(0, q);
        this.query = q < 0 ? Collections.emptyMap() : parseQuery(t.substring(q + 1));
    }

    @Override public String method(){ return method; }
    @Override public String path(){ return path; }
    @Override public String version(){ return version; }

    @Override
    public String header(String name){
        if (name == null) return null;
        String v = headers.get(name);
        if (v != null) return v;
        for (Map.Entry<String,String> e : headers.entrySet()) {
            if (e.getKey().equalsIgnoreCase(name)) return e.getValue();
        }
        return null;
    }

    @Override
    public String query(String name) {
        return name == null ? null : query.get(name);
    }

    @Override public byte[] body() { return body; }

    /** Keeps the first value of a repeated key. */
    static Map<String,String> parseQuery(String raw) {
        Map<String,String> out = new LinkedHashMap<>();
        if (raw == null || raw.isEmpty()) return out;
        for (String pair : raw.split("&")) {
            if (pair.isEmpty()) continue;
            int eq = pair.indexOf('=');
            String k = decode(eq < 0 ? pair : pair.substring(0, eq));
            String v = eq < 0 ? "" : decode(pair.substring(eq + 1));
            out.putIfAbsent(k, v);
        }
        return out;
    }

    private static String decode(String s) {
        try {
            return URLDecoder.decode(s, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException badEscape) {
            // e.g. a lone '%', keep the raw text
            return s;
        }
    }
}
