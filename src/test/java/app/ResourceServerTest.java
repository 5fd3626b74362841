package app;

import api.impl.SocketHttpServer;
import api.impl.handlers.HandlerFactory;
import com.google.gson.JsonElement;
import com.google.gson.JsonParser;
import infrastructure.impl.InMemoryResourceStore;
import infrastructure.impl.ResourceServiceImpl;
import org.junit.jupiter.api.*;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/** End to end over a real socket: one server for the class, tests run in order against shared state. */
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
class ResourceServerTest {

    private static final String DEFAULT_JSON =
            "{\"name\":\"example_resource\",\"location\":\"my_computer\",\"endpoints\":2,\"has_values\":true}";

    private static SocketHttpServer server;
    private static int port;

    @BeforeAll
    static void startServer() throws Exception {
        server = new SocketHttpServer(new HandlerFactory(new ResourceServiceImpl(new InMemoryResourceStore())));
        server.start(0);
        port = server.port();
    }

    @AfterAll
    static void stopServer() throws Exception {
        if (server != null) server.close();
    }

    // ---- utilities ----
    private static String send(String method, String target, String body) throws IOException {
        byte[] bytes = body == null ? new byte[0] : body.getBytes(StandardCharsets.UTF_8);
        String head = method + " " + target + " HTTP/1.1\r\n" +
                "Host: localhost:" + port + "\r\n" +
                (body == null ? "" : "Content-Type: application/json\r\n") +
                "Content-Length: " + bytes.length + "\r\n" +
                "Connection: close\r\n\r\n";
        try (Socket s = new Socket("localhost", port)) {
            OutputStream out = s.getOutputStream();
            InputStream in = s.getInputStream();
            out.write(head.getBytes(StandardCharsets.UTF_8));
            out.write(bytes);
            out.flush();
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private static int status(String resp) {
        return Integer.parseInt(resp.substring("HTTP/1.1 ".length(), "HTTP/1.1 ".length() + 3));
    }

    private static String body(String resp) {
        int i = resp.indexOf("\r\n\r\n");
        return i < 0 ? "" : resp.substring(i + 4);
    }

    private static void assertJsonBody(String expected, String resp) {
        JsonElement want = JsonParser.parseString(expected);
        assertEquals(want, JsonParser.parseString(body(resp)), resp);
    }

    // ---- tests ----
    @Test @Order(1)
    void rootIsOnline() throws Exception {
        String resp = send("GET", "/", null);
        assertEquals(200, status(resp));
        assertTrue(resp.contains("Content-Type: application/json"), resp);
        assertEquals("{\"status\":\"online\",\"nest\":{\"test\":5}}", body(resp));
    }

    @Test @Order(2)
    void getReturnsDefaults() throws Exception {
        String resp = send("GET", "/test_resource", null);
        assertEquals(200, status(resp));
        assertJsonBody(DEFAULT_JSON, resp);
    }

    @Test @Order(3)
    void getWithQueryEchoesExtras() throws Exception {
        String resp = send("GET", "/test_resource?first=a&second=b", null);
        assertEquals(200, status(resp));
        assertJsonBody("{\"resource\":" + DEFAULT_JSON + ",\"extras\":{\"first\":\"a\",\"second\":\"b\"}}", resp);
    }

    @Test @Order(4)
    void putBogusFieldIsRejectedAndNothingChanges() throws Exception {
        String resp = send("PUT", "/test_resource", "{\"bogus\":1}");
        assertEquals(400, status(resp));
        assertJsonBody("{\"error\":\"bad body param\"}", resp);
        assertJsonBody(DEFAULT_JSON, send("GET", "/test_resource", null));
    }

    @Test @Order(5)
    void putNameUpdatesOnlyName() throws Exception {
        String resp = send("PUT", "/test_resource", "{\"name\":\"x\"}");
        assertEquals(200, status(resp));
        String expected = "{\"name\":\"x\",\"location\":\"my_computer\",\"endpoints\":2,\"has_values\":true}";
        assertJsonBody(expected, resp);
        assertJsonBody(expected, send("GET", "/test_resource", null));
    }

    @Test @Order(6)
    void postBuildsNewRecordWithoutStoringIt() throws Exception {
        String resp = send("POST", "/test_resource",
                "{\"name\":\"p\",\"location\":\"q\",\"endpoints\":3,\"has_values\":false}");
        assertEquals(201, status(resp));
        assertJsonBody("{\"name\":\"p\",\"location\":\"q\",\"endpoints\":3,\"has_values\":false}", resp);

        assertJsonBody("{\"name\":\"x\",\"location\":\"my_computer\",\"endpoints\":2,\"has_values\":true}",
                send("GET", "/test_resource", null));
    }

    @Test @Order(7)
    void postMissingEndpointsIs400() throws Exception {
        String resp = send("POST", "/test_resource", "{\"name\":\"p\",\"location\":\"q\",\"has_values\":false}");
        assertEquals(400, status(resp));
        assertJsonBody("{\"error\":\"missing field endpoints\"}", resp);
    }

    @Test @Order(8)
    void deleteIs200WithEmptyBody() throws Exception {
        String resp = send("DELETE", "/test_resource", null);
        assertEquals(200, status(resp));
        assertTrue(resp.contains("Content-Length: 0\r\n"), resp);
        assertEquals("", body(resp));
    }

    @Test @Order(9)
    void malformedJsonAndOddMethodsAre400() throws Exception {
        String bad = send("PUT", "/test_resource", "{not json");
        assertEquals(400, status(bad));
        assertJsonBody("{\"error\":\"invalid json\"}", bad);

        String patch = send("PATCH", "/test_resource", "{}");
        assertEquals(400, status(patch));
        assertJsonBody("{\"error\":\"unsupported method\"}", patch);
    }

    @Test @Order(10)
    void unknownPathIs404() throws Exception {
        assertEquals(404, status(send("GET", "/missing", null)));
    }

    @Test @Order(11)
    void unquotedJsonDoesNotReachTheRecord() throws Exception {
        String resp = send("PUT", "/test_resource", "{name: hacked}");
        assertEquals(400, status(resp));
        assertJsonBody("{\"error\":\"invalid json\"}", resp);
        assertJsonBody("{\"name\":\"x\",\"location\":\"my_computer\",\"endpoints\":2,\"has_values\":true}",
                send("GET", "/test_resource", null));
    }

    @Test @Order(12)
    void lowercaseMethodIsUnsupported() throws Exception {
        String resp = send("get", "/test_resource", null);
        assertEquals(400, status(resp));
        assertJsonBody("{\"error\":\"unsupported method\"}", resp);
    }

    @Test @Order(13)
    void oversizedBodyIsRefused() throws Exception {
        String head = "PUT /test_resource HTTP/1.1\r\n" +
                "Host: localhost:" + port + "\r\n" +
                "Content-Length: 999999999\r\n\r\n";
        String resp;
        try (Socket s = new Socket("localhost", port)) {
            s.getOutputStream().write(head.getBytes(StandardCharsets.US_ASCII));
            s.getOutputStream().flush();
            resp = new String(s.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
        }
        assertEquals(400, status(resp));
        assertJsonBody("{\"error\":\"request too large\"}", resp);
    }

    @Test
    void portResolution() {
        assertEquals(8081, ResourceServer.resolvePort(new String[]{"8081"}));
        assertEquals(ResourceServer.DEFAULT_PORT, ResourceServer.resolvePort(new String[0]));
        assertThrows(IllegalArgumentException.class, () -> ResourceServer.resolvePort(new String[]{"abc"}));
        assertThrows(IllegalArgumentException.class, () -> ResourceServer.resolvePort(new String[]{"70000"}));
    }
}
