package app;

import api.impl.SocketHttpServer;
import api.impl.handlers.HandlerFactory;
import domain.interfaces.IResourceService;
import infrastructure.impl.InMemoryResourceStore;
import infrastructure.impl.ResourceServiceImpl;

public class ResourceServer {

    static final int DEFAULT_PORT = 5000;

    public static void main(String[] args) throws Exception {
        int port = resolvePort(args);

        IResourceService service = new ResourceServiceImpl(new InMemoryResourceStore());
        SocketHttpServer server = new SocketHttpServer(new HandlerFactory(service));
        server.start(port);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                server.close();
            } catch (Exception e) {
                System.err.println("[Server] close failed: " + e.getMessage());
            }
        }, "shutdown"));

        server.join();
    }

    /** First argument, then the PORT system property, then {@value #DEFAULT_PORT}. */
    static int resolvePort(String[] args) {
        String raw = (args != null && args.length > 0) ? args[0] : System.getProperty("PORT");
        if (raw == null || raw.isBlank()) return DEFAULT_PORT;
        try {
            int port = Integer.parseInt(raw.trim());
            if (port < 0 || port > 65535) throw new IllegalArgumentException("port out of range: " + port);
            return port;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("not a port number: " + raw, e);
        }
    }
}
