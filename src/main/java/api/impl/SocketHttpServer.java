package api.impl;

import api.interfaces.IHandlerFactory;
import api.interfaces.IHttpHandler;
import api.interfaces.IHttpServer;
import api.interfaces.http.HttpResponse;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;

/**
 * Plain {@link ServerSocket} server: one thread per connection, one request per connection.
 * <p>
 * Handlers run on the connection thread; shared state is guarded by whatever the handlers use,
 * not by the server.
 */
public class SocketHttpServer implements IHttpServer {

    private final IHandlerFactory factory;
    private volatile ServerSocket server;
    private Thread acceptor;

    public SocketHttpServer(IHandlerFactory factory) {
        this.factory = factory;
    }

    @Override
    public void start(int port) throws IOException {
        if (server != null) throw new IllegalStateException("already started");
        server = new ServerSocket(port);
        System.out.println("[Server] listening on port " + server.getLocalPort());

        acceptor = new Thread(this::acceptLoop, "http-acceptor");
        acceptor.setDaemon(true);
        acceptor.start();
    }

    @Override
    public int port() {
        ServerSocket s = server;
        if (s == null) throw new IllegalStateException("not started");
        return s.getLocalPort();
    }

    /** Blocks until the accept loop ends, i.e. until {@link #close()}. */
    public void join() throws InterruptedException {
        if (acceptor != null) acceptor.join();
    }

    @Override
    public void close() throws IOException {
        ServerSocket s = server;
        if (s != null && !s.isClosed()) {
            s.close();
            System.out.println("[Server] stopped");
        }
    }

    private void acceptLoop() {
        ServerSocket s = server;
        while (!s.isClosed()) {
            try {
                Socket client = s.accept();
                Thread t = new Thread(() -> serve(client), "http-conn-" + client.getPort());
                t.setDaemon(true);
                t.start();
            } catch (IOException e) {
                if (!s.isClosed()) {
                    System.err.println("[Server] accept failed: " + e.getMessage());
                }
            }
        }
    }

    void serve(Socket socket) {
        try (socket;
             InputStream in = new BufferedInputStream(socket.getInputStream());
             OutputStream out = socket.getOutputStream()) {

            MinimalHttpRequest req;
            try {
                req = HttpRequestReader.read(in, out);
            } catch (HttpRequestReader.RequestTooLargeException e) {
                System.err.println("[Server] rejected request: " + e.getMessage());
                HttpResponseWriter.writeJsonError(out, HttpResponse.BAD_REQUEST, "request too large");
                return;
            }
            if (req == null) {
                HttpResponseWriter.writePlain(out, HttpResponse.BAD_REQUEST, "empty request line");
                return;
            }

            HttpResponseImpl res = new HttpResponseImpl();
            IHttpHandler handler = factory.create(req);
            try {
                handler.handle(req, res);
            } catch (Exception e) {
                System.err.println("[Server] handler failed for " + req.method() + " " + req.path() + ": " + e);
                HttpResponseWriter.writeJsonError(out, HttpResponse.INTERNAL_SERVER_ERROR, String.valueOf(e.getMessage()));
                System.out.println("[Server] " + req.method() + " " + req.path() + " -> " + HttpResponse.INTERNAL_SERVER_ERROR);
                return;
            }

            HttpResponseWriter.write(out, res);
            System.out.println("[Server] " + req.method() + " " + req.path() + " -> " + res.status());

        } catch (SocketException se) {
            String msg = String.valueOf(se.getMessage()).toLowerCase();
            if (!(msg.contains("connection reset") || msg.contains("broken pipe")
                    || msg.contains("socket write error") || msg.contains("software caused connection abort"))) {
                System.err.println("[Server] socket error: " + se.getMessage());
            }
        } catch (IOException e) {
            System.err.println("[Server] error: " + e.getMessage());
        }
    }
}
