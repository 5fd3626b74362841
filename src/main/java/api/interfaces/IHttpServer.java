package api.interfaces;

/*
AutoCloseable so tests and main can use try-with-resources
 */
public interface IHttpServer extends AutoCloseable {
    /** Binds and starts accepting in the background; port 0 picks a free port. */
    void start(int port) throws Exception;

    /** The bound port, valid after {@link #start(int)}. */
    int port();

    @Override void close() throws Exception;
}
