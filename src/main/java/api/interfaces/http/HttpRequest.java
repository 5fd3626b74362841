package api.interfaces.http;

/** Minimal request contract */
public interface HttpRequest {
    String method();

    /** Request target without the query string. */
    String path();

    String version();
    String header(String name);

    /** First decoded value of a query parameter; "" when given without a value, null when absent. */
    String query(String name);

    byte[] body();
}
