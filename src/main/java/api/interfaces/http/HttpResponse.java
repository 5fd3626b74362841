package api.interfaces.http;

/** Minimal response contract */
public interface HttpResponse {

    int OK = 200;
    int CREATED = 201;
    int BAD_REQUEST = 400;
    int NOT_FOUND = 404;
    int INTERNAL_SERVER_ERROR = 500;

    String JSON_UTF8 = "application/json; charset=utf-8";

    void status(int code, String reason);
    void header(String name, String value);
    void body(String text);

    /** Status with its standard reason phrase, JSON content type and body. */
    default void json(int code, String json) {
        status(code, reason(code));
        header("Content-Type", JSON_UTF8);
        body(json);
    }

    static String reason(int code) {
        return switch (code) {
            case OK -> "OK";
            case CREATED -> "Created";
            case BAD_REQUEST -> "Bad Request";
            case NOT_FOUND -> "Not Found";
            case INTERNAL_SERVER_ERROR -> "Internal Server Error";
            default -> "Unknown";
        };
    }
}
