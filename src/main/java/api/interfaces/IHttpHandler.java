package api.interfaces;

import api.interfaces.http.HttpRequest;
import api.interfaces.http.HttpResponse;

/** Fills in {@code res} for one request. Exceptions become a 500 in the server loop. */
public interface IHttpHandler {
    void handle(HttpRequest req, HttpResponse res) throws Exception;
}
