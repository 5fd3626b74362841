package api.impl.handlers;

import api.interfaces.IHttpHandler;
import api.interfaces.http.HttpRequest;
import api.interfaces.http.HttpResponse;

/** GET / */
public class RootStatusHandler implements IHttpHandler {
    static final String STATUS_JSON = "{\"status\":\"online\",\"nest\":{\"test\":5}}";

    @Override
    public void handle(HttpRequest req, HttpResponse res) {
        res.json(HttpResponse.OK, STATUS_JSON);
    }
}
