package api.impl.handlers;

import api.interfaces.IHttpHandler;
import api.interfaces.http.HttpRequest;
import api.interfaces.http.HttpResponse;

/** DELETE /test_resource: acknowledged, nothing is removed. */
public class ResourceDeleteHandler implements IHttpHandler {
    @Override
    public void handle(HttpRequest req, HttpResponse res) {
        res.status(HttpResponse.OK, "OK");
        res.body("");
    }
}
