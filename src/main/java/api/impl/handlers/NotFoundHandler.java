package api.impl.handlers;

import api.interfaces.IHttpHandler;
import api.interfaces.http.HttpRequest;
import api.interfaces.http.HttpResponse;

public class NotFoundHandler implements IHttpHandler {
    @Override
    public void handle(HttpRequest req, HttpResponse res) {
        JsonSupport.error(res, HttpResponse.NOT_FOUND, "no route for " + req.method() + " " + req.path());
    }
}
