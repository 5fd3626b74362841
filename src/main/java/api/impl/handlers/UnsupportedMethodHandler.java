package api.impl.handlers;

import api.interfaces.IHttpHandler;
import api.interfaces.http.HttpRequest;
import api.interfaces.http.HttpResponse;

public class UnsupportedMethodHandler implements IHttpHandler {
    @Override
    public void handle(HttpRequest req, HttpResponse res) {
        JsonSupport.error(res, HttpResponse.BAD_REQUEST, "unsupported method");
    }
}
