package api.impl.handlers;

import api.interfaces.IHttpHandler;
import api.interfaces.http.HttpRequest;
import api.interfaces.http.HttpResponse;
import com.google.gson.JsonObject;
import domain.interfaces.IResourceService;
import domain.model.Resource;

/**
 * GET /test_resource. With {@code first} or {@code second} in the query the record is
 * wrapped as {@code {"resource":..., "extras":{"first":..., "second":...}}}.
 */
public class ResourceGetHandler implements IHttpHandler {
    private final IResourceService service;

    public ResourceGetHandler(IResourceService service) { this.service = service; }

    @Override
    public void handle(HttpRequest req, HttpResponse res) {
        Resource current = service.current();
        String first = req.query("first");
        String second = req.query("second");

        if (first == null && second == null) {
            JsonSupport.ok(res, HttpResponse.OK, current);
            return;
        }

        JsonObject extras = new JsonObject();
        extras.addProperty("first", first);
        extras.addProperty("second", second);

        JsonObject wrapped = new JsonObject();
        wrapped.add("resource", JsonSupport.GSON.toJsonTree(current));
        wrapped.add("extras", extras);
        JsonSupport.ok(res, HttpResponse.OK, wrapped);
    }
}
