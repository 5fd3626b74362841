package api.impl.handlers;

import api.interfaces.IHttpHandler;
import api.interfaces.http.HttpRequest;
import api.interfaces.http.HttpResponse;
import domain.interfaces.IResourceService;
import domain.model.ResourceValidationException;

/** POST /test_resource: echoes a complete record back as 201 without storing it. */
public class ResourcePostHandler implements IHttpHandler {
    private final IResourceService service;

    public ResourcePostHandler(IResourceService service) { this.service = service; }

    @Override
    public void handle(HttpRequest req, HttpResponse res) {
        try {
            JsonSupport.ok(res, HttpResponse.CREATED, service.construct(JsonSupport.parseObject(req.body())));
        } catch (ResourceValidationException e) {
            JsonSupport.error(res, HttpResponse.BAD_REQUEST, e.getMessage());
        }
    }
}
