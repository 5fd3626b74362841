package api.impl.handlers;

import api.interfaces.IHttpHandler;
import api.interfaces.http.HttpRequest;
import api.interfaces.http.HttpResponse;
import domain.interfaces.IResourceService;
import domain.model.Resource;
import domain.model.ResourceValidationException;

/** PUT /test_resource: all-or-nothing merge of the body onto the shared record. */
public class ResourcePutHandler implements IHttpHandler {
    private final IResourceService service;

    public ResourcePutHandler(IResourceService service) { this.service = service; }

    @Override
    public void handle(HttpRequest req, HttpResponse res) {
        try {
            Resource updated = service.merge(JsonSupport.parseObject(req.body()));
            JsonSupport.ok(res, HttpResponse.OK, updated);
        } catch (ResourceValidationException e) {
            JsonSupport.error(res, HttpResponse.BAD_REQUEST, e.getMessage());
        }
    }
}
