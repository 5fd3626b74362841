package api.impl.handlers;

import api.interfaces.IHandlerFactory;
import api.interfaces.IHttpHandler;
import api.interfaces.http.HttpRequest;
import domain.interfaces.IResourceService;

public class HandlerFactory implements IHandlerFactory {

    public static final String ROOT_PATH = "/";
    public static final String RESOURCE_PATH = "/test_resource";

    private final IResourceService service;

    // stateless ones are shared
    private final IHttpHandler root = new RootStatusHandler();
    private final IHttpHandler delete = new ResourceDeleteHandler();
    private final IHttpHandler unsupported = new UnsupportedMethodHandler();
    private final IHttpHandler notFound = new NotFoundHandler();

    public HandlerFactory(IResourceService service) { this.service = service; }

    @Override
    public IHttpHandler create(HttpRequest req) {
        // method names are case-sensitive, "get" is not GET
        String m = req.method() == null ? "" : req.method();
        String p = req.path();

        if (ROOT_PATH.equals(p)) {
            return "GET".equals(m) ? root : unsupported;
        }
        if (RESOURCE_PATH.equals(p)) {
            switch (m) {
                case "GET":    return new ResourceGetHandler(service);
                case "PUT":    return new ResourcePutHandler(service);
                case "POST":   return new ResourcePostHandler(service);
                case "DELETE": return delete;
                default:       return unsupported;
            }
        }
        return notFound;
    }
}
