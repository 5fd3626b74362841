package domain.interfaces;

import com.google.gson.JsonObject;
import domain.model.Resource;

public interface IResourceService {
    Resource current();

    /**
     * Merges the given fields onto the shared record. Either every field is applied or,
     * on a {@link domain.model.ResourceValidationException}, none is.
     */
    Resource merge(JsonObject patch);

    /** Builds a new record from a body that carries every field. Leaves the shared record alone. */
    Resource construct(JsonObject body);
}
