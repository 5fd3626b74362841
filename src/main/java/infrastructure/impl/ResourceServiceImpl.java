package infrastructure.impl;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import domain.interfaces.IResourceService;
import domain.interfaces.IResourceStore;
import domain.model.Resource;
import domain.model.ResourceField;
import domain.model.ResourceValidationException;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

public class ResourceServiceImpl implements IResourceService {

    private final IResourceStore store;

    public ResourceServiceImpl(IResourceStore store) { this.store = store; }

    @Override
    public Resource current() { return store.get(); }

    @Override
    public Resource merge(JsonObject patch) {
        if (patch == null) throw new ResourceValidationException(ResourceValidationException.INVALID_JSON);

        // unknown keys first, so {"name":1,"bogus":1} reports the bogus key
        Map<ResourceField, JsonElement> checked = new EnumMap<>(ResourceField.class);
        for (String key : patch.keySet()) {
            Optional<ResourceField> field = ResourceField.fromJsonName(key);
            if (field.isEmpty()) throw new ResourceValidationException(ResourceValidationException.BAD_BODY_PARAM);
            checked.put(field.get(), patch.get(key));
        }
        for (Map.Entry<ResourceField, JsonElement> e : checked.entrySet()) {
            e.getKey().check(e.getValue());
        }

        // nothing below can fail, the whole patch lands under one lock hold
        return store.update(r -> checked.forEach((f, v) -> f.apply(r, v)));
    }

    @Override
    public Resource construct(JsonObject body) {
        if (body == null) throw new ResourceValidationException(ResourceValidationException.INVALID_JSON);

        // every field must be there before any value is looked at
        for (ResourceField f : ResourceField.values()) {
            if (!body.has(f.jsonName())) throw ResourceValidationException.missingField(f);
        }

        Resource fresh = Resource.defaults();
        for (ResourceField f : ResourceField.values()) {
            JsonElement value = body.get(f.jsonName());
            f.check(value);
            f.apply(fresh, value);
        }
        return fresh;
    }
}
