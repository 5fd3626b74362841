package api.impl.handlers;

import api.interfaces.http.HttpResponse;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import domain.model.ResourceValidationException;

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;

/** Gson setup and body/error helpers shared by the handlers. */
final class JsonSupport {

    // nulls stay in the output: GET extras reports a missing param as null
    static final Gson GSON = new GsonBuilder().serializeNulls().disableHtmlEscaping().create();

    // JsonParser.parseReader and Gson.fromJson switch the reader to lenient, the adapter does not
    private static final TypeAdapter<JsonElement> TREE = GSON.getAdapter(JsonElement.class);

    private JsonSupport() {}

    /**
     * Parses the request body as one strict JSON object or throws with {@code invalid json}.
     * Unquoted names, single quotes and anything after the object are rejected.
     */
    static JsonObject parseObject(byte[] bytes) {
        String payload = bytes == null ? "" : new String(bytes, StandardCharsets.UTF_8).trim();
        if (payload.isEmpty()) {
            throw new ResourceValidationException(ResourceValidationException.INVALID_JSON);
        }
        try (JsonReader reader = new JsonReader(new StringReader(payload))) {
            reader.setLenient(false);
            JsonElement root = TREE.read(reader);
            if (root == null || !root.isJsonObject() || reader.peek() != JsonToken.END_DOCUMENT) {
                throw new ResourceValidationException(ResourceValidationException.INVALID_JSON);
            }
            return root.getAsJsonObject();
        } catch (IOException | JsonParseException | IllegalStateException e) {
            throw new ResourceValidationException(ResourceValidationException.INVALID_JSON);
        }
    }

    static void ok(HttpResponse res, int code, Object payload) {
        res.json(code, GSON.toJson(payload));
    }

    static void error(HttpResponse res, int code, String message) {
        JsonObject err = new JsonObject();
        err.addProperty("error", message);
        res.json(code, GSON.toJson(err));
    }
}
