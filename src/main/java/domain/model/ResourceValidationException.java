package domain.model;

/**
 * Raised when a request body does not fit the {@link ResourceField} schema.
 * The message is the text sent back to the client as {@code {"error": ...}}.
 */
public class ResourceValidationException extends IllegalArgumentException {

    public static final String BAD_BODY_PARAM = "bad body param";
    public static final String INVALID_JSON = "invalid json";

    public ResourceValidationException(String message) {
        super(message);
    }

    public static ResourceValidationException missingField(ResourceField field) {
        return new ResourceValidationException("missing field " + field.jsonName());
    }

    public static ResourceValidationException badType(ResourceField field) {
        return new ResourceValidationException("bad type for field " + field.jsonName());
    }
}
