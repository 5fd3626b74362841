package domain.model;

import com.google.gson.JsonElement;
import com.google.gson.JsonPrimitive;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * The fixed field set of a {@link Resource}.
 * <p>
 * Each constant knows its JSON name, how to check a JSON value for its type and how
 * to write an already checked value onto a {@code Resource}. Declaration order is the
 * order POST reports missing fields in.
 */
public enum ResourceField {
    NAME("name") {
        @Override
        public void check(JsonElement value) {
            if (!isString(value)) throw ResourceValidationException.badType(this);
        }

        @Override
        public void apply(Resource target, JsonElement value) {
            target.setName(value.getAsString());
        }
    },
    LOCATION("location") {
        @Override
        public void check(JsonElement value) {
            if (!isString(value)) throw ResourceValidationException.badType(this);
        }

        @Override
        public void apply(Resource target, JsonElement value) {
            target.setLocation(value.getAsString());
        }
    },
    ENDPOINTS("endpoints") {
        @Override
        public void check(JsonElement value) {
            toInt(value);
        }

        @Override
        public void apply(Resource target, JsonElement value) {
            target.setEndpoints(toInt(value));
        }

        private int toInt(JsonElement value) {
            if (value == null || !value.isJsonPrimitive() || !value.getAsJsonPrimitive().isNumber()) {
                throw ResourceValidationException.badType(this);
            }
            try {
                // 2.0 and 2e0 are fine, 2.5 and anything past int range are not
                return new BigDecimal(value.getAsString()).intValueExact();
            } catch (ArithmeticException | NumberFormatException e) {
                throw ResourceValidationException.badType(this);
            }
        }
    },
    HAS_VALUES("has_values") {
        @Override
        public void check(JsonElement value) {
            if (value == null || !value.isJsonPrimitive() || !value.getAsJsonPrimitive().isBoolean()) {
                throw ResourceValidationException.badType(this);
            }
        }

        @Override
        public void apply(Resource target, JsonElement value) {
            target.setHasValues(value.getAsBoolean());
        }
    };

    private final String jsonName;

    ResourceField(String jsonName) {
        this.jsonName = jsonName;
    }

    public String jsonName() {
        return jsonName;
    }

    /** Throws {@link ResourceValidationException} if {@code value} has the wrong JSON type. */
    public abstract void check(JsonElement value);

    /** Writes a value that already passed {@link #check(JsonElement)}. */
    public abstract void apply(Resource target, JsonElement value);

    public static Optional<ResourceField> fromJsonName(String name) {
        for (ResourceField f : values()) {
            if (f.jsonName.equals(name)) return Optional.of(f);
        }
        return Optional.empty();
    }

    private static boolean isString(JsonElement value) {
        if (value == null || !value.isJsonPrimitive()) return false;
        JsonPrimitive p = value.getAsJsonPrimitive();
        return p.isString();
    }
}
