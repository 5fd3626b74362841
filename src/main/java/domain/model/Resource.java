package domain.model;

import com.google.gson.annotations.SerializedName;

import java.util.Objects;

/**
 * The single demo record served on /test_resource.
 * Field order here is the order Gson writes them.
 */
public class Resource {
    public static final String DEFAULT_NAME = "example_resource";
    public static final String DEFAULT_LOCATION = "my_computer";
    public static final int DEFAULT_ENDPOINTS = 2;
    public static final boolean DEFAULT_HAS_VALUES = true;

    private String name;
    private String location;
    private int endpoints;
    @SerializedName("has_values")
    private boolean hasValues;

    public Resource(String name, String location, int endpoints, boolean hasValues) {
        this.name = name;
        this.location = location;
        this.endpoints = endpoints;
        this.hasValues = hasValues;
    }

    /** The record every server starts with. */
    public static Resource defaults() {
        return new Resource(DEFAULT_NAME, DEFAULT_LOCATION, DEFAULT_ENDPOINTS, DEFAULT_HAS_VALUES);
    }

    public Resource copy() {
        return new Resource(name, location, endpoints, hasValues);
    }

    public String getName() { return name; }
    public String getLocation() { return location; }
    public int getEndpoints() { return endpoints; }
    public boolean hasValues() { return hasValues; }

    public void setName(String name) { this.name = name; }
    public void setLocation(String location) { this.location = location; }
    public void setEndpoints(int endpoints) { this.endpoints = endpoints; }
    public void setHasValues(boolean hasValues) { this.hasValues = hasValues; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Resource)) return false;
        Resource that = (Resource) o;
        return endpoints == that.endpoints
                && hasValues == that.hasValues
                && Objects.equals(name, that.name)
                && Objects.equals(location, that.location);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, location, endpoints, hasValues);
    }

    @Override
    public String toString() {
        return "Resource{" +
                "name='" + name + '\'' +
                ", location='" + location + '\'' +
                ", endpoints=" + endpoints +
                ", hasValues=" + hasValues +
                '}';
    }
}
