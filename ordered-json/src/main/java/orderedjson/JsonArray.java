package orderedjson;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * JSON array. The element list is unmodifiable; {@code null} elements are stored as {@link JsonNull}.
 */
public record JsonArray(List<JsonValue> value) implements JsonValue {
    public JsonArray {
        Objects.requireNonNull(value, "value");
        value = value.stream().map(v -> v == null ? new JsonNull() : v).toList();
    }

    public static JsonArray of(JsonValue... values) {
        return new JsonArray(Arrays.asList(values));
    }

    public int size() {
        return value.size();
    }

    public JsonValue get(int index) {
        return value.get(index);
    }
}
