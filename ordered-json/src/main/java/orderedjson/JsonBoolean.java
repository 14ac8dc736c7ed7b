package orderedjson;

public record JsonBoolean(boolean value) implements JsonValue {}
