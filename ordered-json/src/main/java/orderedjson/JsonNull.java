package orderedjson;

/**
 * JSON {@code null}.
 */
public record JsonNull() implements JsonValue {}
