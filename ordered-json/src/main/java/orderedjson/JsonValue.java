package orderedjson;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Map;
import java.util.Optional;
import org.jspecify.annotations.Nullable;

/**
 * A JSON value. Objects are always {@link OrderedMap}s, so member order is part of every value.
 */
public sealed interface JsonValue permits JsonArray, JsonBoolean, JsonNull, JsonNumber, JsonString, OrderedMap {

    /**
     * Compact JSON text of this value.
     */
    default String stringify() {
        return OrderedJson.stringify(this);
    }

    /**
     * Convert a plain Java value.
     *
     * <p> Maps keep their iteration order, records keep component declaration order.
     *
     * @param o value to convert, may be {@code null}
     * @return the JSON form of {@code o}
     * @throws OrderedJson.ConversionException if {@code o} has no JSON form
     */
    static JsonValue of(@Nullable Object o) {
        if (o instanceof JsonValue jsonValue) return jsonValue;
        if (o == null) return new JsonNull();
        if (o instanceof Number number) return new JsonNumber(number);
        if (o instanceof CharSequence s) return new JsonString(s.toString());
        if (o instanceof Character c) return new JsonString(String.valueOf(c));
        if (o instanceof Boolean bool) return new JsonBoolean(bool);
        if (o instanceof Optional<?> optional) return of(optional.orElse(null));
        if (o instanceof Map<?, ?> map) {
            var object = new OrderedMap(map.size());
            for (var en : map.entrySet()) {
                object.set(String.valueOf(en.getKey()), of(en.getValue()));
            }
            return object;
        }
        if (o instanceof Iterable<?> iterable) {
            var values = new ArrayList<JsonValue>();
            for (var e : iterable) {
                values.add(of(e));
            }
            return new JsonArray(values);
        }
        if (o.getClass().isArray()) {
            int len = Array.getLength(o);
            var values = new ArrayList<JsonValue>(len);
            for (int i = 0; i < len; i++) {
                values.add(of(Array.get(o, i)));
            }
            return new JsonArray(values);
        }
        if (o instanceof Record) {
            var object = new OrderedMap();
            for (var c : o.getClass().getRecordComponents()) {
                try {
                    object.set(c.getName(), of(c.getAccessor().invoke(o)));
                } catch (ReflectiveOperationException e) {
                    throw new OrderedJson.ConversionException(
                            "Failed to access record component '" + c.getName() + "' of type "
                                    + o.getClass().getName(),
                            e);
                }
            }
            return object;
        }
        throw new OrderedJson.ConversionException("Cannot convert " + o.getClass().getName() + " to a JSON value");
    }
}
