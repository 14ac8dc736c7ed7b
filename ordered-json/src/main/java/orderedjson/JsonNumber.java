package orderedjson;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;

/**
 * JSON number.
 *
 * <p> Equality is numeric: {@code 1}, {@code 1L}, {@code 1.0} and {@code new BigDecimal("1.00")} are all equal.
 * NaN and infinities have no JSON form and are rejected.
 */
public record JsonNumber(Number value) implements JsonValue {
    public JsonNumber {
        Objects.requireNonNull(value, "value");
        if (value instanceof Double || value instanceof Float) {
            double d = value.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d))
                throw new OrderedJson.ConversionException("Cannot represent NaN or Infinity as JSON number: " + value);
        } else if (!isStable(value)) {
            // AtomicInteger, AtomicLong, custom Number subclasses: snapshot the current value
            try {
                value = new BigDecimal(value.toString());
            } catch (NumberFormatException e) {
                throw new OrderedJson.ConversionException("Not a JSON number: " + value, e);
            }
        }
    }

    public BigDecimal toBigDecimal() {
        if (value instanceof BigDecimal b) return b;
        if (value instanceof BigInteger b) return new BigDecimal(b);
        return new BigDecimal(value.toString());
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof JsonNumber n && toBigDecimal().compareTo(n.toBigDecimal()) == 0;
    }

    @Override
    public int hashCode() {
        return toBigDecimal().stripTrailingZeros().hashCode();
    }

    private static boolean isStable(Number n) {
        return n instanceof Integer
                || n instanceof Long
                || n instanceof Short
                || n instanceof Byte
                || n instanceof BigInteger
                || n instanceof BigDecimal;
    }
}
