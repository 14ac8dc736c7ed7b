package orderedjson;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiPredicate;
import org.jspecify.annotations.Nullable;

/**
 * String-keyed map that remembers the order its keys were first set.
 *
 * <p> Lookups go through a hash map; iteration, positional access and JSON output follow the key order. Setting an
 * existing key replaces its value and keeps its position. Reordering happens only through {@link #sortKeys},
 * {@link #sort} and {@link #sortBy}.
 *
 * <p> Not thread-safe. Concurrent reads of an instance nobody mutates are fine.
 *
 * <h3>Example</h3>
 * <pre>{@code
 * var map = new OrderedMap()
 *         .set("name", "Alice")
 *         .set("age", 30)
 *         .set("name", "Bob");
 * map.keys();        // -> [name, age]
 * map.stringify();   // -> {"name":"Bob","age":30}
 * }</pre>
 */
public final class OrderedMap implements JsonValue {

    private final List<String> keys;
    private final Map<String, JsonValue> values;

    public OrderedMap() {
        this(16);
    }

    public OrderedMap(int expectedSize) {
        this.keys = new ArrayList<>(expectedSize);
        this.values = new HashMap<>(mapCap(expectedSize));
    }

    /**
     * @return the value for {@code key}, or {@code null} if absent; a JSON {@code null} is a {@link JsonNull}
     */
    public @Nullable JsonValue get(String key) {
        return values.get(key);
    }

    public boolean containsKey(String key) {
        return values.containsKey(key);
    }

    /**
     * Insert or update. A new key goes to the end of the key order; an existing key keeps its position.
     *
     * @param key   not {@code null}
     * @param value value, {@code null} is stored as {@link JsonNull}
     * @return this map
     */
    public OrderedMap set(String key, @Nullable JsonValue value) {
        Objects.requireNonNull(key, "key");
        if (values.put(key, value == null ? new JsonNull() : value) == null) {
            keys.add(key);
        }
        return this;
    }

    /**
     * Insert or update a plain Java value, converted with {@link JsonValue#of(Object)}.
     */
    public OrderedMap set(String key, @Nullable Object value) {
        return set(key, JsonValue.of(value));
    }

    /**
     * Remove {@code key}. The remaining keys keep their relative order. No-op if absent.
     *
     * @return the removed value, or {@code null} if absent
     */
    public @Nullable JsonValue delete(String key) {
        var removed = values.remove(key);
        if (removed != null) {
            keys.remove(key);
        }
        return removed;
    }

    /**
     * Live, unmodifiable view of the key order.
     */
    public List<String> keys() {
        return Collections.unmodifiableList(keys);
    }

    /**
     * Values in key order, as a snapshot.
     */
    public List<JsonValue> values() {
        var v = new ArrayList<JsonValue>(keys.size());
        for (var k : keys) {
            v.add(values.get(k));
        }
        return v;
    }

    /**
     * Unmodifiable, unordered key to value view.
     */
    public Map<String, JsonValue> toMap() {
        return Collections.unmodifiableMap(values);
    }

    /**
     * Entries in key order, as a snapshot.
     */
    public List<Pair> pairs() {
        var pairs = new ArrayList<Pair>(keys.size());
        for (var k : keys) {
            pairs.add(new Pair(k, values.get(k)));
        }
        return pairs;
    }

    public int size() {
        return keys.size();
    }

    public boolean isEmpty() {
        return keys.isEmpty();
    }

    /**
     * @throws IndexOutOfBoundsException if {@code index} is out of range
     */
    public String getKeyAt(int index) {
        return keys.get(index);
    }

    /**
     * @throws IndexOutOfBoundsException if {@code index} is out of range
     */
    public JsonValue getValueAt(int index) {
        return values.get(keys.get(index));
    }

    /**
     * Reorder the keys. Values and lookups are unaffected.
     */
    public void sortKeys(Comparator<? super String> comparator) {
        Objects.requireNonNull(comparator, "comparator");
        keys.sort(comparator);
    }

    /**
     * Reorder the keys by comparing whole entries. The sort is stable: entries that compare equal keep their
     * current relative order.
     */
    public void sort(Comparator<? super Pair> comparator) {
        Objects.requireNonNull(comparator, "comparator");
        var pairs = pairs();
        pairs.sort(comparator);
        for (int i = 0; i < pairs.size(); i++) {
            keys.set(i, pairs.get(i).key());
        }
    }

    /**
     * Reorder the keys with a less-than predicate, which must be a strict weak ordering.
     *
     * @see Pair#comparing(BiPredicate)
     */
    public void sortBy(BiPredicate<? super Pair, ? super Pair> less) {
        sort(Pair.comparing(less));
    }

    /**
     * Set {@code key} and move it to the end of the key order, whether or not it was already present.
     */
    void putLast(String key, JsonValue value) {
        if (values.put(key, value) != null) {
            keys.remove(key);
        }
        keys.add(key);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        return o instanceof OrderedMap m && keys.equals(m.keys) && values.equals(m.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(keys, values);
    }

    @Override
    public String toString() {
        return stringify();
    }

    static int mapCap(int expectedSize) {
        return expectedSize < 3 ? 4 : (int) (expectedSize / 0.75f) + 1;
    }

    /**
     * A (key, value) snapshot of one entry, used when sorting.
     */
    public record Pair(String key, JsonValue value) {

        public static Comparator<Pair> byKey() {
            return Comparator.comparing(Pair::key);
        }

        /**
         * Adapt a less-than predicate to a {@link Comparator}.
         */
        public static Comparator<Pair> comparing(BiPredicate<? super Pair, ? super Pair> less) {
            Objects.requireNonNull(less, "less");
            return (a, b) -> less.test(a, b) ? -1 : less.test(b, a) ? 1 : 0;
        }
    }
}
