package io.gridsync.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.function.Predicate;

/**
 * Immutable, insertion-ordered mapping from option name to {@link OptionValue}.
 *
 * <p>
 * Every "modification" returns a new bag. The canonical option state held by the settings
 * controller is an {@code OptionBag} that is swapped wholesale on commit, so readers never observe
 * a half-applied update.
 *
 * <p>
 * Thread-safe: all fields are final and the backing map is unmodifiable.
 */
public final class OptionBag {

    private static final OptionBag EMPTY = new OptionBag(Map.of());

    private final Map<String, OptionValue> values;

    private OptionBag(Map<String, OptionValue> values) {
        this.values = values;
    }

    /** Returns the empty bag. */
    public static OptionBag empty() {
        return EMPTY;
    }

    /**
     * Creates a bag from a map. The map is copied and its iteration order kept.
     *
     * @param values option values by name; {@code null} values are rejected
     */
    public static OptionBag of(Map<String, ? extends OptionValue> values) {
        Builder builder = builder();
        values.forEach(builder::put);
        return builder.build();
    }

    /**
     * Creates a bag of {@link OptionValue.Scalar} values from the fields of a JSON object.
     * Callers that need typed values should go through the option normalizer instead.
     */
    public static OptionBag ofScalars(ObjectNode json) {
        Builder builder = builder();
        json.fields().forEachRemaining(f -> builder.put(f.getKey(), OptionValue.scalar(f.getValue())));
        return builder.build();
    }

    /** Returns a fresh {@link Builder}. */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Looks up a value by option name.
     *
     * @return the value, or {@code null} if the option is not present
     */
    public OptionValue get(String name) {
        return values.get(name);
    }

    /**
     * Returns the persistable JSON form of an option, or {@code null} if absent.
     */
    public JsonNode getJson(String name) {
        OptionValue value = values.get(name);
        return value == null ? null : value.toJson();
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    /** Option names in insertion order. */
    public Set<String> names() {
        return values.keySet();
    }

    /** Unmodifiable view of the entries. */
    public Map<String, OptionValue> asMap() {
        return values;
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public void forEach(BiConsumer<String, OptionValue> action) {
        values.forEach(action);
    }

    /** Returns a bag with {@code name} set to {@code value}. */
    public OptionBag with(String name, OptionValue value) {
        return toBuilder().put(name, value).build();
    }

    /** Returns a bag without {@code name}. */
    public OptionBag without(String name) {
        return toBuilder().remove(name).build();
    }

    /**
     * Layers {@code top} over this bag: every option in {@code top} replaces the one here, options
     * only present here are kept.
     */
    public OptionBag overlay(OptionBag top) {
        if (top.isEmpty()) {
            return this;
        }
        Builder builder = toBuilder();
        top.forEach(builder::put);
        return builder.build();
    }

    /** Returns the options whose names pass {@code filter}, in the same order. */
    public OptionBag filter(Predicate<String> filter) {
        Builder builder = builder();
        values.forEach((name, value) -> {
            if (filter.test(name)) {
                builder.put(name, value);
            }
        });
        return builder.build();
    }

    /** Returns the options named in {@code names}. */
    public OptionBag select(Collection<String> names) {
        return filter(names::contains);
    }

    /** Persistable JSON object holding every option's {@link OptionValue#toJson()} form. */
    public ObjectNode toJson() {
        ObjectNode json = JsonNodeFactory.instance.objectNode();
        values.forEach((name, value) -> json.set(name, value.toJson()));
        return json;
    }

    /** Returns a builder seeded with this bag's entries. */
    public Builder toBuilder() {
        Builder builder = builder();
        values.forEach(builder::put);
        return builder;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof OptionBag other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "OptionBag" + values.keySet();
    }

    /** Builder for constructing an {@link OptionBag} incrementally. */
    public static final class Builder {

        private final Map<String, OptionValue> values = new LinkedHashMap<>();

        Builder() {}

        /**
         * Sets an option. Re-putting an existing name keeps its original position.
         *
         * @return this builder (fluent)
         */
        public Builder put(String name, OptionValue value) {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(value, "value must not be null");
            values.put(name, value);
            return this;
        }

        /** Removes an option if present. */
        public Builder remove(String name) {
            values.remove(name);
            return this;
        }

        public boolean contains(String name) {
            return values.containsKey(name);
        }

        public OptionValue get(String name) {
            return values.get(name);
        }

        /** Builds an immutable bag from the current state. */
        public OptionBag build() {
            if (values.isEmpty()) {
                return EMPTY;
            }
            return new OptionBag(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
        }
    }
}
