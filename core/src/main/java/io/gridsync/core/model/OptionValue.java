package io.gridsync.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Objects;

/**
 * A single grid option value. Exactly one of three shapes:
 *
 * <ul>
 * <li>{@link Scalar}: any JSON value, replaced wholesale on update.
 * <li>{@link Structured}: a JSON object whose fields merge onto the current value.
 * <li>{@link FunctionRef}: a JSON object carrying a behavioral function. The function is derived
 * from scalar {@code inputs}; only the inputs are ever persisted.
 * </ul>
 *
 * <p>
 * All shapes are immutable: JSON content is copied in and copied out.
 */
public sealed interface OptionValue permits OptionValue.Scalar, OptionValue.Structured, OptionValue.FunctionRef {

    /** The shape of this value. */
    ValueKind kind();

    /**
     * Persistable JSON form. For {@link FunctionRef} the function is dropped and its scalar inputs
     * are folded back into the object.
     */
    JsonNode toJson();

    /** Wraps any JSON value as a {@link Scalar}. */
    static Scalar scalar(JsonNode json) {
        return new Scalar(json);
    }

    /** Wraps a JSON object as a {@link Structured} value. */
    static Structured structured(ObjectNode fields) {
        return new Structured(fields);
    }

    /** Plain JSON value. */
    record Scalar(JsonNode json) implements OptionValue {

        public Scalar {
            json = JsonNodes.copyOf(json);
        }

        @Override
        public JsonNode json() {
            return json.deepCopy();
        }

        @Override
        public ValueKind kind() {
            return ValueKind.SCALAR;
        }

        @Override
        public JsonNode toJson() {
            return json.deepCopy();
        }
    }

    /** JSON object merged shallowly onto the current value on update. */
    record Structured(ObjectNode fields) implements OptionValue {

        public Structured {
            fields = fields == null ? JsonNodeFactory.instance.objectNode() : fields.deepCopy();
        }

        @Override
        public ObjectNode fields() {
            return fields.deepCopy();
        }

        /** Returns the named field, or a missing node. */
        public JsonNode field(String name) {
            return fields.path(name);
        }

        /** Returns a new value holding this value's fields overwritten by {@code delta}'s. */
        public Structured mergedWith(ObjectNode delta) {
            return new Structured(JsonNodes.shallowMerge(fields, delta));
        }

        @Override
        public ValueKind kind() {
            return ValueKind.STRUCTURED;
        }

        @Override
        public JsonNode toJson() {
            return fields.deepCopy();
        }
    }

    /**
     * JSON object with a synthesized function attached under {@code functionField}.
     *
     * <p>
     * Equality is behavioral: two references are equal when their data, function field and inputs
     * are equal, regardless of the function instance. Functions synthesized from the same inputs
     * behave identically.
     *
     * @param data          the object without the function and without the inputs
     * @param functionField the field the function is attached under, e.g. {@code "cellStyle"}
     * @param function      the synthesized function
     * @param inputs        the scalar inputs the function was derived from
     */
    record FunctionRef(ObjectNode data, String functionField, CellStyleFunction function, ObjectNode inputs)
            implements OptionValue {

        public FunctionRef {
            Objects.requireNonNull(functionField, "functionField must not be null");
            Objects.requireNonNull(function, "function must not be null");
            data = data == null ? JsonNodeFactory.instance.objectNode() : data.deepCopy();
            inputs = inputs == null ? JsonNodeFactory.instance.objectNode() : inputs.deepCopy();
        }

        @Override
        public ObjectNode data() {
            return data.deepCopy();
        }

        @Override
        public ObjectNode inputs() {
            return inputs.deepCopy();
        }

        @Override
        public ValueKind kind() {
            return ValueKind.FUNCTION_REF;
        }

        @Override
        public JsonNode toJson() {
            return JsonNodes.shallowMerge(data, inputs);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof FunctionRef other)) {
                return false;
            }
            return functionField.equals(other.functionField)
                    && JsonNodes.structurallyEqual(data, other.data)
                    && JsonNodes.structurallyEqual(inputs, other.inputs);
        }

        @Override
        public int hashCode() {
            // numeric-aware equality rules out hashing the JSON values themselves
            return Objects.hash(functionField, data.size(), inputs.size());
        }

        @Override
        public String toString() {
            return "FunctionRef[" + functionField + ", data=" + data + ", inputs=" + inputs + "]";
        }
    }
}
