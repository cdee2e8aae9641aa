package com.challenges.jmodel.json;

import com.challenges.jmodel.output.JsonStringifier;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.map.mutable.MapAdapter;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiPredicate;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * A JSON document: exactly one of six immutable variants.
 * <p>
 * Nothing is validated at construction time. A document may hold a mixed-kind array and is
 * only rejected when {@link JsonValidator#validate(JsonNode)} is asked about it.
 */
public sealed interface JsonNode {

    /** Variant tag. Switch on this instead of on the concrete record type. */
    enum Kind {
        NULL, BOOLEAN, NUMBER, STRING, ARRAY, OBJECT
    }

    Kind kind();

    /**
     * Pre-order walk: the visitor sees this node, then every child in element or insertion
     * order, recursively.
     */
    default void accept(Consumer<? super JsonNode> visitor) {
        visitor.accept(this);
        if (this instanceof JsonArray array) {
            for (JsonNode element : array.elements()) {
                element.accept(visitor);
            }
        } else if (this instanceof JsonObject object) {
            for (JsonNode value : object.fields().values()) {
                value.accept(visitor);
            }
        }
    }

    /** Compact JSON text for this document. */
    default String stringify() {
        return new JsonStringifier().stringify(this);
    }

    record JsonObject(MutableMap<String, JsonNode> fields) implements JsonNode {
        public JsonObject {
            fields = MapAdapter.adapt(new LinkedHashMap<>(Objects.requireNonNull(fields, "fields")))
                    .asUnmodifiable();
            if (fields.containsKey(null) || fields.anySatisfy(Objects::isNull)) {
                throw new NullPointerException("object members must not be null, use JsonNull");
            }
        }

        public static JsonObject empty() {
            return new JsonObject(MapAdapter.adapt(new LinkedHashMap<>()));
        }

        public static JsonObject of(Map<String, ? extends JsonNode> members) {
            return new JsonObject(MapAdapter.adapt(new LinkedHashMap<String, JsonNode>(members)));
        }

        @Override
        public Kind kind() {
            return Kind.OBJECT;
        }

        /** A read-only, insertion-ordered copy of the members. */
        public MutableMap<String, JsonNode> entries() {
            return MapAdapter.adapt(new LinkedHashMap<>(fields)).asUnmodifiable();
        }

        public int size() {
            return fields.size();
        }

        public boolean isEmpty() {
            return fields.isEmpty();
        }

        public JsonObject with(String key, JsonNode value) {
            MutableMap<String, JsonNode> newFields = MapAdapter.adapt(new LinkedHashMap<>(fields));
            newFields.put(key, value);
            return new JsonObject(newFields);
        }

        public JsonObject filter(BiPredicate<? super String, ? super JsonNode> predicate) {
            Map<String, JsonNode> kept = new LinkedHashMap<>();
            fields.forEachKeyValue((key, value) -> {
                if (predicate.test(key, value)) {
                    kept.put(key, value);
                }
            });
            return new JsonObject(MapAdapter.adapt(kept));
        }
    }

    record JsonArray(ImmutableList<JsonNode> elements) implements JsonNode {
        public JsonArray {
            elements = Lists.immutable.withAll(Objects.requireNonNull(elements, "elements"));
            if (elements.anySatisfy(Objects::isNull)) {
                throw new NullPointerException("array elements must not be null, use JsonNull");
            }
        }

        public static JsonArray empty() {
            return new JsonArray(Lists.immutable.empty());
        }

        public static JsonArray of(JsonNode... elements) {
            return new JsonArray(Lists.immutable.with(elements));
        }

        public static JsonArray of(Iterable<? extends JsonNode> elements) {
            return new JsonArray(Lists.immutable.<JsonNode>withAll(elements));
        }

        @Override
        public Kind kind() {
            return Kind.ARRAY;
        }

        /** The elements in order. The list is immutable, so handing it out is safe. */
        public ImmutableList<JsonNode> values() {
            return elements;
        }

        public int size() {
            return elements.size();
        }

        public boolean isEmpty() {
            return elements.isEmpty();
        }

        public JsonArray with(JsonNode element) {
            return new JsonArray(elements.newWith(element));
        }

        public JsonArray map(UnaryOperator<JsonNode> transform) {
            return new JsonArray(elements.collect(transform::apply));
        }

        public JsonArray filter(Predicate<? super JsonNode> predicate) {
            return new JsonArray(elements.select(predicate::test));
        }
    }

    record JsonString(String value) implements JsonNode {
        public JsonString {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public Kind kind() {
            return Kind.STRING;
        }
    }

    /**
     * Integral and fractional values share this variant. Narrow integral boxes are widened to
     * {@code Long} so that {@code 18} and {@code 18L} make equal documents.
     */
    record JsonNumber(Number value) implements JsonNode {
        public JsonNumber {
            Objects.requireNonNull(value, "value");
            if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
                value = value.longValue();
            }
        }

        public static JsonNumber of(long value) {
            return new JsonNumber(value);
        }

        public static JsonNumber of(double value) {
            return new JsonNumber(value);
        }

        @Override
        public Kind kind() {
            return Kind.NUMBER;
        }

        /** The payload's own decimal text: {@code 37}, {@code 0.2}, {@code 2.0}. */
        public String toJsonString() {
            return value.toString();
        }
    }

    record JsonBoolean(boolean value) implements JsonNode {
        @Override
        public Kind kind() {
            return Kind.BOOLEAN;
        }
    }

    record JsonNull() implements JsonNode {
        @Override
        public Kind kind() {
            return Kind.NULL;
        }
    }
}
