package com.challenges.jmodel.convert;

import com.challenges.jmodel.json.JsonNode;
import org.eclipse.collections.api.RichIterable;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MapIterable;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.map.mutable.MapAdapter;
import org.eclipse.collections.impl.utility.ListIterate;
import org.eclipse.collections.impl.utility.MapIterate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Field;
import java.lang.reflect.InaccessibleObjectException;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lifts plain Java values into documents.
 * <p>
 * Recognized shapes, checked in this order:
 * <ul>
 *     <li>{@code null} becomes {@link JsonNode.JsonNull}; a {@link JsonNode} is returned as is;</li>
 *     <li>any {@link Number} becomes a number, a {@link Boolean} a boolean, a
 *     {@link CharSequence} or {@link Character} a string;</li>
 *     <li>a {@link List} or {@link ListIterable} becomes an array of converted elements;</li>
 *     <li>an enum constant becomes a string holding its {@link Enum#name() name};</li>
 *     <li>a {@link Map} or {@link MapIterable} with {@code String} keys becomes an object in
 *     iteration order;</li>
 *     <li>a record becomes an object of its components in declaration order;</li>
 *     <li>any other class outside the JDK becomes an object of its instance fields, superclass
 *     fields first, skipping static, transient and synthetic ones.</li>
 * </ul>
 * Everything else, including arrays, sets and JDK types such as {@code Optional}, is rejected
 * with a {@link ConversionException}.
 */
public class JsonConverter {
    private static final Logger LOGGER = LoggerFactory.getLogger(JsonConverter.class);

    static final String NON_STRING_KEY_MESSAGE = "Map keys must be Strings";

    private static final ClassValue<ImmutableList<Property>> PROPERTIES = new ClassValue<>() {
        @Override
        protected ImmutableList<Property> computeValue(Class<?> type) {
            return introspect(type);
        }
    };

    public JsonNode convert(Object value) {
        if (value == null) {
            return new JsonNode.JsonNull();
        }
        if (value instanceof JsonNode node) {
            return node;
        }
        if (value instanceof Number number) {
            return new JsonNode.JsonNumber(number);
        }
        if (value instanceof Boolean bool) {
            return new JsonNode.JsonBoolean(bool);
        }
        if (value instanceof CharSequence || value instanceof Character) {
            return new JsonNode.JsonString(value.toString());
        }
        if (value instanceof List<?> list) {
            MutableList<JsonNode> elements = ListIterate.collect(list, this::convert);
            return new JsonNode.JsonArray(elements.toImmutable());
        }
        if (value instanceof ListIterable<?> list) {
            return JsonNode.JsonArray.of(list.collect(this::convert));
        }
        if (value instanceof Enum<?> constant) {
            return new JsonNode.JsonString(constant.name());
        }
        if (value instanceof Map<?, ?> map) {
            MutableMap<String, JsonNode> members = MapAdapter.adapt(new LinkedHashMap<>());
            MapIterate.forEachKeyValue(map, (key, member) -> members.put(keyOf(key), convert(member)));
            return new JsonNode.JsonObject(members);
        }
        if (value instanceof MapIterable<?, ?> map) {
            MutableMap<String, JsonNode> members = MapAdapter.adapt(new LinkedHashMap<>());
            map.forEachKeyValue((key, member) -> members.put(keyOf(key), convert(member)));
            return new JsonNode.JsonObject(members);
        }
        return convertStructure(value);
    }

    private static String keyOf(Object key) {
        if (key instanceof String name) {
            return name;
        }
        throw new IllegalArgumentException(NON_STRING_KEY_MESSAGE);
    }

    private JsonNode.JsonObject convertStructure(Object value) {
        MutableMap<String, JsonNode> members = MapAdapter.adapt(new LinkedHashMap<>());
        for (Property property : PROPERTIES.get(value.getClass())) {
            members.put(property.name(), convert(property.read(value)));
        }
        return new JsonNode.JsonObject(members);
    }

    private static ImmutableList<Property> introspect(Class<?> type) {
        if (type.isArray()
                || Collection.class.isAssignableFrom(type)
                || RichIterable.class.isAssignableFrom(type)
                || isJdkType(type)) {
            throw new ConversionException("Unsupported value type: " + type.getName());
        }

        MutableList<Property> properties = Lists.mutable.empty();
        try {
            if (type.isRecord()) {
                for (RecordComponent component : type.getRecordComponents()) {
                    Method accessor = component.getAccessor();
                    accessor.setAccessible(true);
                    properties.add(new Property(component.getName(), accessor::invoke));
                }
            } else {
                for (Class<?> declaring : hierarchyOf(type)) {
                    for (Field field : declaring.getDeclaredFields()) {
                        int modifiers = field.getModifiers();
                        if (Modifier.isStatic(modifiers) || Modifier.isTransient(modifiers) || field.isSynthetic()) {
                            continue;
                        }
                        field.setAccessible(true);
                        properties.add(new Property(field.getName(), field::get));
                    }
                }
            }
        } catch (InaccessibleObjectException | SecurityException e) {
            throw new ConversionException("Cannot introspect " + type.getName(), e);
        }

        LOGGER.debug("Introspected {}: {}", type.getName(), properties.collect(Property::name));
        return properties.toImmutable();
    }

    // Topmost superclass first so inherited fields come before the subclass's own
    private static ListIterable<Class<?>> hierarchyOf(Class<?> type) {
        MutableList<Class<?>> hierarchy = Lists.mutable.empty();
        for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
            hierarchy.add(c);
        }
        return hierarchy.reverseThis();
    }

    private static boolean isJdkType(Class<?> type) {
        String module = type.getModule().getName();
        return module != null && (module.startsWith("java.") || module.startsWith("jdk."));
    }

    @FunctionalInterface
    private interface Reader {
        Object read(Object target) throws ReflectiveOperationException;
    }

    private record Property(String name, Reader reader) {
        Object read(Object target) {
            try {
                return reader.read(target);
            } catch (InvocationTargetException e) {
                throw new ConversionException(
                        "Reading " + name + " of " + target.getClass().getName() + " failed", e.getCause());
            } catch (ReflectiveOperationException e) {
                throw new ConversionException("Cannot read " + name + " of " + target.getClass().getName(), e);
            }
        }
    }
}
