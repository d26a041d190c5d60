package org.pragmatica.dnsb.config;

import org.pragmatica.lang.Option;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.pragmatica.lang.Option.none;
import static org.pragmatica.lang.Option.option;
import static org.pragmatica.lang.Option.some;

/**
 * Configuration tree value.
 *
 * <p>Every configuration document is represented with three variants:
 * <ul>
 *   <li>{@link Scalar} - string, number, boolean or null</li>
 *   <li>{@link Sequence} - ordered list of values</li>
 *   <li>{@link Mapping} - insertion-ordered map with unique string keys</li>
 * </ul>
 * All variants are immutable. Mutating operations return new instances.
 */
public sealed interface ConfigValue {
    /**
     * Canonical string projection. Used for sequence de-duplication and for substitution output.
     */
    String projection();

    /**
     * Converts the value back to plain Java objects (String, Number, Boolean, List, Map or null).
     */
    Object toObject();

    default boolean isScalar() {
        return this instanceof Scalar;
    }

    default boolean isMapping() {
        return this instanceof Mapping;
    }

    default boolean isSequence() {
        return this instanceof Sequence;
    }

    default Option<Mapping> asMapping() {
        return this instanceof Mapping mapping
               ? some(mapping)
               : none();
    }

    default Option<Sequence> asSequence() {
        return this instanceof Sequence sequence
               ? some(sequence)
               : none();
    }

    /**
     * Returns the text of a string scalar.
     */
    default Option<String> asText() {
        return this instanceof Scalar scalar && scalar.value() instanceof String text
               ? some(text)
               : none();
    }

    record Scalar(Object value) implements ConfigValue {
        public static final Scalar NULL = new Scalar(null);

        @Override
        public String projection() {
            return String.valueOf(value);
        }

        @Override
        public Object toObject() {
            return value;
        }

        public boolean isNull() {
            return value == null;
        }

        public boolean isText() {
            return value instanceof String;
        }
    }

    record Sequence(List<ConfigValue> items) implements ConfigValue {
        public Sequence {
            items = List.copyOf(items);
        }

        @Override
        public String projection() {
            return items.stream()
                        .map(ConfigValue::projection)
                        .collect(Collectors.joining(", ", "[", "]"));
        }

        @Override
        public Object toObject() {
            var list = new ArrayList<>(items.size());
            items.forEach(item -> list.add(item.toObject()));
            return list;
        }

        public int size() {
            return items.size();
        }

        public boolean isEmpty() {
            return items.isEmpty();
        }

        public Sequence append(ConfigValue value) {
            var copy = new ArrayList<>(items);
            copy.add(value);
            return new Sequence(copy);
        }

        /**
         * Returns the texts of all string elements, or none if any element is not a string.
         */
        public Option<List<String>> texts() {
            var texts = new ArrayList<String>(items.size());
            for (var item : items) {
                var text = item.asText();
                if (text.isEmpty()) {
                    return none();
                }
                text.onPresent(texts::add);
            }
            return some(List.copyOf(texts));
        }
    }

    record Mapping(Map<String, ConfigValue> entries) implements ConfigValue {
        public static final Mapping EMPTY = new Mapping(Map.of());

        public Mapping {
            entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        }

        @Override
        public String projection() {
            return entries.entrySet()
                          .stream()
                          .map(entry -> entry.getKey() + "=" + entry.getValue()
                                                                     .projection())
                          .collect(Collectors.joining(", ", "{", "}"));
        }

        @Override
        public Object toObject() {
            var map = new LinkedHashMap<String, Object>();
            entries.forEach((key, value) -> map.put(key, value.toObject()));
            return map;
        }

        public Option<ConfigValue> get(String key) {
            return option(entries.get(key));
        }

        public boolean has(String key) {
            return entries.containsKey(key);
        }

        public Option<String> text(String key) {
            return get(key).flatMap(ConfigValue::asText);
        }

        public Option<Mapping> mapping(String key) {
            return get(key).flatMap(ConfigValue::asMapping);
        }

        public Option<Sequence> sequence(String key) {
            return get(key).flatMap(ConfigValue::asSequence);
        }

        public List<String> keys() {
            return List.copyOf(entries.keySet());
        }

        public boolean isEmpty() {
            return entries.isEmpty();
        }

        public int size() {
            return entries.size();
        }

        public Mapping with(String key, ConfigValue value) {
            var copy = new LinkedHashMap<>(entries);
            copy.put(key, value);
            return new Mapping(copy);
        }

        public Mapping without(String key) {
            if (!entries.containsKey(key)) {
                return this;
            }
            var copy = new LinkedHashMap<>(entries);
            copy.remove(key);
            return new Mapping(copy);
        }
    }

    static Scalar text(String value) {
        return new Scalar(value);
    }

    static Scalar number(long value) {
        return new Scalar(value);
    }

    static Scalar bool(boolean value) {
        return new Scalar(value);
    }

    static Scalar nullValue() {
        return Scalar.NULL;
    }

    static Sequence sequence(List<? extends ConfigValue> items) {
        return new Sequence(List.copyOf(items));
    }

    static Sequence texts(String... values) {
        var items = new ArrayList<ConfigValue>(values.length);
        for (var value : values) {
            items.add(text(value));
        }
        return new Sequence(items);
    }

    static Mapping mapping(Map<String, ? extends ConfigValue> entries) {
        return new Mapping(new LinkedHashMap<>(entries));
    }

    static Mapping emptyMapping() {
        return Mapping.EMPTY;
    }

    /**
     * Converts plain Java objects, as produced by a YAML or JSON parser, into a configuration tree.
     * Integral numbers are widened to {@code Long}, fractional ones to {@code Double}. Objects of
     * any other type are represented by their string form.
     */
    static ConfigValue fromObject(Object object) {
        if (object == null) {
            return Scalar.NULL;
        }
        if (object instanceof ConfigValue value) {
            return value;
        }
        if (object instanceof Map< ? , ? > map) {
            var entries = new LinkedHashMap<String, ConfigValue>();
            map.forEach((key, value) -> entries.put(String.valueOf(key), fromObject(value)));
            return new Mapping(entries);
        }
        if (object instanceof List< ? > list) {
            var items = new ArrayList<ConfigValue>(list.size());
            list.forEach(item -> items.add(fromObject(item)));
            return new Sequence(items);
        }
        if (object instanceof Integer || object instanceof Long || object instanceof Short || object instanceof Byte) {
            return new Scalar(((Number) object).longValue());
        }
        if (object instanceof Float || object instanceof Double) {
            return new Scalar(((Number) object).doubleValue());
        }
        if (object instanceof Boolean || object instanceof String) {
            return new Scalar(object);
        }
        return new Scalar(object.toString());
    }
}
