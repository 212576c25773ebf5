package io.provtrack.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import io.provtrack.ProvTrackException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Field source handed to {@link PersistentObject#readState}. Fields the caller
 * never asks for are ignored, so records written by a newer shape still load.
 */
public final class StateReader {
    private final JsonNode node;
    private final ObjectReader reader;

    StateReader(JsonNode node, ObjectReader reader) {
        this.node = node;
        this.reader = reader;
    }

    public String embeddedType() {
        return string(node.get(Record.TYPE_KEY));
    }

    public boolean has(String name) {
        JsonNode value = node.get(name);
        return value != null && !value.isNull();
    }

    public String string(String name) {
        return string(node.get(name));
    }

    public Integer integer(String name) {
        JsonNode value = node.get(name);
        if (value == null || value.isNull()) {
            return null;
        }
        return value.asInt();
    }

    public long longValue(String name, long defaultValue) {
        JsonNode value = node.get(name);
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        return value.asLong(defaultValue);
    }

    public boolean bool(String name, boolean defaultValue) {
        JsonNode value = node.get(name);
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        return value.asBoolean(defaultValue);
    }

    public Instant instant(String name) {
        JsonNode value = node.get(name);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isTextual()) {
            return Instant.parse(value.asText());
        }
        if (!Record.DATETIME_TYPE.equals(string(value.get(Record.TYPE_KEY)))) {
            throw new ProvTrackException("Field '" + name + "' is not a datetime");
        }
        return Instant.parse(value.path(Record.VALUE_KEY).asText());
    }

    public List<String> strings(String name) {
        List<String> out = new ArrayList<>();
        for (JsonNode value : array(name)) {
            out.add(value.isNull() ? null : value.asText());
        }
        return out;
    }

    public List<Integer> integers(String name) {
        List<Integer> out = new ArrayList<>();
        for (JsonNode value : array(name)) {
            out.add(value.asInt());
        }
        return out;
    }

    public <T extends PersistentObject> T reference(String name, Class<T> type) {
        JsonNode value = node.get(name);
        if (value == null || value.isNull()) {
            return null;
        }
        return cast(name, reader.resolve(value), type);
    }

    public <T extends PersistentObject> List<T> references(String name, Class<T> type) {
        List<T> out = new ArrayList<>();
        for (JsonNode value : array(name)) {
            out.add(cast(name, reader.resolve(value), type));
        }
        return out;
    }

    public <T extends PersistentObject> LinkedHashMap<String, T> referenceMap(String name, Class<T> type) {
        LinkedHashMap<String, T> out = new LinkedHashMap<>();
        JsonNode value = node.get(name);
        if (value == null || !value.isObject()) {
            return out;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = value.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            out.put(entry.getKey(), cast(name, reader.resolve(entry.getValue()), type));
        }
        return out;
    }

    public <T> T embedded(String name, Function<StateReader, T> factory) {
        JsonNode value = node.get(name);
        if (value == null || value.isNull()) {
            return null;
        }
        return factory.apply(new StateReader(value, reader));
    }

    public <T> List<T> embeddedList(String name, Function<StateReader, T> factory) {
        List<T> out = new ArrayList<>();
        for (JsonNode value : array(name)) {
            out.add(factory.apply(new StateReader(value, reader)));
        }
        return out;
    }

    private Iterable<JsonNode> array(String name) {
        JsonNode value = node.get(name);
        if (value == null || !value.isArray()) {
            return List.of();
        }
        return value;
    }

    private static <T extends PersistentObject> T cast(String name, PersistentObject object, Class<T> type) {
        if (!type.isInstance(object)) {
            throw new ProvTrackException("Field '" + name + "' references " + object
                    + " which is not a " + type.getSimpleName());
        }
        return type.cast(object);
    }

    private static String string(JsonNode value) {
        if (value == null || value.isNull()) {
            return null;
        }
        return value.asText();
    }
}
