package io.provtrack.persistence;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Field sink handed to {@link PersistentObject#writeState}. Keeps the JSON
 * tree out of domain code.
 */
public final class StateWriter {
    private final ObjectNode node;
    private final Function<PersistentObject, ObjectNode> references;

    StateWriter(ObjectNode node, Function<PersistentObject, ObjectNode> references) {
        this.node = node;
        this.references = references;
    }

    public StateWriter string(String name, String value) {
        if (value == null) {
            node.putNull(checkName(name));
        } else {
            node.put(checkName(name), value);
        }
        return this;
    }

    public StateWriter integer(String name, Integer value) {
        if (value == null) {
            node.putNull(checkName(name));
        } else {
            node.put(checkName(name), value);
        }
        return this;
    }

    public StateWriter longValue(String name, long value) {
        node.put(checkName(name), value);
        return this;
    }

    public StateWriter bool(String name, boolean value) {
        node.put(checkName(name), value);
        return this;
    }

    public StateWriter instant(String name, Instant value) {
        if (value == null) {
            node.putNull(checkName(name));
            return this;
        }
        ObjectNode wrapped = node.putObject(checkName(name));
        wrapped.put(Record.TYPE_KEY, Record.DATETIME_TYPE);
        wrapped.put(Record.VALUE_KEY, value.toString());
        return this;
    }

    public StateWriter strings(String name, Collection<String> values) {
        ArrayNode array = node.putArray(checkName(name));
        if (values != null) {
            values.forEach(array::add);
        }
        return this;
    }

    public StateWriter integers(String name, Collection<Integer> values) {
        ArrayNode array = node.putArray(checkName(name));
        if (values != null) {
            values.forEach(array::add);
        }
        return this;
    }

    public StateWriter reference(String name, PersistentObject value) {
        if (value == null) {
            node.putNull(checkName(name));
        } else {
            node.set(checkName(name), references.apply(value));
        }
        return this;
    }

    public StateWriter references(String name, List<? extends PersistentObject> values) {
        ArrayNode array = node.putArray(checkName(name));
        if (values != null) {
            for (PersistentObject value : values) {
                array.add(references.apply(value));
            }
        }
        return this;
    }

    public StateWriter referenceMap(String name, Map<String, ? extends PersistentObject> values) {
        ObjectNode map = node.putObject(checkName(name));
        if (values != null) {
            for (Map.Entry<String, ? extends PersistentObject> entry : values.entrySet()) {
                map.set(entry.getKey(), references.apply(entry.getValue()));
            }
        }
        return this;
    }

    public StateWriter embedded(String name, Embeddable value) {
        if (value == null) {
            node.putNull(checkName(name));
        } else {
            node.set(checkName(name), embed(value));
        }
        return this;
    }

    public StateWriter embeddedList(String name, List<? extends Embeddable> values) {
        ArrayNode array = node.putArray(checkName(name));
        if (values != null) {
            for (Embeddable value : values) {
                array.add(embed(value));
            }
        }
        return this;
    }

    private ObjectNode embed(Embeddable value) {
        ObjectNode child = node.objectNode();
        child.put(Record.TYPE_KEY, value.embeddedType());
        value.writeTo(new StateWriter(child, references));
        return child;
    }

    private static String checkName(String name) {
        if (name == null || name.isBlank() || name.startsWith("@")) {
            throw new IllegalArgumentException("Invalid field name: " + name);
        }
        return name;
    }
}
