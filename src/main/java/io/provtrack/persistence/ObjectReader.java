package io.provtrack.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import io.provtrack.ProvTrackException;

/**
 * Turns records back into objects. Reference stubs always resolve through the
 * database cache; an oid that is not cached yet becomes a ghost registered in
 * the cache, so every path to the same oid yields the same instance.
 */
final class ObjectReader {
    private final Database database;
    private final TypeRegistry types;

    ObjectReader(Database database, TypeRegistry types) {
        this.database = database;
        this.types = types;
    }

    PersistentObject deserialize(JsonNode data) {
        String oid = requireText(data, Record.OID_KEY);
        PersistentType type = types.lookup(requireText(data, Record.TYPE_KEY));
        PersistentObject object = type.newInstance();
        object.bind(database, oid, ObjectState.UP_TO_DATE);
        // Visible to nested lookups while its own fields are parsed.
        database.preCache(object);
        try {
            object.readState(new StateReader(data, this));
        } finally {
            database.releasePreCache(object);
        }
        return object;
    }

    void setGhostState(PersistentObject ghost, JsonNode data) {
        String typeName = requireText(data, Record.TYPE_KEY);
        if (!ghost.type().typeName().equals(typeName)) {
            throw new ProvTrackException("Record " + ghost.oid() + " has type " + typeName
                    + " but was referenced as " + ghost.type().typeName());
        }
        ghost.readState(new StateReader(data, this));
    }

    PersistentObject resolve(JsonNode stub) {
        if (stub == null || !stub.isObject() || !stub.path(Record.REFERENCE_KEY).asBoolean(false)) {
            throw new ProvTrackException("Expected a reference stub but found: " + stub);
        }
        String oid = requireText(stub, Record.OID_KEY);
        PersistentType type = types.lookup(requireText(stub, Record.TYPE_KEY));
        PersistentObject cached = database.cached(oid);
        if (cached != null) {
            return cached;
        }
        PersistentObject ghost = type.newInstance();
        database.newGhost(oid, ghost);
        return ghost;
    }

    private static String requireText(JsonNode data, String key) {
        JsonNode value = data == null ? null : data.get(key);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw new ProvTrackException("Record is missing '" + key + "'");
        }
        return value.asText();
    }
}
