package io.provtrack.persistence;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The closed set of types a database will read. Records tagged with anything
 * else are rejected instead of instantiated.
 */
public final class TypeRegistry {
    private final Map<String, PersistentType> types;

    private TypeRegistry(Map<String, PersistentType> types) {
        this.types = Collections.unmodifiableMap(types);
    }

    public static TypeRegistry of(PersistentType... modelTypes) {
        Map<String, PersistentType> types = new LinkedHashMap<>();
        for (CatalogType type : CatalogType.values()) {
            types.put(type.typeName(), type);
        }
        for (PersistentType type : modelTypes) {
            PersistentType previous = types.putIfAbsent(type.typeName(), type);
            if (previous != null && previous != type) {
                throw new IllegalArgumentException("Duplicate persistent type name: " + type.typeName());
            }
        }
        return new TypeRegistry(types);
    }

    public PersistentType lookup(String typeName) {
        PersistentType type = typeName == null ? null : types.get(typeName);
        if (type == null) {
            throw new UnknownTypeException(typeName);
        }
        return type;
    }

    public List<PersistentType> rootTypes() {
        List<PersistentType> out = new ArrayList<>();
        for (PersistentType type : types.values()) {
            if (type.isRoot()) {
                out.add(type);
            }
        }
        return out;
    }
}
