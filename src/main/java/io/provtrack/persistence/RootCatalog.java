package io.provtrack.persistence;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The object stored under {@link Database#ROOT_OID}: one {@link Index} per
 * root type name.
 */
public final class RootCatalog extends PersistentObject {
    private LinkedHashMap<String, Index> indexes = new LinkedHashMap<>();

    RootCatalog() {
    }

    @Override
    public PersistentType type() {
        return CatalogType.ROOT;
    }

    public Index index(String typeName) {
        activate();
        Index index = indexes.get(typeName);
        if (index == null) {
            throw new IllegalArgumentException("No index for type: " + typeName);
        }
        return index;
    }

    public Map<String, Index> indexes() {
        activate();
        return Collections.unmodifiableMap(indexes);
    }

    boolean hasIndex(String typeName) {
        activate();
        return indexes.containsKey(typeName);
    }

    void putIndex(Index index) {
        changed();
        indexes.put(index.name(), index);
    }

    @Override
    protected void writeState(StateWriter out) {
        out.referenceMap("indexes", indexes);
    }

    @Override
    protected void readState(StateReader in) {
        indexes = in.referenceMap("indexes", Index.class);
    }
}
