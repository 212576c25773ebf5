package io.provtrack.persistence;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;

/**
 * Insertion-ordered catalog of every stored object of one root type, keyed by
 * oid.
 */
public final class Index extends PersistentObject {
    private String name;
    private LinkedHashMap<String, PersistentObject> entries = new LinkedHashMap<>();

    Index() {
    }

    Index(String name) {
        this.name = name;
    }

    static String oidFor(String typeName) {
        return typeName.toLowerCase(Locale.ROOT) + "-index";
    }

    @Override
    public PersistentType type() {
        return CatalogType.INDEX;
    }

    public String name() {
        activate();
        return name;
    }

    public int size() {
        activate();
        return entries.size();
    }

    public boolean contains(String oid) {
        activate();
        return entries.containsKey(oid);
    }

    public PersistentObject get(String oid) {
        activate();
        return entries.get(oid);
    }

    public List<String> oids() {
        activate();
        return new ArrayList<>(entries.keySet());
    }

    public List<PersistentObject> values() {
        activate();
        return new ArrayList<>(entries.values());
    }

    void put(PersistentObject object) {
        activate();
        PersistentObject existing = entries.get(object.oid());
        if (existing == object) {
            return;
        }
        if (existing != null) {
            throw new DuplicateIdentifierException(object.oid());
        }
        changed();
        entries.put(object.oid(), object);
    }

    @Override
    protected void writeState(StateWriter out) {
        out.string("name", name);
        out.referenceMap("entries", entries);
    }

    @Override
    protected void readState(StateReader in) {
        name = in.string("name");
        entries = in.referenceMap("entries", PersistentObject.class);
    }
}
