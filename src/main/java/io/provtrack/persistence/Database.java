package io.provtrack.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import io.provtrack.storage.ObjectNotFoundException;
import io.provtrack.storage.Storage;
import io.provtrack.util.Hashing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Object database over a {@link Storage}. Owns every cached object: the live
 * cache, the set of added-but-uncommitted objects, the pre-cache used while an
 * object is being read, and the list of dirty objects written on
 * {@link #commit()}.
 *
 * <p>Not thread-safe. Callers hold a repository-level lock around any
 * sequence of calls.
 */
public final class Database {
    public static final String ROOT_OID = "root";

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final Storage storage;
    private final TypeRegistry types;
    private final ObjectReader reader;
    private final Map<String, PersistentObject> cache = new HashMap<>();
    private final Map<String, PersistentObject> preCache = new HashMap<>();
    private final Map<String, PersistentObject> pending = new LinkedHashMap<>();
    private final Map<String, PersistentObject> dirty = new LinkedHashMap<>();
    private RootCatalog root;

    public Database(Storage storage, TypeRegistry types) {
        this.storage = Objects.requireNonNull(storage, "storage");
        this.types = Objects.requireNonNull(types, "types");
        this.reader = new ObjectReader(this, types);
    }

    public static String newOid() {
        return Hashing.randomHex(32);
    }

    public static String hashId(String id) {
        return Hashing.sha3Hex(id);
    }

    public static String generateOid(PersistentObject object) {
        if (object.oid() != null) {
            return object.oid();
        }
        String naturalId = object.naturalId();
        if (naturalId != null && !naturalId.isBlank()) {
            return hashId(naturalId);
        }
        return newOid();
    }

    public RootCatalog root() {
        if (root != null) {
            return root;
        }
        if (cached(ROOT_OID) != null || storage.exists(ROOT_OID)) {
            PersistentObject loaded = get(ROOT_OID);
            if (!(loaded instanceof RootCatalog catalog)) {
                throw new IllegalStateException("Object " + ROOT_OID + " is not a root catalog: " + loaded);
            }
            root = catalog;
        } else {
            root = new RootCatalog();
            addInternal(root, ROOT_OID);
        }
        for (PersistentType type : types.rootTypes()) {
            if (!root.hasIndex(type.typeName())) {
                Index index = new Index(type.typeName());
                addInternal(index, Index.oidFor(type.typeName()));
                root.putIndex(index);
            }
        }
        return root;
    }

    /**
     * Registers a new object. It becomes durable on the next {@link #commit()}.
     * Adding an object that is already registered here is a no-op.
     *
     * @throws ObjectAlreadyOwnedException if the object belongs to another database
     * @throws DuplicateIdentifierException if a different object already uses its oid
     */
    public void add(PersistentObject object) {
        Objects.requireNonNull(object, "object");
        if (object.database() != null && object.database() != this) {
            throw new ObjectAlreadyOwnedException(object);
        }
        if (object.type() instanceof CatalogType) {
            throw new IllegalArgumentException("Catalog objects are managed by the database: " + object);
        }
        types.lookup(object.type().typeName());
        String oid = generateOid(object);
        PersistentObject existing = cached(oid);
        if (existing == object) {
            return;
        }
        if (existing != null || storage.exists(oid)) {
            throw new DuplicateIdentifierException(oid);
        }
        addInternal(object, oid);
    }

    /**
     * Returns the object stored under {@code oid}. The same oid always yields
     * the same instance for the lifetime of this database.
     *
     * @throws ObjectNotFoundException if nothing is stored under {@code oid}
     */
    public PersistentObject get(String oid) {
        Objects.requireNonNull(oid, "oid");
        PersistentObject object = cached(oid);
        if (object != null) {
            return object;
        }
        JsonNode data = storage.load(oid);
        object = reader.deserialize(data);
        cache.put(oid, object);
        log.debug("Loaded {}", object);
        return object;
    }

    public <T extends PersistentObject> T get(String oid, Class<T> type) {
        PersistentObject object = get(oid);
        if (!type.isInstance(object)) {
            throw new IllegalArgumentException("Object " + oid + " is not a " + type.getSimpleName());
        }
        return type.cast(object);
    }

    /** Committed objects of a root type, in catalog order. */
    public <T extends PersistentObject> List<T> all(PersistentType type, Class<T> javaType) {
        List<T> out = new ArrayList<>();
        for (PersistentObject object : root().index(type.typeName()).values()) {
            out.add(javaType.cast(object));
        }
        return out;
    }

    /** The catalogued object of {@code type} stored under {@code oid}, if any. */
    public <T extends PersistentObject> Optional<T> findByOid(PersistentType type, String oid, Class<T> javaType) {
        PersistentObject object = root().index(type.typeName()).get(oid);
        if (object == null) {
            PersistentObject candidate = cached(oid);
            if (candidate != null && candidate.type() == type) {
                object = candidate;
            }
        }
        return Optional.ofNullable(object).filter(javaType::isInstance).map(javaType::cast);
    }

    /** Whether {@code oid} is cached, pending or stored. Never loads anything. */
    public boolean contains(String oid) {
        return cached(oid) != null || storage.exists(oid);
    }

    public PersistentObject cached(String oid) {
        PersistentObject object = cache.get(oid);
        if (object != null) {
            return object;
        }
        object = pending.get(oid);
        if (object != null) {
            return object;
        }
        return preCache.get(oid);
    }

    public boolean hasPendingChanges() {
        for (PersistentObject object : dirty.values()) {
            if (object.isDirty()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Writes every new or modified object and the closure of dirty objects it
     * references. Objects become {@code UP_TO_DATE} only after every record was
     * stored; if a store fails the dirty list is left as it was and the commit
     * can simply be retried.
     */
    public void commit() {
        ObjectWriter writer = new ObjectWriter(this);
        List<Record> records = new ArrayList<>();

        List<PersistentObject> batch = dirtyObjects(writer, false);
        while (!batch.isEmpty()) {
            for (PersistentObject object : batch) {
                records.addAll(writer.serialize(object));
            }
            batch = dirtyObjects(writer, false);
        }
        List<PersistentObject> catalogued = new ArrayList<>(writer.written());
        if (!catalogued.isEmpty()) {
            RootCatalog catalog = root();
            for (PersistentObject object : catalogued) {
                if (object.type().isRoot()) {
                    catalog.index(object.type().typeName()).put(object);
                }
            }
        }
        for (PersistentObject object : dirtyObjects(writer, true)) {
            records.addAll(writer.serialize(object));
        }

        for (Record record : records) {
            storage.store(record.oid(), record.data());
        }

        for (PersistentObject object : writer.written()) {
            object.markState(ObjectState.UP_TO_DATE);
            cache.put(object.oid(), object);
            pending.remove(object.oid());
            dirty.remove(object.oid());
        }
        dirty.values().removeIf(object -> !object.isDirty());
        if (!records.isEmpty()) {
            log.debug("Committed {} records", records.size());
        }
    }

    void register(PersistentObject object) {
        if (object.oid() == null) {
            object.assignOid(generateOid(object));
        }
        dirty.put(object.oid(), object);
    }

    void setState(PersistentObject ghost) {
        JsonNode data = storage.load(ghost.oid());
        ghost.markState(ObjectState.UP_TO_DATE);
        try {
            reader.setGhostState(ghost, data);
        } catch (RuntimeException e) {
            ghost.markState(ObjectState.GHOST);
            throw e;
        }
    }

    void newGhost(String oid, PersistentObject ghost) {
        if (cached(oid) != null) {
            throw new DuplicateIdentifierException(oid);
        }
        ghost.bind(this, oid, ObjectState.GHOST);
        cache.put(oid, ghost);
    }

    void preCache(PersistentObject object) {
        preCache.put(object.oid(), object);
    }

    void releasePreCache(PersistentObject object) {
        preCache.remove(object.oid());
    }

    private void addInternal(PersistentObject object, String oid) {
        object.bind(this, oid, ObjectState.NEW);
        pending.put(oid, object);
        dirty.put(oid, object);
    }

    private List<PersistentObject> dirtyObjects(ObjectWriter writer, boolean catalogObjects) {
        List<PersistentObject> out = new ArrayList<>();
        for (PersistentObject object : dirty.values()) {
            boolean isCatalog = object.type() instanceof CatalogType;
            if (isCatalog == catalogObjects && object.isDirty() && !writer.hasWritten(object.oid())) {
                out.add(object);
            }
        }
        return out;
    }
}
