package io.provtrack.persistence;

/**
 * Base class of every object the {@link Database} can store.
 *
 * <p>Subclasses keep their fields private, call {@link #activate()} at the top
 * of every accessor and {@link #changed()} at the top of every mutator. The
 * database then takes care of loading ghosts on first access and of writing
 * modified objects on the next commit.
 *
 * <p>State moves {@code NEW -> UP_TO_DATE} on the first store,
 * {@code UP_TO_DATE -> MODIFIED} on mutation, {@code MODIFIED -> UP_TO_DATE}
 * on store and {@code GHOST -> UP_TO_DATE} on first access.
 */
public abstract class PersistentObject {
    private String oid;
    private ObjectState state = ObjectState.NEW;
    private Database database;

    public final String oid() {
        return oid;
    }

    public final ObjectState state() {
        return state;
    }

    public final Database database() {
        return database;
    }

    public abstract PersistentType type();

    /**
     * Semantic identifier the oid is derived from, or {@code null} when the
     * object has none and gets a random oid.
     */
    protected String naturalId() {
        return null;
    }

    /** Writes every persisted field; nested persistent objects go through {@link StateWriter#reference}. */
    protected abstract void writeState(StateWriter out);

    /** Restores every persisted field written by {@link #writeState}. Missing fields keep their defaults. */
    protected abstract void readState(StateReader in);

    protected final void activate() {
        if (state == ObjectState.GHOST && database != null) {
            database.setState(this);
        }
    }

    protected final void changed() {
        activate();
        if (state == ObjectState.UP_TO_DATE) {
            state = ObjectState.MODIFIED;
        }
        if (database != null) {
            database.register(this);
        }
    }

    /**
     * Drops the oid of an object that has not been handed to a database yet,
     * so that a fresh one is derived when it is added.
     */
    protected final void resetOid() {
        if (database != null) {
            throw new IllegalStateException("Cannot reset the oid of a stored object: " + oid);
        }
        oid = null;
    }

    final boolean isDirty() {
        return state == ObjectState.NEW || state == ObjectState.MODIFIED;
    }

    final void bind(Database owner, String assignedOid, ObjectState initialState) {
        if (oid != null && !oid.equals(assignedOid)) {
            throw new IllegalStateException("Object oid cannot change: " + oid + " -> " + assignedOid);
        }
        this.database = owner;
        this.oid = assignedOid;
        this.state = initialState;
    }

    final void assignOid(String assignedOid) {
        if (oid != null && !oid.equals(assignedOid)) {
            throw new IllegalStateException("Object oid cannot change: " + oid + " -> " + assignedOid);
        }
        this.oid = assignedOid;
    }

    final void markState(ObjectState newState) {
        this.state = newState;
    }

    @Override
    public String toString() {
        return type().typeName() + "/" + oid;
    }
}
