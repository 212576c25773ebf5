package io.provtrack.persistence;

/**
 * One persisted model. Implementations are closed enums; the type name is the
 * {@code @type} tag written into every record of that model.
 */
public interface PersistentType {
    String typeName();

    /** Root types are catalogued in the database root under {@link #typeName()}. */
    boolean isRoot();

    /** Creates an empty instance that the reader fills (or leaves as a ghost). */
    PersistentObject newInstance();
}
