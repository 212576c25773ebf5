package io.provtrack.storage;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Flat, durable mapping from object identifier to one JSON record. Knows
 * nothing about types, references or the root catalog.
 */
public interface Storage {

    /**
     * Persists {@code data} under {@code oid}, replacing any previous record.
     * A reader sees either the old or the new record, never a partial one.
     */
    void store(String oid, JsonNode data);

    /**
     * @throws ObjectNotFoundException if no record exists for {@code oid}
     */
    JsonNode load(String oid);

    boolean exists(String oid);
}
