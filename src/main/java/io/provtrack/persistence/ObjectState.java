package io.provtrack.persistence;

public enum ObjectState {
    /** Created and added, never stored. */
    NEW,
    /** Matches the stored record. */
    UP_TO_DATE,
    /** Changed since it was last stored. */
    MODIFIED,
    /** Identity known, fields not loaded yet. */
    GHOST
}
