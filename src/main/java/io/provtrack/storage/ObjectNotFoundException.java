package io.provtrack.storage;

import io.provtrack.ProvTrackException;

public final class ObjectNotFoundException extends ProvTrackException {
    private final String oid;

    public ObjectNotFoundException(String oid) {
        super("Object not found: " + oid);
        this.oid = oid;
    }

    public String oid() {
        return oid;
    }
}
