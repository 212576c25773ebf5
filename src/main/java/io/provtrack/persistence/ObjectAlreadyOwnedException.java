package io.provtrack.persistence;

import io.provtrack.ProvTrackException;

public final class ObjectAlreadyOwnedException extends ProvTrackException {
    public ObjectAlreadyOwnedException(PersistentObject object) {
        super("Object already belongs to another database: " + object.type().typeName() + "/" + object.oid());
    }
}
