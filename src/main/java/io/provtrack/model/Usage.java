package io.provtrack.model;

import io.provtrack.persistence.StateReader;

/** A file an activity read. */
public final class Usage extends EntityLink {

    public Usage(String id, Entity entity) {
        super(id, entity);
    }

    static Usage read(StateReader in) {
        return new Usage(in.string("id"), in.reference("entity", Entity.class));
    }
}
