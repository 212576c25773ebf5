package io.provtrack.model;

import io.provtrack.persistence.StateReader;

/** A file an activity wrote. */
public final class Generation extends EntityLink {

    public Generation(String id, Entity entity) {
        super(id, entity);
    }

    static Generation read(StateReader in) {
        return new Generation(in.string("id"), in.reference("entity", Entity.class));
    }
}
