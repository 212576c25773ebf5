package io.provtrack.model;

import io.provtrack.persistence.Embeddable;
import io.provtrack.persistence.StateWriter;

import java.util.Objects;

/** Embedded association between an {@link Activity} and one {@link Entity}. */
public abstract class EntityLink implements Embeddable {
    private final String id;
    private final Entity entity;

    protected EntityLink(String id, Entity entity) {
        this.id = Objects.requireNonNull(id, "id");
        this.entity = Objects.requireNonNull(entity, "entity");
    }

    public String id() {
        return id;
    }

    public Entity entity() {
        return entity;
    }

    public String path() {
        return entity.path();
    }

    public String checksum() {
        return entity.checksum();
    }

    @Override
    public String embeddedType() {
        return getClass().getSimpleName();
    }

    @Override
    public void writeTo(StateWriter out) {
        out.string("id", id).reference("entity", entity);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + path() + "@" + checksum() + ")";
    }
}
