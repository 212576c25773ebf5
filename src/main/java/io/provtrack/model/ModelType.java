package io.provtrack.model;

import io.provtrack.persistence.PersistentObject;
import io.provtrack.persistence.PersistentType;
import io.provtrack.persistence.TypeRegistry;

public enum ModelType implements PersistentType {
    ACTIVITY("Activity") {
        @Override
        public PersistentObject newInstance() {
            return new Activity();
        }
    },
    ENTITY("Entity") {
        @Override
        public PersistentObject newInstance() {
            return new Entity();
        }
    },
    PLAN("Plan") {
        @Override
        public PersistentObject newInstance() {
            return new Plan();
        }
    };

    private final String typeName;

    ModelType(String typeName) {
        this.typeName = typeName;
    }

    @Override
    public String typeName() {
        return typeName;
    }

    @Override
    public boolean isRoot() {
        return true;
    }

    public static TypeRegistry registry() {
        return TypeRegistry.of(values());
    }
}
