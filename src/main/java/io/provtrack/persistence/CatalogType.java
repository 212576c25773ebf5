package io.provtrack.persistence;

public enum CatalogType implements PersistentType {
    ROOT("Root") {
        @Override
        public PersistentObject newInstance() {
            return new RootCatalog();
        }
    },
    INDEX("Index") {
        @Override
        public PersistentObject newInstance() {
            return new Index();
        }
    };

    private final String typeName;

    CatalogType(String typeName) {
        this.typeName = typeName;
    }

    @Override
    public String typeName() {
        return typeName;
    }

    @Override
    public boolean isRoot() {
        return false;
    }
}
