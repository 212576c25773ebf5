package io.provtrack.model;

import io.provtrack.persistence.Database;
import io.provtrack.persistence.PersistentObject;
import io.provtrack.persistence.PersistentType;
import io.provtrack.persistence.StateReader;
import io.provtrack.persistence.StateWriter;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * One file at one content checksum. Entities are shared: every activity that
 * used or generated the same path at the same checksum points at the same
 * stored entity.
 */
public final class Entity extends PersistentObject {
    private String id;
    private String path;
    private String checksum;

    Entity() {
    }

    public Entity(String id, String path, String checksum) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("entity id cannot be empty");
        }
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("entity path cannot be empty: " + id);
        }
        this.id = id;
        this.path = path;
        this.checksum = checksum;
    }

    public static String generateId(String checksum, String path) {
        return "/entities/" + checksum + "/" + quotePath(path);
    }

    /**
     * Returns the entity for {@code path} at {@code checksum}, reusing the one
     * already known to {@code database} when there is one.
     */
    public static Entity findOrCreate(Database database, String path, String checksum) {
        String id = generateId(checksum, path);
        String oid = Database.hashId(id);
        if (database.contains(oid)) {
            return database.get(oid, Entity.class);
        }
        Entity entity = new Entity(id, path, checksum);
        database.add(entity);
        return entity;
    }

    @Override
    public PersistentType type() {
        return ModelType.ENTITY;
    }

    @Override
    protected String naturalId() {
        return id;
    }

    public String id() {
        activate();
        return id;
    }

    public String path() {
        activate();
        return path;
    }

    public String checksum() {
        activate();
        return checksum;
    }

    @Override
    protected void writeState(StateWriter out) {
        out.string("id", id)
                .string("path", path)
                .string("checksum", checksum);
    }

    @Override
    protected void readState(StateReader in) {
        id = in.string("id");
        path = in.string("path");
        checksum = in.string("checksum");
    }

    static String quotePath(String path) {
        String trimmed = path;
        while (trimmed.startsWith("/")) {
            trimmed = trimmed.substring(1);
        }
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        StringBuilder sb = new StringBuilder(trimmed.length());
        String[] segments = trimmed.split("/", -1);
        for (int i = 0; i < segments.length; i++) {
            if (i > 0) {
                sb.append('/');
            }
            sb.append(URLEncoder.encode(segments[i], StandardCharsets.UTF_8).replace("+", "%20"));
        }
        return sb.toString();
    }
}
