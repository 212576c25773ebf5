package io.provtrack.storage;

import com.fasterxml.jackson.databind.JsonNode;
import io.provtrack.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

public final class FileStorage implements Storage {
    public static final int MIN_SHARDED_FILENAME_LENGTH = 64;

    private final Path root;

    public FileStorage(Path root) {
        this.root = root;
        try {
            Files.createDirectories(root);
        } catch (IOException e) {
            throw new StorageException("Failed to initialize object directory: " + root, e);
        }
    }

    public Path root() {
        return root;
    }

    @Override
    public void store(String oid, JsonNode data) {
        Path target = pathOf(oid);
        Path tmp = null;
        try {
            Files.createDirectories(target.getParent());
            tmp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
            Files.writeString(tmp, Jsons.mapper().writeValueAsString(data), StandardCharsets.UTF_8);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException ignored) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new StorageException("Failed to store object: " + oid, e);
        }
    }

    @Override
    public JsonNode load(String oid) {
        Path path = pathOf(oid);
        if (!Files.isRegularFile(path)) {
            throw new ObjectNotFoundException(oid);
        }
        try {
            return Jsons.mapper().readTree(path.toFile());
        } catch (IOException e) {
            throw new StorageException("Failed to load object: " + oid, e);
        }
    }

    @Override
    public boolean exists(String oid) {
        return Files.isRegularFile(pathOf(oid));
    }

    Path pathOf(String oid) {
        if (oid == null || oid.isBlank() || oid.contains("/") || oid.contains("\\") || oid.startsWith(".")) {
            throw new IllegalArgumentException("Invalid oid: " + oid);
        }
        if (oid.length() >= MIN_SHARDED_FILENAME_LENGTH) {
            return root.resolve(oid.substring(0, 2)).resolve(oid.substring(2, 4)).resolve(oid);
        }
        return root.resolve(oid);
    }

    private static void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException ignored) {
            // The failed store is already being reported.
        }
    }
}
