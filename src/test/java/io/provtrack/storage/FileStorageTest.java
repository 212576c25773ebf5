package io.provtrack.storage;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.provtrack.util.Hashing;
import io.provtrack.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

final class FileStorageTest {

    @Test
    void storesAndLoadsRecords() throws Exception {
        Path root = Files.createTempDirectory("provtrack-test-storage-");
        try {
            FileStorage storage = new FileStorage(root.resolve("objects"));
            ObjectNode data = Jsons.mapper().createObjectNode();
            data.put("@type", "Entity");
            data.put("@oid", "root");
            data.put("path", "data/in.csv");

            Assertions.assertFalse(storage.exists("root"));
            storage.store("root", data);
            Assertions.assertTrue(storage.exists("root"));
            Assertions.assertEquals("data/in.csv", storage.load("root").path("path").asText());
            Assertions.assertTrue(Files.isRegularFile(root.resolve("objects").resolve("root")));

            data.put("path", "data/other.csv");
            storage.store("root", data);
            Assertions.assertEquals("data/other.csv", storage.load("root").path("path").asText());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void shardsLongOids() throws Exception {
        Path root = Files.createTempDirectory("provtrack-test-storage-shard-");
        try {
            FileStorage storage = new FileStorage(root);
            String oid = Hashing.sha3Hex("/plans/abc");
            storage.store(oid, Jsons.mapper().createObjectNode().put("@oid", oid));

            Path expected = root.resolve(oid.substring(0, 2)).resolve(oid.substring(2, 4)).resolve(oid);
            Assertions.assertTrue(Files.isRegularFile(expected));
            Assertions.assertTrue(storage.exists(oid));

            try (Stream<Path> files = Files.list(expected.getParent())) {
                List<Path> leftovers = files.filter(p -> p.toString().endsWith(".tmp")).toList();
                Assertions.assertTrue(leftovers.isEmpty());
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void oidsAreCaseSensitive() throws Exception {
        Path root = Files.createTempDirectory("provtrack-test-storage-case-");
        try {
            FileStorage storage = new FileStorage(root);
            storage.store("X", Jsons.mapper().createObjectNode().put("v", 1));

            Assertions.assertTrue(storage.exists("X"));
            Assertions.assertFalse(storage.exists("x"));
            Assertions.assertThrows(ObjectNotFoundException.class, () -> storage.load("x"));

            storage.store("x", Jsons.mapper().createObjectNode().put("v", 2));
            Assertions.assertEquals(1, storage.load("X").path("v").asInt());
            Assertions.assertEquals(2, storage.load("x").path("v").asInt());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void missingRecordThrowsNotFound() throws Exception {
        Path root = Files.createTempDirectory("provtrack-test-storage-missing-");
        try {
            FileStorage storage = new FileStorage(root);
            ObjectNotFoundException error = Assertions.assertThrows(
                    ObjectNotFoundException.class, () -> storage.load("nothing"));
            Assertions.assertEquals("nothing", error.oid());
            Assertions.assertFalse(storage.exists("nothing"));
            Assertions.assertThrows(IllegalArgumentException.class, () -> storage.load("../escape"));
        } finally {
            deleteRecursively(root);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
