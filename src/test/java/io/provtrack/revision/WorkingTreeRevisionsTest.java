package io.provtrack.revision;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.stream.Stream;

final class WorkingTreeRevisionsTest {

    @Test
    void filesHashLikeGitBlobs() throws Exception {
        Path root = Files.createTempDirectory("provtrack-test-tree-");
        try {
            Files.writeString(root.resolve("hello.txt"), "hello\n", StandardCharsets.UTF_8);
            Files.createFile(root.resolve("empty.txt"));
            WorkingTreeRevisions revisions = new WorkingTreeRevisions(root);

            Assertions.assertEquals(Optional.of("ce013625030ba8dba906f756967f9e9ca394464a"),
                    revisions.checksumAt("hello.txt", "HEAD"));
            Assertions.assertEquals(Optional.of("e69de29bb2d1d6434b8b29ae775ad8c2e48c5391"),
                    revisions.checksumAt("empty.txt", "anything"));
            Assertions.assertTrue(revisions.checksumAt("missing.txt", "HEAD").isEmpty());
            Assertions.assertTrue(revisions.checksumAt("../outside.txt", "HEAD").isEmpty());
            Assertions.assertTrue(revisions.checksumAt(" ", "HEAD").isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void directoryChecksumFollowsItsContents() throws Exception {
        Path root = Files.createTempDirectory("provtrack-test-tree-dir-");
        try {
            Path data = Files.createDirectories(root.resolve("data"));
            Files.writeString(data.resolve("a.csv"), "1", StandardCharsets.UTF_8);
            WorkingTreeRevisions revisions = new WorkingTreeRevisions(root);

            String before = revisions.checksumAt("data", "HEAD").orElseThrow();
            Assertions.assertEquals(before, revisions.checksumAt("data/", "HEAD").orElseThrow());
            Files.writeString(data.resolve("a.csv"), "2", StandardCharsets.UTF_8);
            String changed = revisions.checksumAt("data", "HEAD").orElseThrow();
            Assertions.assertNotEquals(before, changed);
            Files.writeString(data.resolve("b.csv"), "", StandardCharsets.UTF_8);
            Assertions.assertNotEquals(changed, revisions.checksumAt("data", "HEAD").orElseThrow());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void directoriesHashLikeGitTrees() throws Exception {
        Path root = Files.createTempDirectory("provtrack-test-tree-git-");
        try {
            Path data = Files.createDirectories(root.resolve("data"));
            Files.writeString(data.resolve("a.csv"), "1", StandardCharsets.UTF_8);
            Files.createDirectories(data.resolve("sub"));
            Files.createFile(data.resolve("sub").resolve("b.txt"));
            Files.createDirectories(data.resolve("empty"));
            Files.createDirectories(root.resolve("nothing"));
            WorkingTreeRevisions revisions = new WorkingTreeRevisions(root);

            // Same ids as `git rev-parse HEAD:data` after committing this layout.
            Assertions.assertEquals(Optional.of("82dd38d3f2d162fd3f9ad7309970f3e53aa5d5e7"),
                    revisions.checksumAt("data", "HEAD"));
            Assertions.assertEquals(Optional.of("4b825dc642cb6eb9a060e54bf8d69288fbee4904"),
                    revisions.checksumAt("nothing", "HEAD"));
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
