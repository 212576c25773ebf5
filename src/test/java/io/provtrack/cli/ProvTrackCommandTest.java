package io.provtrack.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.provtrack.util.Jsons;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProvTrackCommandTest {
    private static final String STEP = """
            {
              "name": "copy",
              "command": "cp",
              "inputs": [{"value": "in.txt", "position": 1}],
              "outputs": [{"value": "out.txt", "position": 2}],
              "unknown_field": true
            }
            """;

    @Test
    void recordedStepShowsUpInStatusPlansAndLog() throws Exception {
        Path root = Files.createTempDirectory("provtrack-test-cli-");
        try {
            Files.writeString(root.resolve("in.txt"), "v1", StandardCharsets.UTF_8);
            Files.writeString(root.resolve("out.txt"), "v1", StandardCharsets.UTF_8);
            Path stepFile = root.resolve("copy.json");
            Files.writeString(stepFile, STEP, StandardCharsets.UTF_8);

            assertTrue(execute(root, "init").path("created").asBoolean());
            JsonNode run = execute(root, "run", "--file", stepFile.toString(), "--no-execute");
            assertEquals("copy", run.path("planName").asText());
            assertEquals(1, run.path("order").asInt());
            assertFalse(run.path("executed").asBoolean());

            JsonNode clean = execute(root, "status");
            assertTrue(clean.path("stalePaths").isEmpty());

            Files.writeString(root.resolve("in.txt"), "v2", StandardCharsets.UTF_8);
            JsonNode stale = execute(root, "status");
            assertEquals("in.txt", stale.path("stalePaths").path("out.txt").get(0).asText());
            assertEquals("copy", execute(root, "update", "--dry-run").path("plans").get(0).asText());

            assertEquals(1, execute(root, "plans").size());
            assertEquals("copy", execute(root, "log", "--limit", "1").get(0).path("plan").asText());
            assertTrue(execute(root, "journal", "--verify").path("valid").asBoolean());
            assertEquals(2, execute(root, "journal", "--lines", "5").size());

            execute(root, "invalidate", "copy");
            assertEquals(0, execute(root, "plans").size());
            assertEquals(1, execute(root, "plans", "--all").size());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void failuresReturnNonZero() throws Exception {
        Path root = Files.createTempDirectory("provtrack-test-cli-fail-");
        try {
            CommandLine cli = new CommandLine(new ProvTrackCommand());
            cli.setErr(new PrintWriter(new StringWriter()));
            assertEquals(1, cli.execute("--root", root.toString(), "--working-tree", "invalidate", "nope"));
            assertEquals(2, cli.execute("--root", root.toString(), "run"));
        } finally {
            deleteRecursively(root);
        }
    }

    private static JsonNode execute(Path root, String... args) throws IOException {
        List<String> argv = new ArrayList<>(List.of("--root", root.toString(), "--working-tree"));
        argv.addAll(List.of(args));
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        PrintStream previous = System.out;
        int exit;
        try {
            System.setOut(new PrintStream(buffer, true, StandardCharsets.UTF_8));
            exit = new CommandLine(new ProvTrackCommand()).execute(argv.toArray(new String[0]));
        } finally {
            System.setOut(previous);
        }
        assertEquals(0, exit, String.join(" ", argv));
        return Jsons.mapper().readTree(buffer.toString(StandardCharsets.UTF_8));
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
