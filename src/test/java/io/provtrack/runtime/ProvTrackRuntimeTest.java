package io.provtrack.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import io.provtrack.ProvTrackException;
import io.provtrack.config.ProvTrackConfig;
import io.provtrack.graph.BlockedByDeletedInputException;
import io.provtrack.revision.GitRevisions;
import io.provtrack.revision.WorkingTreeRevisions;
import io.provtrack.workflow.PlannedStep;
import io.provtrack.workflow.StepExecutionException;
import io.provtrack.workflow.StepResult;
import io.provtrack.workflow.WorkflowExecutor;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

final class ProvTrackRuntimeTest {

    @Test
    void initIsIdempotent() throws Exception {
        Path root = Files.createTempDirectory("provtrack-test-init-");
        try {
            ProvTrackRuntime runtime = new ProvTrackRuntime(ProvTrackConfig.fromRoot(root.toString()), new ConcatExecutor(root));
            Assertions.assertTrue(runtime.init().created());
            Assertions.assertFalse(runtime.init().created());
            Assertions.assertTrue(Files.isDirectory(root.resolve(".provtrack").resolve("objects")));
            Assertions.assertEquals(2, runtime.journalTail(10).size());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void modifiedInputMakesDownstreamOutputsStaleUntilUpdated() throws Exception {
        Path root = Files.createTempDirectory("provtrack-test-stale-");
        try {
            ConcatExecutor executor = new ConcatExecutor(root);
            ProvTrackRuntime runtime = new ProvTrackRuntime(ProvTrackConfig.fromRoot(root.toString()), executor);
            WorkingTreeRevisions revisions = new WorkingTreeRevisions(root);
            runtime.init();
            write(root, "in.txt", "a");

            ProvTrackRuntime.RunOutcome copy = runtime.run(step("copy", "in.txt", "out.txt"), revisions, true);
            ProvTrackRuntime.RunOutcome count = runtime.run(step("count", "out.txt", "count.txt"), revisions, true);
            Assertions.assertEquals(1L, copy.order());
            Assertions.assertEquals(2L, count.order());
            Assertions.assertFalse(copy.reusedPlan());
            Assertions.assertTrue(runtime.status(revisions).upToDate());

            write(root, "in.txt", "b");
            ProvTrackRuntime.StatusReport status = runtime.status(revisions);
            Assertions.assertFalse(status.upToDate());
            Assertions.assertEquals(List.of("in.txt"), status.modifiedInputs());
            Assertions.assertEquals(
                    Map.of("out.txt", List.of("in.txt"), "count.txt", List.of("in.txt")),
                    status.stalePaths());
            Assertions.assertTrue(status.blockedPlans().isEmpty());

            ProvTrackRuntime.UpdatePlan dryRun = runtime.update(revisions, true);
            Assertions.assertEquals(List.of("copy", "count"), dryRun.plans());
            Assertions.assertTrue(dryRun.recordedOrders().isEmpty());
            Assertions.assertEquals(2, executor.calls.size());

            ProvTrackRuntime.UpdatePlan update = runtime.update(revisions, false);
            Assertions.assertEquals(List.of(3L, 4L), update.recordedOrders());
            Assertions.assertEquals(List.of("copy", "count"), executor.calls.subList(2, 4));
            Assertions.assertEquals("b", Files.readString(root.resolve("count.txt"), StandardCharsets.UTF_8));
            Assertions.assertTrue(runtime.status(revisions).upToDate());
            Assertions.assertTrue(runtime.update(revisions, false).plans().isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void deletedInputBlocksItsConsumer() throws Exception {
        Path root = Files.createTempDirectory("provtrack-test-blocked-");
        try {
            ProvTrackRuntime runtime = new ProvTrackRuntime(ProvTrackConfig.fromRoot(root.toString()), new ConcatExecutor(root));
            WorkingTreeRevisions revisions = new WorkingTreeRevisions(root);
            write(root, "a.txt", "a");
            write(root, "b.txt", "b");
            StepDefinition merge = new StepDefinition("merge", "cat", null, null, null,
                    List.of(StepDefinition.Slot.at("a.txt", 1), StepDefinition.Slot.at("b.txt", 2)),
                    List.of(StepDefinition.Slot.at("m.txt", null)), null, null);
            runtime.run(merge, revisions, true);
            runtime.run(step("report", "m.txt", "r.txt"), revisions, true);

            write(root, "a.txt", "changed");
            Files.delete(root.resolve("b.txt"));
            ProvTrackRuntime.StatusReport status = runtime.status(revisions);
            Assertions.assertEquals(List.of("a.txt"), status.modifiedInputs());
            Assertions.assertEquals(List.of("b.txt"), status.deletedInputs());
            Assertions.assertEquals(List.of("merge", "report"), status.blockedPlans());
            Assertions.assertTrue(status.stalePaths().isEmpty());

            BlockedByDeletedInputException error = Assertions.assertThrows(BlockedByDeletedInputException.class,
                    () -> runtime.update(revisions, false));
            Assertions.assertEquals(List.of("merge", "report"), error.planNames());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void failedUpdateKeepsStepsThatAlreadyRan() throws Exception {
        Path root = Files.createTempDirectory("provtrack-test-partial-");
        try {
            ConcatExecutor executor = new ConcatExecutor(root);
            ProvTrackRuntime runtime = new ProvTrackRuntime(ProvTrackConfig.fromRoot(root.toString()), executor);
            WorkingTreeRevisions revisions = new WorkingTreeRevisions(root);
            write(root, "in.txt", "a");
            runtime.run(step("copy", "in.txt", "out.txt"), revisions, true);
            runtime.run(step("count", "out.txt", "count.txt"), revisions, true);

            write(root, "in.txt", "b");
            executor.failOn = "count";
            StepExecutionException error = Assertions.assertThrows(StepExecutionException.class,
                    () -> runtime.update(revisions, false));
            Assertions.assertEquals("count", error.planName());

            List<ProvTrackRuntime.ActivityView> log = runtime.log(0);
            Assertions.assertEquals(3, log.size());
            Assertions.assertEquals("copy", log.get(2).plan());
            Assertions.assertEquals(3L, log.get(2).order());
            ProvTrackRuntime.StatusReport status = runtime.status(revisions);
            Assertions.assertEquals(List.of("out.txt"), status.modifiedInputs());
            Assertions.assertEquals(Map.of("count.txt", List.of("out.txt")), status.stalePaths());
            Assertions.assertEquals("failed", runtime.journalTail(1).get(0).path("result").asText());

            executor.failOn = null;
            Assertions.assertEquals(List.of("count"), runtime.update(revisions, false).plans());
            Assertions.assertTrue(runtime.status(revisions).upToDate());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void gitModeRecordsWhatTheStepWroteAndComparesAgainstCommits() throws Exception {
        Assumptions.assumeTrue(gitAvailable(), "git executable not available");
        Path root = Files.createTempDirectory("provtrack-test-git-");
        try {
            git(root, "init", "-q");
            write(root, ".gitignore", ".provtrack/\n");
            Files.createDirectories(root.resolve("data"));
            write(root, "data/a.csv", "1");
            write(root, "in.txt", "a");
            commitAll(root);

            ProvTrackRuntime runtime = new ProvTrackRuntime(ProvTrackConfig.fromRoot(root.toString()), new ConcatExecutor(root));
            GitRevisions revisions = new GitRevisions(root);
            ProvTrackRuntime.RunOutcome copy = runtime.run(step("copy", "in.txt", "out.txt"), revisions, true);
            Assertions.assertEquals(1L, copy.order());
            write(root, "summary.txt", "done");
            runtime.run(step("summarize", "data", "summary.txt"), revisions, false);

            Assertions.assertEquals(
                    new WorkingTreeRevisions(root).checksumAt("out.txt", "HEAD").orElseThrow(),
                    runtime.log(0).get(0).generations().get("out.txt"));
            Assertions.assertTrue(runtime.status(revisions).upToDate());

            write(root, "in.txt", "b");
            Assertions.assertTrue(runtime.status(revisions).upToDate());
            commitAll(root);
            Assertions.assertEquals(Map.of("out.txt", List.of("in.txt")), runtime.status(revisions).stalePaths());

            Assertions.assertEquals(List.of("copy"), runtime.update(revisions, false).plans());
            Assertions.assertEquals("b", Files.readString(root.resolve("out.txt"), StandardCharsets.UTF_8));
            Assertions.assertTrue(runtime.status(revisions).upToDate());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void recordingWithoutExecutionReusesEquivalentPlans() throws Exception {
        Path root = Files.createTempDirectory("provtrack-test-record-");
        try {
            ConcatExecutor executor = new ConcatExecutor(root);
            ProvTrackRuntime runtime = new ProvTrackRuntime(ProvTrackConfig.fromRoot(root.toString()), executor);
            WorkingTreeRevisions revisions = new WorkingTreeRevisions(root);
            write(root, "in.txt", "x");
            write(root, "out.txt", "x");
            write(root, "old.txt", "gone soon");

            StepDefinition first = new StepDefinition("copy", "cp", null, null, null,
                    List.of(StepDefinition.Slot.at("in.txt", 1)), List.of(StepDefinition.Slot.at("out.txt", 2)),
                    null, List.of("old.txt", "never-existed.txt"));
            ProvTrackRuntime.RunOutcome recorded = runtime.run(first, revisions, false);
            ProvTrackRuntime.RunOutcome again = runtime.run(step("other-name", "in.txt", "out.txt"), revisions, false);

            Assertions.assertTrue(executor.calls.isEmpty());
            Assertions.assertFalse(recorded.executed());
            Assertions.assertTrue(again.reusedPlan());
            Assertions.assertEquals(recorded.planId(), again.planId());
            Assertions.assertEquals("copy", again.planName());

            List<ProvTrackRuntime.ActivityView> log = runtime.log(0);
            Assertions.assertEquals(2, log.size());
            Assertions.assertEquals(List.of("old.txt"), log.get(0).invalidations());
            Assertions.assertTrue(log.get(1).invalidations().isEmpty());
            Assertions.assertEquals(1, runtime.log(1).size());
            Assertions.assertEquals(2L, runtime.log(1).get(0).order());
            Assertions.assertEquals(log.get(0).usages().get("in.txt"), log.get(0).generations().get("out.txt"));

            Assertions.assertThrows(ProvTrackException.class,
                    () -> runtime.run(step("missing", "in.txt", "nowhere.txt"), revisions, false));
            Assertions.assertEquals(1, runtime.plans(false).size());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void invalidatedPlansLeaveTheGraph() throws Exception {
        Path root = Files.createTempDirectory("provtrack-test-invalidate-");
        try {
            ProvTrackRuntime runtime = new ProvTrackRuntime(ProvTrackConfig.fromRoot(root.toString()), new ConcatExecutor(root));
            WorkingTreeRevisions revisions = new WorkingTreeRevisions(root);
            write(root, "in.txt", "1");
            runtime.run(step("copy", "in.txt", "out.txt"), revisions, true);

            ProvTrackRuntime.PlanView view = runtime.invalidate("copy");
            Assertions.assertNotNull(view.invalidatedAt());
            Assertions.assertTrue(runtime.plans(false).isEmpty());
            Assertions.assertEquals(1, runtime.plans(true).size());
            Assertions.assertThrows(IllegalArgumentException.class, () -> runtime.invalidate("nope"));

            write(root, "in.txt", "2");
            Assertions.assertTrue(runtime.status(revisions).stalePaths().isEmpty());
            ProvTrackRuntime.RunOutcome rerun = runtime.run(step("copy", "in.txt", "out.txt"), revisions, true);
            Assertions.assertFalse(rerun.reusedPlan());
            Assertions.assertNotEquals(view.id(), rerun.planId());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void journalChainsEveryChange() throws Exception {
        Path root = Files.createTempDirectory("provtrack-test-journal-");
        try {
            ProvTrackRuntime runtime = new ProvTrackRuntime(ProvTrackConfig.fromRoot(root.toString()), new ConcatExecutor(root));
            WorkingTreeRevisions revisions = new WorkingTreeRevisions(root);
            runtime.init();
            write(root, "in.txt", "1");
            runtime.run(step("copy", "in.txt", "out.txt"), revisions, true);
            runtime.invalidate("copy");

            List<JsonNode> rows = runtime.journalTail(10);
            Assertions.assertEquals(List.of("init", "run", "invalidate"),
                    rows.stream().map(row -> row.path("command").asText()).toList());
            Assertions.assertEquals("copy", rows.get(1).path("details").path("plan").asText());
            Assertions.assertEquals(0, runtime.verifyJournal());
        } finally {
            deleteRecursively(root);
        }
    }

    private static boolean gitAvailable() {
        try {
            Process process = new ProcessBuilder("git", "--version").redirectErrorStream(true).start();
            process.getInputStream().readAllBytes();
            return process.waitFor(10, TimeUnit.SECONDS) && process.exitValue() == 0;
        } catch (IOException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static void commitAll(Path root) throws Exception {
        git(root, "add", "-A");
        git(root, "-c", "user.name=provtrack", "-c", "user.email=provtrack@example.invalid",
                "commit", "-q", "-m", "snapshot");
    }

    private static void git(Path root, String... args) throws Exception {
        List<String> command = new ArrayList<>(List.of("git"));
        command.addAll(List.of(args));
        Process process = new ProcessBuilder(command).directory(root.toFile()).redirectErrorStream(true).start();
        String output = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
        Assertions.assertTrue(process.waitFor(30, TimeUnit.SECONDS), "git timed out");
        Assertions.assertEquals(0, process.exitValue(), String.join(" ", command) + ": " + output);
    }

    private static StepDefinition step(String name, String input, String output) {
        return new StepDefinition(name, "cp", null, null, null,
                List.of(StepDefinition.Slot.at(input, 1)), List.of(StepDefinition.Slot.at(output, 2)), null, null);
    }

    private static void write(Path root, String path, String content) throws IOException {
        Files.writeString(root.resolve(path), content, StandardCharsets.UTF_8);
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

    /**
     * Writes the concatenated inputs to every output instead of spawning a
     * process. Fails the step named {@code failOn}.
     */
    private static final class ConcatExecutor implements WorkflowExecutor {
        private final Path root;
        private final List<String> calls = new ArrayList<>();
        private String failOn;

        private ConcatExecutor(Path root) {
            this.root = root;
        }

        @Override
        public List<StepResult> execute(List<PlannedStep> steps) {
            List<StepResult> results = new ArrayList<>();
            for (PlannedStep step : steps) {
                calls.add(step.plan().name());
                if (step.plan().name().equals(failOn)) {
                    throw new StepExecutionException(failOn, "exit=1").withCompleted(results);
                }
                Instant startedAt = Instant.now();
                try {
                    StringBuilder content = new StringBuilder();
                    for (String input : step.inputs()) {
                        content.append(Files.readString(root.resolve(input), StandardCharsets.UTF_8));
                    }
                    for (String output : step.outputs()) {
                        Files.writeString(root.resolve(output), content.toString(), StandardCharsets.UTF_8);
                    }
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
                results.add(new StepResult(step.plan(), 0, step.outputs(), startedAt, Instant.now(), ""));
            }
            return results;
        }
    }
}
