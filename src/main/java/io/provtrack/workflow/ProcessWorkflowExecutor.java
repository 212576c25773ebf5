package io.provtrack.workflow;

import io.provtrack.model.CommandOutput;
import io.provtrack.model.Plan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs each plan's argv as a local process in the repository directory, one
 * step at a time. Exit codes outside the plan's success codes fail the step.
 */
public final class ProcessWorkflowExecutor implements WorkflowExecutor {
    private static final Logger log = LoggerFactory.getLogger(ProcessWorkflowExecutor.class);
    private static final int MAX_LOG_CHARS = 512;

    private final Path workDir;
    private final long timeoutMs;

    public ProcessWorkflowExecutor(Path workDir, long timeoutMs) {
        if (workDir == null) {
            throw new IllegalArgumentException("work directory cannot be null");
        }
        this.workDir = workDir;
        this.timeoutMs = Math.max(1_000L, timeoutMs);
    }

    @Override
    public List<StepResult> execute(List<PlannedStep> steps) {
        List<StepResult> results = new ArrayList<>(steps.size());
        for (PlannedStep step : steps) {
            try {
                results.add(run(step));
            } catch (StepExecutionException e) {
                throw e.withCompleted(results);
            }
        }
        return results;
    }

    private StepResult run(PlannedStep step) {
        Plan plan = step.plan();
        List<String> argv = plan.toArgv();
        if (argv.isEmpty()) {
            throw new StepExecutionException(plan.name(), "empty command");
        }
        prepareOutputs(plan);

        Path logFile;
        try {
            logFile = Files.createTempFile("provtrack-step-", ".log");
        } catch (IOException e) {
            throw new StepExecutionException(plan.name(), "cannot create log file", e);
        }
        try {
            ProcessBuilder pb = new ProcessBuilder(argv);
            pb.directory(workDir.toFile());
            pb.redirectErrorStream(true);
            pb.redirectOutput(logFile.toFile());
            log.info("Running {}: {}", plan.name(), String.join(" ", argv));

            Instant startedAt = Instant.now();
            Process process;
            try {
                process = pb.start();
            } catch (IOException e) {
                throw new StepExecutionException(plan.name(), "spawn failed: " + e.getMessage(), e);
            }
            try {
                process.getOutputStream().close();
                boolean finished = process.waitFor(timeoutMs, TimeUnit.MILLISECONDS);
                if (!finished) {
                    process.destroyForcibly();
                    process.waitFor(1, TimeUnit.SECONDS);
                    throw new StepExecutionException(plan.name(), "timeout after " + Duration.ofMillis(timeoutMs));
                }
            } catch (IOException e) {
                process.destroyForcibly();
                throw new StepExecutionException(plan.name(), "execution failed: " + e.getMessage(), e);
            } catch (InterruptedException e) {
                process.destroyForcibly();
                Thread.currentThread().interrupt();
                throw new StepExecutionException(plan.name(), "interrupted", e);
            }
            Instant endedAt = Instant.now();

            String output = Files.readString(logFile, StandardCharsets.UTF_8);
            int exit = process.exitValue();
            if (!plan.successCodes().contains(exit)) {
                throw new StepExecutionException(plan.name(), "exit=" + exit + " output=" + truncate(output));
            }
            List<String> produced = new ArrayList<>();
            for (String path : step.outputs()) {
                if (!Files.exists(workDir.resolve(path))) {
                    throw new StepExecutionException(plan.name(), "output not produced: " + path);
                }
                produced.add(path);
            }
            return new StepResult(plan, exit, produced, startedAt, endedAt, output.strip());
        } catch (IOException e) {
            throw new StepExecutionException(plan.name(), "cannot read step output", e);
        } finally {
            try {
                Files.deleteIfExists(logFile);
            } catch (IOException e) {
                log.warn("Failed to delete step log {}", logFile, e);
            }
        }
    }

    private void prepareOutputs(Plan plan) {
        for (CommandOutput output : plan.outputs()) {
            Path target = workDir.resolve(output.produces()).normalize();
            try {
                if (output.createFolder()) {
                    Files.createDirectories(target);
                } else if (target.getParent() != null) {
                    Files.createDirectories(target.getParent());
                }
            } catch (IOException e) {
                throw new StepExecutionException(plan.name(), "cannot prepare output " + output.produces(), e);
            }
        }
    }

    private static String truncate(String raw) {
        if (raw == null) {
            return "";
        }
        String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= MAX_LOG_CHARS) {
            return normalized;
        }
        return normalized.substring(0, MAX_LOG_CHARS) + "...";
    }
}
