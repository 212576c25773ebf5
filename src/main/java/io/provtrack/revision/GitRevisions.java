package io.provtrack.revision;

import io.provtrack.ProvTrackException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/** Object ids from git, via {@code git rev-parse <revision>:<path>}. */
public final class GitRevisions implements Revisions {
    private static final Logger log = LoggerFactory.getLogger(GitRevisions.class);
    private static final long TIMEOUT_MS = 30_000L;

    private final Path repoDir;
    private final String gitExecutable;

    public GitRevisions(Path repoDir) {
        this(repoDir, "git");
    }

    public GitRevisions(Path repoDir, String gitExecutable) {
        if (repoDir == null) {
            throw new IllegalArgumentException("repository directory cannot be null");
        }
        this.repoDir = repoDir;
        this.gitExecutable = gitExecutable == null || gitExecutable.isBlank() ? "git" : gitExecutable;
    }

    @Override
    public Optional<String> checksumAt(String path, String revision) {
        if (path == null || path.isBlank()) {
            return Optional.empty();
        }
        String rev = revision == null || revision.isBlank() ? "HEAD" : revision.trim();
        ProcessBuilder pb = new ProcessBuilder(List.of(gitExecutable, "rev-parse", "--verify", "--quiet", rev + ":" + path));
        pb.directory(repoDir.toFile());
        pb.redirectErrorStream(true);
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new ProvTrackException("Failed to start git in " + repoDir, e);
        }
        try {
            process.getOutputStream().close();
            boolean finished = process.waitFor(TIMEOUT_MS, TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                throw new ProvTrackException("git rev-parse timed out for " + rev + ":" + path);
            }
            String out = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8).strip();
            if (process.exitValue() != 0 || out.isEmpty()) {
                log.debug("No object for {}:{} (exit={})", rev, path, process.exitValue());
                return Optional.empty();
            }
            return Optional.of(out);
        } catch (IOException e) {
            process.destroyForcibly();
            throw new ProvTrackException("Failed to read git output for " + path, e);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new ProvTrackException("Interrupted while running git", e);
        }
    }
}
