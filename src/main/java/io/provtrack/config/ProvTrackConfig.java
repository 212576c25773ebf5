package io.provtrack.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class ProvTrackConfig {
    public static final String METADATA_DIR = ".provtrack";
    public static final String DEFAULT_REVISION = "HEAD";
    public static final long DEFAULT_STEP_TIMEOUT_MS = 600_000L;

    private final Path rootDir;
    private final String revision;
    private final long stepTimeoutMs;

    public ProvTrackConfig(Path rootDir, String revision, long stepTimeoutMs) {
        this.rootDir = rootDir;
        this.revision = revision;
        this.stepTimeoutMs = stepTimeoutMs;
    }

    public static ProvTrackConfig fromRoot(String root) {
        return fromRoot(root, DEFAULT_REVISION);
    }

    public static ProvTrackConfig fromRoot(String root, String revision) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(".")
                : Paths.get(root);
        String safeRevision = revision == null || revision.isBlank() ? DEFAULT_REVISION : revision.trim();
        return new ProvTrackConfig(resolved.toAbsolutePath().normalize(), safeRevision, DEFAULT_STEP_TIMEOUT_MS);
    }

    public ProvTrackConfig withStepTimeoutMs(long timeoutMs) {
        return new ProvTrackConfig(rootDir, revision, Math.max(1_000L, timeoutMs));
    }

    public Path rootDir() {
        return rootDir;
    }

    public String revision() {
        return revision;
    }

    public long stepTimeoutMs() {
        return stepTimeoutMs;
    }

    public Path metadataDir() {
        return rootDir.resolve(METADATA_DIR);
    }

    public Path objectsDir() {
        return metadataDir().resolve("objects");
    }

    public Path journalFile() {
        return metadataDir().resolve("journal.jsonl");
    }

    public Path lockFile() {
        return metadataDir().resolve("lock");
    }
}
