package io.provtrack.revision;

import java.util.Optional;

/** Content checksums of repository paths at a given revision. */
public interface Revisions {
    /**
     * Checksum of {@code path} at {@code revision}, or empty when the path
     * does not exist there.
     */
    Optional<String> checksumAt(String path, String revision);
}
