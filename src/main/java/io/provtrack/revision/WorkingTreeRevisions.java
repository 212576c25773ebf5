package io.provtrack.revision;

import io.provtrack.ProvTrackException;
import io.provtrack.config.ProvTrackConfig;
import io.provtrack.util.Hashing;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Checksums of the files currently on disk; the revision is ignored. Files
 * hash like git blobs and directories like git trees, so a committed and
 * unchanged path gets the same checksum here as from {@link GitRevisions}.
 * Empty subdirectories, {@code .git} and the provtrack metadata directory
 * are left out of tree hashes, as git would not track them.
 */
public final class WorkingTreeRevisions implements Revisions {
    private static final String EMPTY_TREE = Hashing.gitObjectSha1Hex("tree", new byte[0]);

    private final Path rootDir;

    public WorkingTreeRevisions(Path rootDir) {
        if (rootDir == null) {
            throw new IllegalArgumentException("root directory cannot be null");
        }
        this.rootDir = rootDir.toAbsolutePath().normalize();
    }

    @Override
    public Optional<String> checksumAt(String path, String revision) {
        if (path == null || path.isBlank()) {
            return Optional.empty();
        }
        Path file = rootDir.resolve(path).normalize();
        if (!file.startsWith(rootDir) || !Files.exists(file, LinkOption.NOFOLLOW_LINKS)) {
            return Optional.empty();
        }
        try {
            if (Files.isDirectory(file, LinkOption.NOFOLLOW_LINKS)) {
                return Optional.of(treeChecksum(file).orElse(EMPTY_TREE));
            }
            return Optional.of(blobChecksum(file));
        } catch (IOException e) {
            throw new ProvTrackException("Failed to checksum " + file, e);
        }
    }

    private static String blobChecksum(Path file) throws IOException {
        if (Files.isSymbolicLink(file)) {
            String target = Files.readSymbolicLink(file).toString();
            return Hashing.gitBlobSha1Hex(target.getBytes(StandardCharsets.UTF_8));
        }
        return Hashing.gitBlobSha1Hex(Files.readAllBytes(file));
    }

    private static Optional<String> treeChecksum(Path dir) throws IOException {
        List<TreeEntry> entries = new ArrayList<>();
        List<Path> children;
        try (Stream<Path> stream = Files.list(dir)) {
            children = stream.toList();
        }
        for (Path child : children) {
            String name = child.getFileName().toString();
            if (Files.isSymbolicLink(child)) {
                entries.add(new TreeEntry("120000", name, blobChecksum(child)));
            } else if (Files.isDirectory(child)) {
                if (name.equals(".git") || name.equals(ProvTrackConfig.METADATA_DIR)) {
                    continue;
                }
                Optional<String> sub = treeChecksum(child);
                sub.ifPresent(id -> entries.add(new TreeEntry("40000", name, id)));
            } else {
                String mode = Files.isExecutable(child) ? "100755" : "100644";
                entries.add(new TreeEntry(mode, name, blobChecksum(child)));
            }
        }
        if (entries.isEmpty()) {
            return Optional.empty();
        }
        entries.sort(Comparator.comparing(TreeEntry::sortKey));

        ByteArrayOutputStream content = new ByteArrayOutputStream();
        for (TreeEntry entry : entries) {
            content.writeBytes((entry.mode() + " " + entry.name()).getBytes(StandardCharsets.UTF_8));
            content.write(0);
            content.writeBytes(HexFormat.of().parseHex(entry.id()));
        }
        return Optional.of(Hashing.gitObjectSha1Hex("tree", content.toByteArray()));
    }

    // git orders a subtree as if its name ended with '/'.
    private record TreeEntry(String mode, String name, String id) {
        String sortKey() {
            return mode.equals("40000") ? name + "/" : name;
        }
    }
}
