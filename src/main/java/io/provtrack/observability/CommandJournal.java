package io.provtrack.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.provtrack.util.Hashing;
import io.provtrack.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSONL record of the commands that changed the repository. Each
 * line carries the hash of the previous one, so an edited or dropped line
 * breaks the chain.
 */
public final class CommandJournal {
    private final Path journalFile;
    private String previousHash;

    public CommandJournal(Path journalFile) {
        this.journalFile = journalFile;
        try {
            Files.createDirectories(journalFile.getParent());
            if (!Files.exists(journalFile)) {
                try {
                    Files.createFile(journalFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Created concurrently between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize journal file: " + journalFile, e);
        }
        this.previousHash = loadLastHash();
    }

    public synchronized void record(String command, String result, Map<String, Object> details) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.now().toString());
        row.put("command", command);
        row.put("result", result);
        row.put("details", details == null ? Map.of() : details);
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(journalFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new RuntimeException("Failed to write journal", e);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    /** The last {@code lines} entries, oldest first. */
    public List<JsonNode> tail(int lines) {
        List<JsonNode> rows = readAll();
        int from = Math.max(0, rows.size() - Math.max(0, lines));
        return new ArrayList<>(rows.subList(from, rows.size()));
    }

    /**
     * Recomputes the chain and returns the 1-based line number of the first
     * broken entry, or {@code 0} when the journal is intact.
     */
    public int verify() {
        String expectedPrev = "";
        int lineNo = 0;
        for (JsonNode row : readAll()) {
            lineNo++;
            String hash = row.path("hash").asText("");
            if (!expectedPrev.equals(row.path("prev_hash").asText(""))) {
                return lineNo;
            }
            Map<String, Object> unhashed = Jsons.mapper().convertValue(row, Jsons.MAP_TYPE);
            unhashed.remove("hash");
            if (!hash.equals(Hashing.sha256Hex(Jsons.toCompactJson(unhashed)))) {
                return lineNo;
            }
            expectedPrev = hash;
        }
        return 0;
    }

    private List<JsonNode> readAll() {
        List<JsonNode> rows = new ArrayList<>();
        try {
            for (String line : Files.readAllLines(journalFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    rows.add(Jsons.mapper().readTree(line));
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to read journal: " + journalFile, e);
        }
        return rows;
    }

    private String loadLastHash() {
        List<JsonNode> rows = readAll();
        if (rows.isEmpty()) {
            return "";
        }
        return rows.get(rows.size() - 1).path("hash").asText("");
    }
}
