package io.procwarden.observability;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.procwarden.os.ProcessTables;
import io.procwarden.registry.LockSettings;
import io.procwarden.registry.SentinelLock;
import io.procwarden.security.SensitiveDataMasker;
import io.procwarden.util.Hashing;
import io.procwarden.util.Jsons;
import io.procwarden.util.Ticker;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.io.UncheckedIOException;
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

public final class AuditLogger {
    private static final int TAIL_WINDOW_BYTES = 8 * 1024;

    private final Path auditFile;
    private final String namespace;
    private final String signingSecret;
    private final SentinelLock lock;

    public AuditLogger(Path auditFile, String namespace, String signingSecret) {
        this(auditFile, namespace, signingSecret, new SentinelLock(
                SentinelLock.lockPathFor(auditFile),
                LockSettings.defaults(),
                ProcessTables.forCurrentPlatform(),
                Ticker.SYSTEM
        ));
    }

    public AuditLogger(Path auditFile, String namespace, String signingSecret, SentinelLock lock) {
        this.auditFile = auditFile;
        this.lock = lock;
        this.namespace = namespace == null || namespace.isBlank() ? "default" : namespace.trim();
        this.signingSecret = signingSecret == null ? "" : signingSecret.trim();
        try {
            Files.createDirectories(auditFile.getParent());
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Another procwarden created it between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to initialize audit log file: " + auditFile, e);
        }
    }

    public Path auditFile() {
        return auditFile;
    }

    public synchronized void log(AuditEvent event) {
        try {
            lock.withLock(() -> {
                append(event);
                return null;
            });
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write audit log", e);
        }
    }

    // Caller holds the lock; the chain head is whatever another writer appended last.
    private void append(AuditEvent event) throws IOException {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.now().toString());
        row.put("namespace", namespace);
        row.put("action", event.action());
        row.put("actor", event.actor());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("details", sanitizeDetails(event.details()));
        row.put("prev_hash", readLastHash());
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        if (!signingSecret.isBlank()) {
            row.put("signature", Hashing.hmacSha256Hex(signingSecret, rowHash));
        }
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
    }

    public synchronized String currentHash() {
        try {
            return readLastHash();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read audit log tail: " + auditFile, e);
        }
    }

    public synchronized List<String> tail(int lines) {
        if (!Files.exists(auditFile)) {
            return List.of();
        }
        try {
            List<String> all = new ArrayList<>();
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (!line.isBlank()) {
                    all.add(line);
                }
            }
            int from = Math.max(0, all.size() - Math.max(1, lines));
            return List.copyOf(all.subList(from, all.size()));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read audit log", e);
        }
    }

    public synchronized AuditIntegrityOutcome verifyIntegrity() {
        if (!Files.exists(auditFile)) {
            return new AuditIntegrityOutcome(true, 0, 0, "", "");
        }
        int checkedRows = 0;
        int brokenLine = 0;
        String reason = "";
        String expectedPrev = "";
        List<String> lines;
        try {
            lines = Files.readAllLines(auditFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to verify audit integrity", e);
        }
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank()) {
                continue;
            }
            JsonNode parsed;
            try {
                parsed = Jsons.mapper().readTree(line);
            } catch (IOException e) {
                brokenLine = i + 1;
                reason = "invalid_json";
                break;
            }
            String hash = parsed.path("hash").asText("");
            String prevHash = parsed.path("prev_hash").asText("");
            if (!prevHash.equals(expectedPrev)) {
                brokenLine = i + 1;
                reason = "prev_hash_mismatch";
                break;
            }
            ObjectNode canonical = parsed.deepCopy();
            canonical.remove("hash");
            canonical.remove("signature");
            if (!Hashing.sha256Hex(Jsons.toCompactJson(canonical)).equals(hash)) {
                brokenLine = i + 1;
                reason = "hash_mismatch";
                break;
            }
            String signature = parsed.path("signature").asText("");
            if (!signingSecret.isBlank() && !Hashing.hmacSha256Hex(signingSecret, hash).equals(signature)) {
                brokenLine = i + 1;
                reason = "signature_mismatch";
                break;
            }
            checkedRows++;
            expectedPrev = hash;
        }
        return new AuditIntegrityOutcome(brokenLine == 0, checkedRows, brokenLine, reason, expectedPrev);
    }

    private String readLastHash() throws IOException {
        if (!Files.exists(auditFile)) {
            return "";
        }
        String last = lastLine();
        if (last.isEmpty()) {
            return "";
        }
        return Jsons.mapper().readTree(last).path("hash").asText("");
    }

    // Reads backwards in growing windows until a whole final line is in view.
    private String lastLine() throws IOException {
        try (RandomAccessFile file = new RandomAccessFile(auditFile.toFile(), "r")) {
            long length = file.length();
            long window = TAIL_WINDOW_BYTES;
            while (true) {
                long from = Math.max(0L, length - window);
                byte[] buffer = new byte[(int) (length - from)];
                file.seek(from);
                file.readFully(buffer);
                String chunk = new String(buffer, StandardCharsets.UTF_8).strip();
                int newline = chunk.lastIndexOf('\n');
                if (newline >= 0) {
                    return chunk.substring(newline + 1).strip();
                }
                if (from == 0L) {
                    return chunk;
                }
                window *= 2L;
            }
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> sanitizeDetails(Map<String, Object> input) {
        if (input == null || input.isEmpty()) {
            return Map.of();
        }
        JsonNode node = Jsons.mapper().valueToTree(input);
        JsonNode masked = SensitiveDataMasker.masked(node);
        return Jsons.mapper().convertValue(masked, LinkedHashMap.class);
    }

    public record AuditEvent(
            String action,
            String actor,
            String resource,
            String result,
            Map<String, Object> details
    ) {
        public static AuditEvent of(String action, String actor, String resource, String result, Map<String, Object> details) {
            return new AuditEvent(action, actor, resource, result, details == null ? Map.of() : details);
        }

        public static AuditEvent forPid(String action, String actor, long pid, String result, Map<String, Object> details) {
            return of(action, actor, "pid/" + pid, result, details);
        }
    }

    public record AuditIntegrityOutcome(
            boolean ok,
            int checkedRows,
            int brokenLine,
            String reason,
            String tailHash
    ) {
    }
}
