package io.chainrelay.observability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.chainrelay.security.SensitiveDataMasker;
import io.chainrelay.util.Hashing;
import io.chainrelay.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Append-only NDJSON audit trail. Every row carries the hash of the previous row, so an
 * edited, dropped or reordered line breaks the chain at that point.
 *
 * <p>Appends never throw. A write that still fails after {@value #MAX_ATTEMPTS} attempts
 * is reported through the application log and dropped.
 */
public final class AuditLog {
    private static final Logger log = LoggerFactory.getLogger(AuditLog.class);
    private static final int MAX_ATTEMPTS = 3;
    private static final long RETRY_DELAY_MS = 25L;
    // Exact decimals keep the hash stable across a write and a later re-read.
    private static final ObjectMapper ROW_MAPPER = new ObjectMapper()
            .findAndRegisterModules()
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
            .setNodeFactory(JsonNodeFactory.withExactBigDecimals(true));
    // FileChannel locks are per JVM, so threads sharing a file also serialize here.
    private static final ConcurrentHashMap<Path, Object> IN_PROCESS_LOCKS = new ConcurrentHashMap<>();

    private final Path auditFile;
    private final String namespace;
    private final String signingSecret;
    private final Clock clock;
    private final Object fileMonitor;
    private String previousHash;
    private long knownSize;

    public AuditLog(Path auditFile, String namespace, String signingSecret, Clock clock) {
        this.auditFile = auditFile.toAbsolutePath().normalize();
        this.namespace = namespace == null || namespace.isBlank() ? "default" : namespace.trim();
        this.signingSecret = signingSecret == null ? "" : signingSecret.trim();
        this.clock = clock;
        this.fileMonitor = IN_PROCESS_LOCKS.computeIfAbsent(this.auditFile, ignored -> new Object());
        this.previousHash = "";
        this.knownSize = -1L;
        try {
            Files.createDirectories(this.auditFile.getParent());
            if (!Files.exists(this.auditFile)) {
                try {
                    Files.createFile(this.auditFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Another process created it between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
    }

    public Path file() {
        return auditFile;
    }

    public void append(AuditEvent event) {
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            try {
                write(event);
                return;
            } catch (IOException | RuntimeException e) {
                if (attempt == MAX_ATTEMPTS) {
                    log.error("Dropped audit event {} for run {} after {} attempts",
                            event.event(), event.runId(), MAX_ATTEMPTS, e);
                    return;
                }
                log.warn("Audit append attempt {} failed for run {}: {}", attempt, event.runId(), e.toString());
                if (!pause()) {
                    log.error("Dropped audit event {} for run {}: interrupted", event.event(), event.runId());
                    return;
                }
            }
        }
    }

    /** Events of {@code runId} in the order they were appended. */
    public List<JsonNode> readRun(String runId) {
        List<JsonNode> out = new ArrayList<>();
        if (runId == null || runId.isBlank() || !Files.exists(auditFile)) {
            return out;
        }
        try {
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line == null || line.isBlank()) {
                    continue;
                }
                JsonNode row;
                try {
                    row = ROW_MAPPER.readTree(line);
                } catch (JsonProcessingException e) {
                    log.warn("Skipping unreadable audit line while reading run {}", runId);
                    continue;
                }
                if (runId.equals(row.path("runId").asText(""))) {
                    out.add(row);
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log", e);
        }
        return out;
    }

    public AuditIntegrityOutcome verify() {
        if (!Files.exists(auditFile)) {
            return new AuditIntegrityOutcome(true, 0, 0, 0, 0, "", "");
        }
        int totalRows = 0;
        int checkedRows = 0;
        int legacyRows = 0;
        int brokenLine = 0;
        String reason = "";
        String expectedPrev = "";
        try {
            List<String> lines = Files.readAllLines(auditFile, StandardCharsets.UTF_8);
            for (int i = 0; i < lines.size(); i++) {
                String line = lines.get(i);
                if (line == null || line.isBlank()) {
                    continue;
                }
                totalRows++;
                JsonNode parsed;
                try {
                    parsed = ROW_MAPPER.readTree(line);
                } catch (JsonProcessingException e) {
                    brokenLine = i + 1;
                    reason = "invalid_json";
                    break;
                }
                String hash = parsed.path("hash").asText("");
                if (hash.isBlank()) {
                    legacyRows++;
                    expectedPrev = "";
                    continue;
                }
                String prevHash = parsed.path("prev_hash").asText("");
                if (!prevHash.equals(expectedPrev)) {
                    brokenLine = i + 1;
                    reason = "prev_hash_mismatch";
                    break;
                }
                ObjectNode body = parsed.deepCopy();
                body.remove("hash");
                body.remove("signature");
                if (!Hashing.sha256Hex(ROW_MAPPER.writeValueAsString(body)).equals(hash)) {
                    brokenLine = i + 1;
                    reason = "hash_mismatch";
                    break;
                }
                String signature = parsed.path("signature").asText("");
                if (!signingSecret.isBlank()
                        && (signature.isBlank() || !Hashing.hmacSha256Hex(signingSecret, hash).equals(signature))) {
                    brokenLine = i + 1;
                    reason = "signature_mismatch";
                    break;
                }
                checkedRows++;
                expectedPrev = hash;
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to verify audit integrity", e);
        }
        return new AuditIntegrityOutcome(brokenLine == 0, totalRows, checkedRows, legacyRows, brokenLine, reason, expectedPrev);
    }

    private void write(AuditEvent event) throws IOException {
        synchronized (fileMonitor) {
            try (FileChannel channel = FileChannel.open(auditFile,
                    StandardOpenOption.CREATE, StandardOpenOption.READ, StandardOpenOption.WRITE);
                 FileLock ignored = channel.lock()) {
                long size = channel.size();
                if (size != knownSize) {
                    previousHash = tailHash(channel, size);
                }
                ObjectNode row = row(event);
                String rowHash = Hashing.sha256Hex(ROW_MAPPER.writeValueAsString(row));
                row.put("hash", rowHash);
                if (!signingSecret.isBlank()) {
                    row.put("signature", Hashing.hmacSha256Hex(signingSecret, rowHash));
                }
                byte[] line = (ROW_MAPPER.writeValueAsString(row) + "\n").getBytes(StandardCharsets.UTF_8);
                ByteBuffer buffer = ByteBuffer.wrap(line);
                long position = size;
                while (buffer.hasRemaining()) {
                    position += channel.write(buffer, position);
                }
                channel.force(false);
                previousHash = rowHash;
                knownSize = position;
            }
        }
    }

    private ObjectNode row(AuditEvent event) throws JsonProcessingException {
        JsonNode masked = SensitiveDataMasker.masked(Jsons.mapper().valueToTree(event.payload()));
        ObjectNode row = ROW_MAPPER.createObjectNode();
        row.put("timestamp", Instant.ofEpochMilli(clock.millis()).toString());
        row.put("namespace", namespace);
        row.put("runId", event.runId());
        row.put("plane", event.plane() == null ? null : event.plane().wireName());
        row.put("phase", event.phase() == null ? null : event.phase().wireName());
        row.put("event", event.event());
        row.put("state", event.state() == null ? null : event.state().name());
        row.set("payload", ROW_MAPPER.readTree(ROW_MAPPER.writeValueAsString(masked)));
        row.put("prev_hash", previousHash);
        return row;
    }

    private static String tailHash(FileChannel channel, long size) throws IOException {
        if (size == 0) {
            return "";
        }
        ByteBuffer buffer = ByteBuffer.allocate((int) Math.min(size, Integer.MAX_VALUE - 8));
        long start = size - buffer.capacity();
        while (buffer.hasRemaining()) {
            int read = channel.read(buffer, start + buffer.position());
            if (read < 0) {
                break;
            }
        }
        String content = new String(buffer.array(), 0, buffer.position(), StandardCharsets.UTF_8);
        String[] lines = content.split("\n");
        for (int i = lines.length - 1; i >= 0; i--) {
            if (!lines[i].isBlank()) {
                try {
                    return ROW_MAPPER.readTree(lines[i]).path("hash").asText("");
                } catch (JsonProcessingException e) {
                    log.warn("Audit tail row is unreadable; chaining from an empty hash");
                    return "";
                }
            }
        }
        return "";
    }

    private static boolean pause() {
        try {
            Thread.sleep(RETRY_DELAY_MS);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
