package com.ryuqq.cutover.adapter.filesystem;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.cutover.core.model.CorrelationId;
import com.ryuqq.cutover.core.model.ExpectedVersion;
import com.ryuqq.cutover.core.model.KeyPrefix;
import com.ryuqq.cutover.core.model.Payload;
import com.ryuqq.cutover.core.model.RecordKey;
import com.ryuqq.cutover.core.model.StoredRecord;
import com.ryuqq.cutover.core.model.VersionToken;
import com.ryuqq.cutover.core.spi.CorrelationScope;
import com.ryuqq.cutover.core.spi.StoreAdapter;
import com.ryuqq.cutover.core.spi.StoreUnavailableException;
import com.ryuqq.cutover.core.spi.TransientStoreException;
import com.ryuqq.cutover.core.spi.VersionConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * File-backed implementation of {@link StoreAdapter} SPI.
 *
 * <p>Each record is one JSON envelope file. The layout mirrors a partition/row store:</p>
 * <pre>
 * {root}/{table}/{encoded partitionKey}/{encoded rowKey}.json
 *
 * {
 *   "version": "3f6c...",
 *   "updatedAt": "2025-08-08T10:15:30.123Z",
 *   "payload": "{...serialized document...}"
 * }
 * </pre>
 *
 * <p><strong>Write Protocol:</strong></p>
 * <ol>
 *   <li>Acquire the per-key lock</li>
 *   <li>Read the current envelope and check the {@link ExpectedVersion}</li>
 *   <li>Write the new envelope to a temp file in the same directory</li>
 *   <li>Rename it over the record file ({@link StandardCopyOption#ATOMIC_MOVE})</li>
 * </ol>
 *
 * <p>A crash between steps 3 and 4 leaves only a stray temp file, never a torn record.
 * Locks are per JVM: two processes writing the same root are not supported.</p>
 *
 * <p>I/O failures surface as {@link TransientStoreException}; a record file that is not
 * a valid envelope surfaces as {@link StoreUnavailableException} since repeating the
 * read cannot fix it.</p>
 *
 * <p>Used for the legacy blob store, the local emulator of the primary store, and
 * command line runs against directories.</p>
 *
 * @author Cutover Team
 * @since 1.0.0
 */
public class FileSystemStoreAdapter implements StoreAdapter {

    private static final Logger log = LoggerFactory.getLogger(FileSystemStoreAdapter.class);

    private static final String RECORD_SUFFIX = ".json";
    private static final String TEMP_SUFFIX = ".tmp";

    private final String name;
    private final Path root;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final ConcurrentHashMap<RecordKey, ReentrantLock> locks = new ConcurrentHashMap<>();

    public FileSystemStoreAdapter(String name, Path root) {
        this(name, root, new ObjectMapper(), Clock.systemUTC());
    }

    /**
     * Creates an adapter with an explicit mapper and clock.
     *
     * @param name backend name used in logs
     * @param root store root directory (created when missing)
     * @param objectMapper mapper for envelope files
     * @param clock source of updated-at timestamps
     * @throws IllegalArgumentException if any argument is null or name is blank
     */
    public FileSystemStoreAdapter(String name, Path root, ObjectMapper objectMapper, Clock clock) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (root == null) {
            throw new IllegalArgumentException("root cannot be null");
        }
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.name = name;
        this.root = root;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public Optional<StoredRecord> get(RecordKey key, CorrelationId correlationId) {
        requireArgs(key, correlationId);
        return read(key, pathOf(key));
    }

    @Override
    public VersionToken put(RecordKey key, Payload payload, ExpectedVersion expected, CorrelationId correlationId) {
        requireArgs(key, correlationId);
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        if (expected == null) {
            throw new IllegalArgumentException("expected cannot be null");
        }

        Path target = pathOf(key);
        ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
        lock.lock();
        try {
            Optional<StoredRecord> current = read(key, target);
            VersionToken currentToken = current.map(StoredRecord::version).orElse(null);
            if (!expected.isSatisfiedBy(currentToken)) {
                throw new VersionConflictException(name, key, expected);
            }

            Instant updatedAt = clock.instant();
            if (current.isPresent() && !updatedAt.isAfter(current.get().updatedAt())) {
                updatedAt = current.get().updatedAt().plusMillis(1);
            }
            VersionToken token = VersionToken.of(UUID.randomUUID().toString());
            writeAtomically(target, envelope(token, updatedAt, payload));

            try (CorrelationScope ignored = CorrelationScope.open(correlationId)) {
                log.debug("Put {}: backend={}, version={}", key, name, token.getValue());
            }
            return token;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Stream<StoredRecord> query(KeyPrefix prefix, CorrelationId correlationId) {
        if (prefix == null) {
            throw new IllegalArgumentException("prefix cannot be null");
        }
        if (correlationId == null) {
            throw new IllegalArgumentException("correlationId cannot be null");
        }

        Path tableDir = root.resolve(prefix.table().tableName());
        if (!Files.isDirectory(tableDir)) {
            return Stream.empty();
        }

        List<RecordKey> keys = new ArrayList<>();
        for (String partition : listNames(tableDir, true)) {
            if (!partition.startsWith(prefix.partitionPrefix())) {
                continue;
            }
            Path partitionDir = tableDir.resolve(KeyCodec.encode(partition));
            for (String row : listNames(partitionDir, false)) {
                keys.add(new RecordKey(prefix.table(), partition, row));
            }
        }
        keys.sort(Comparator.naturalOrder());

        return keys.stream()
            .map(key -> read(key, pathOf(key)))
            .flatMap(Optional::stream);
    }

    @Override
    public String name() {
        return name;
    }

    public Path getRoot() {
        return root;
    }

    Path pathOf(RecordKey key) {
        return root
            .resolve(key.table().tableName())
            .resolve(KeyCodec.encode(key.partitionKey()))
            .resolve(KeyCodec.encode(key.rowKey()) + RECORD_SUFFIX);
    }

    private Optional<StoredRecord> read(RecordKey key, Path path) {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(path);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new TransientStoreException(name, "Failed to read " + key + ": " + e.getMessage(), e);
        }

        try {
            JsonNode envelope = objectMapper.readTree(bytes);
            String version = envelope.path("version").asText(null);
            String updatedAt = envelope.path("updatedAt").asText(null);
            JsonNode payload = envelope.get("payload");
            if (version == null || updatedAt == null || payload == null || !payload.isTextual()) {
                throw new StoreUnavailableException(name, "Corrupt envelope for " + key + " at " + path);
            }
            return Optional.of(new StoredRecord(
                key,
                Payload.of(payload.asText()),
                VersionToken.of(version),
                Instant.parse(updatedAt)
            ));
        } catch (JsonProcessingException | DateTimeParseException e) {
            throw new StoreUnavailableException(name, "Corrupt envelope for " + key + " at " + path, e);
        } catch (IOException e) {
            throw new TransientStoreException(name, "Failed to parse " + key + ": " + e.getMessage(), e);
        }
    }

    private byte[] envelope(VersionToken token, Instant updatedAt, Payload payload) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("version", token.getValue());
        node.put("updatedAt", updatedAt.toString());
        node.put("payload", payload.getValue());
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Envelope serialization failed", e);
        }
    }

    private void writeAtomically(Path target, byte[] content) {
        Path dir = target.getParent();
        Path temp = dir.resolve("." + target.getFileName() + "." + UUID.randomUUID() + TEMP_SUFFIX);
        try {
            Files.createDirectories(dir);
            Files.write(temp, content);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new TransientStoreException(name, "Failed to write " + target + ": " + e.getMessage(), e);
        }
    }

    private void deleteQuietly(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Failed to remove temp file {}: {}", temp, e.getMessage());
        }
    }

    /**
     * Decoded names of the entries in a directory, sorted.
     *
     * @param dir directory to list
     * @param directories true to list partition directories, false to list record files
     */
    private List<String> listNames(Path dir, boolean directories) {
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> entries = Files.list(dir)) {
            return entries
                .filter(p -> directories ? Files.isDirectory(p) : Files.isRegularFile(p))
                .map(p -> p.getFileName().toString())
                .filter(n -> !n.startsWith("."))
                .filter(n -> directories || n.endsWith(RECORD_SUFFIX))
                .map(n -> directories ? n : n.substring(0, n.length() - RECORD_SUFFIX.length()))
                .map(KeyCodec::decode)
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException | UncheckedIOException e) {
            throw new TransientStoreException(name, "Failed to list " + dir + ": " + e.getMessage(), e);
        }
    }

    private void requireArgs(RecordKey key, CorrelationId correlationId) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (correlationId == null) {
            throw new IllegalArgumentException("correlationId cannot be null");
        }
    }
}
