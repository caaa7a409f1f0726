package com.ryuqq.cutover.migration.checkpoint;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.cutover.application.document.Documents;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

/**
 * JSON 파일 기반 {@link CheckpointStore}.
 *
 * <p><strong>쓰기 프로토콜:</strong></p>
 * <ol>
 *   <li>lock 획득 (JVM 내 단일 writer)</li>
 *   <li>같은 디렉터리의 임시 파일에 전체 내용 쓰기</li>
 *   <li>대상 파일로 rename ({@link StandardCopyOption#ATOMIC_MOVE})</li>
 * </ol>
 *
 * @author Cutover Team
 * @since 1.0.0
 */
public final class FileCheckpointStore implements CheckpointStore {

    private static final Logger log = LoggerFactory.getLogger(FileCheckpointStore.class);

    private final Path path;
    private final ObjectMapper objectMapper;
    private final ReentrantLock lock = new ReentrantLock();

    public FileCheckpointStore(Path path) {
        this(path, Documents.objectMapper());
    }

    public FileCheckpointStore(Path path, ObjectMapper objectMapper) {
        if (path == null) {
            throw new IllegalArgumentException("path cannot be null");
        }
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        this.path = path.toAbsolutePath();
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<Checkpoint> load() {
        lock.lock();
        try {
            return read();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void save(Checkpoint checkpoint) {
        if (checkpoint == null) {
            throw new IllegalArgumentException("checkpoint cannot be null");
        }
        lock.lock();
        try {
            write(checkpoint);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Checkpoint update(Checkpoint initial, UnaryOperator<Checkpoint> change) {
        if (initial == null) {
            throw new IllegalArgumentException("initial cannot be null");
        }
        if (change == null) {
            throw new IllegalArgumentException("change cannot be null");
        }
        lock.lock();
        try {
            Checkpoint next = change.apply(read().orElse(initial));
            write(next);
            return next;
        } finally {
            lock.unlock();
        }
    }

    public Path getPath() {
        return path;
    }

    private Optional<Checkpoint> read() {
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(Files.readAllBytes(path), Checkpoint.class));
        } catch (IOException e) {
            throw new CheckpointException("Failed to read checkpoint " + path, e);
        }
    }

    private void write(Checkpoint checkpoint) {
        Path dir = path.getParent();
        Path temp = dir.resolve("." + path.getFileName() + "." + UUID.randomUUID() + ".tmp");
        try {
            byte[] content = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(checkpoint);
            Files.createDirectories(dir);
            Files.write(temp, content);
            try {
                Files.move(temp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Checkpoint saved: completed={}, registryCopied={}",
                checkpoint.completedOrganizations().size(), checkpoint.registryCopied());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Checkpoint serialization failed", e);
        } catch (IOException e) {
            deleteTemp(temp);
            throw new CheckpointException("Failed to write checkpoint " + path, e);
        }
    }

    private static void deleteTemp(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Failed to delete temp checkpoint {}: {}", temp, e.getMessage());
        }
    }
}
