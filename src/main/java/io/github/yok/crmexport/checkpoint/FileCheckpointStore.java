package io.github.yok.crmexport.checkpoint;

import io.github.yok.crmexport.checkpoint.CheckpointCodec.CorruptCheckpointException;
import io.github.yok.crmexport.config.PathsConfig;
import io.github.yok.crmexport.model.Phase;
import io.github.yok.crmexport.model.ResourceType;
import java.io.File;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Collection;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * {@link CheckpointStore} backed by small text files under {@code {data-path}/state}.
 *
 * <ul>
 * <li>{@code {stem}_checkpoint.txt}: resume position in {@link CheckpointCodec} format</li>
 * <li>{@code {stem}_completed.txt}: completion marker holding a human-readable timestamp</li>
 * </ul>
 *
 * <p>
 * Writes go to a temporary sibling file which is forced to disk and then moved over the target,
 * so a crash leaves either the previous or the new checkpoint but never a torn one.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
public class FileCheckpointStore implements CheckpointStore {

    static final String CHECKPOINT_SUFFIX = "_checkpoint.txt";

    static final String COMPLETED_SUFFIX = "_completed.txt";

    private static final DateTimeFormatter MARKER_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Path stateDir;

    /**
     * Creates a store rooted at the configured state directory.
     *
     * @param pathsConfig path settings
     */
    @Autowired
    public FileCheckpointStore(PathsConfig pathsConfig) {
        this(Paths.get(pathsConfig.getState()));
    }

    /**
     * Creates a store rooted at an explicit directory.
     *
     * @param stateDir directory holding the state files; created on first write
     */
    public FileCheckpointStore(Path stateDir) {
        this.stateDir = stateDir;
    }

    @Override
    public Optional<String> load(CheckpointKey key) {
        Path file = checkpointFile(key);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            String content = Files.readString(file, StandardCharsets.UTF_8);
            String value = CheckpointCodec.decode(key, content);
            log.info("[{}] Loaded checkpoint: {}", key, value);
            return Optional.of(value);
        } catch (CorruptCheckpointException e) {
            log.warn("[{}] Ignoring corrupt checkpoint {}: {}", key, file, e.getMessage());
            return Optional.empty();
        } catch (IOException e) {
            log.warn("[{}] Ignoring unreadable checkpoint {}: {}", key, file, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void save(CheckpointKey key, String position) {
        Path file = checkpointFile(key);
        writeDurably(file, CheckpointCodec.encode(key, position));
        log.debug("[{}] Saved checkpoint: {}", key, position);
    }

    @Override
    public void clear(CheckpointKey key) {
        delete(checkpointFile(key));
    }

    @Override
    public boolean isPhaseComplete(CheckpointKey key) {
        return Files.exists(completedFile(key));
    }

    @Override
    public void markComplete(CheckpointKey key) {
        Path file = completedFile(key);
        writeDurably(file, "Completed on " + LocalDateTime.now().format(MARKER_FORMAT) + "\n");
        log.info("[{}] Marked as complete", key);
    }

    @Override
    public void reset(Collection<ResourceType> types) {
        for (ResourceType type : types) {
            for (Phase phase : Phase.values()) {
                CheckpointKey key = CheckpointKey.of(type, phase);
                delete(checkpointFile(key));
                delete(completedFile(key));
            }
        }
    }

    Path checkpointFile(CheckpointKey key) {
        return stateDir.resolve(key.fileStem() + CHECKPOINT_SUFFIX);
    }

    Path completedFile(CheckpointKey key) {
        return stateDir.resolve(key.fileStem() + COMPLETED_SUFFIX);
    }

    private void writeDurably(Path target, String content) {
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            FileUtils.forceMkdir(stateDir.toFile());
            try (FileChannel channel = FileChannel.open(tmp, StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
                ByteBuffer buf = ByteBuffer.wrap(content.getBytes(StandardCharsets.UTF_8));
                while (buf.hasRemaining()) {
                    channel.write(buf);
                }
                channel.force(true);
            }
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE,
                        StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported for {}, falling back to replace", target);
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            FileUtils.deleteQuietly(tmp.toFile());
            throw new CheckpointException("Failed to write " + target, e);
        }
    }

    private void delete(Path path) {
        File file = path.toFile();
        if (file.exists()) {
            if (FileUtils.deleteQuietly(file)) {
                log.info("Removed {}", file.getName());
            } else {
                log.warn("Could not remove {}", file);
            }
        }
    }
}
