package com.framegate.infrastructure.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.framegate.domain.frame.exception.StateStoreException;
import com.framegate.domain.frame.model.RunState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Crash-safe persistence of run state and other run artifacts. Every write goes to a temp file
 * in the target directory and is then moved over the destination, so readers only ever see a
 * complete previous or complete new file.
 */
@Slf4j
@Component
public class RunStateStore {

    private static final String TEMP_SUFFIX = ".tmp";

    private final ObjectMapper objectMapper;

    public RunStateStore(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void save(RunWorkspace workspace, RunState state) {
        writeJson(workspace.statePath(), state);
        log.debug("[StateStore] Saved run {} ({} frames, status {})",
                state.getRunId(), state.totalFrames(), state.getStatus());
    }

    public Optional<RunState> load(RunWorkspace workspace) {
        Path path = workspace.statePath();
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        return Optional.of(read(path, RunState.class));
    }

    public void writeJson(Path target, Object value) {
        try {
            writeAtomically(target, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(value));
        } catch (IOException e) {
            throw new StateStoreException("Failed to serialize " + target.getFileName(), e);
        }
    }

    public <T> T read(Path path, Class<T> type) {
        try {
            return objectMapper.readValue(path.toFile(), type);
        } catch (IOException e) {
            throw new StateStoreException("Failed to read " + path, e);
        }
    }

    public byte[] readBytes(Path path) {
        try {
            return Files.readAllBytes(path);
        } catch (IOException e) {
            throw new StateStoreException("Failed to read " + path, e);
        }
    }

    public void writeAtomically(Path target, byte[] content) {
        Path temp = null;
        try {
            Path dir = target.toAbsolutePath().getParent();
            Files.createDirectories(dir);
            temp = Files.createTempFile(dir, target.getFileName().toString(), TEMP_SUFFIX);
            Files.write(temp, content);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("[StateStore] Atomic move not supported for {}, falling back to replace", target);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new StateStoreException("Failed to write " + target, e);
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("[StateStore] Could not remove temp file {}: {}", temp, e.getMessage());
        }
    }
}
