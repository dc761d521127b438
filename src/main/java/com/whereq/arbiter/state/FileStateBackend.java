package com.whereq.arbiter.state;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.arbiter.config.ArbiterProperties;
import com.whereq.arbiter.exception.StatePersistenceException;
import com.whereq.arbiter.model.BanditState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;

/**
 * Stores the state document as a JSON file on local disk.
 * Writes go to a sibling temp file first and are then moved over the target.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "arbiter.state.backend", havingValue = "file")
public class FileStateBackend implements StateBackend {

    private final Path path;
    private final ObjectMapper objectMapper;

    public FileStateBackend(ArbiterProperties properties, ObjectMapper objectMapper) {
        this(Paths.get(properties.getState().getFilePath()), objectMapper);
    }

    public FileStateBackend(Path path, ObjectMapper objectMapper) {
        this.path = path;
        this.objectMapper = objectMapper;
        log.info("Bandit state file: {}", path.toAbsolutePath());
    }

    @Override
    public Mono<BanditState> load() {
        return Mono.fromCallable(() -> {
            if (!Files.exists(path)) {
                log.info("No bandit state at {}, starting empty", path);
                return BanditState.empty();
            }
            try {
                BanditState state = objectMapper.readValue(path.toFile(), BanditState.class);
                return state != null ? state : BanditState.empty();
            } catch (IOException e) {
                throw new StatePersistenceException("Failed to read bandit state from " + path, e);
            }
        })
        .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<Void> save(BanditState state) {
        return Mono.fromRunnable(() -> {
            try {
                Path parent = path.toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
                objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), state);
                move(tmp);
                log.debug("Wrote bandit state to {} ({} arms)", path, state.getArms().size());
            } catch (IOException e) {
                throw new StatePersistenceException("Failed to write bandit state to " + path, e);
            }
        })
        .subscribeOn(Schedulers.boundedElastic())
        .then();
    }

    private void move(Path tmp) throws IOException {
        try {
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    @Override
    public String name() {
        return "file";
    }

    public Path getPath() {
        return path;
    }
}
