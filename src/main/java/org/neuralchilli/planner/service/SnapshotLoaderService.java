package org.neuralchilli.planner.service;

import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.neuralchilli.planner.config.BlockSnapshotParser;
import org.neuralchilli.planner.config.PlannerConfig;
import org.neuralchilli.planner.config.SnapshotFormatException;
import org.neuralchilli.planner.core.EvaluationCache;
import org.neuralchilli.planner.domain.Block;
import org.neuralchilli.planner.monitoring.EvaluationMonitor;
import org.neuralchilli.planner.store.InMemoryBlockStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Loads YAML block snapshots into the in-memory block store.
 * Handles the initial load on startup and provides reload capability.
 */
@ApplicationScoped
public class SnapshotLoaderService {

    private static final Logger log = LoggerFactory.getLogger(SnapshotLoaderService.class);

    @Inject
    BlockSnapshotParser parser;

    @Inject
    InMemoryBlockStore blockStore;

    @Inject
    EvaluationCache cache;

    @Inject
    EvaluationMonitor monitor;

    @Inject
    PlannerConfig config;

    /**
     * Load the configured snapshot on startup
     */
    void onStart(@Observes StartupEvent event) {
        Optional<Path> path = snapshotPath();
        if (path.isEmpty()) {
            log.info("No block snapshot configured, starting with an empty store");
            return;
        }

        log.info("Loading block snapshot from: {}", path.get());
        LoadResult result = loadSnapshot(path.get());
        if (result.isSuccess()) {
            log.info("Snapshot loaded: {} blocks", result.blockCount());
        }
    }

    void onStop(@Observes ShutdownEvent event) {
        monitor.logReport();
    }

    /**
     * The configured snapshot file, if any
     */
    public Optional<Path> snapshotPath() {
        return config.snapshot().path()
                .filter(p -> !p.isBlank())
                .map(Path::of);
    }

    /**
     * Replace the store content with the snapshot at the given path.
     * A missing file leaves the store untouched.
     */
    public LoadResult loadSnapshot(Path path) {
        String source = path.toString();
        if (!Files.exists(path)) {
            log.warn("Block snapshot does not exist: {}", path);
            return LoadResult.failure(source, "File not found");
        }

        try {
            List<Block> blocks = parser.parse(Files.readString(path));
            return replaceStore(source, blocks);
        } catch (IOException e) {
            log.error("✗ Failed to read block snapshot: {}", path, e);
            return LoadResult.failure(source, e);
        } catch (SnapshotFormatException e) {
            log.error("✗ Invalid block snapshot {}: {}", path, e.getMessage());
            return LoadResult.failure(source, e);
        }
    }

    /**
     * Replace the store content with a snapshot given as YAML text
     */
    public LoadResult loadSnapshot(String source, String yamlContent) {
        try {
            return replaceStore(source, parser.parse(yamlContent));
        } catch (SnapshotFormatException e) {
            log.error("✗ Invalid block snapshot {}: {}", source, e.getMessage());
            return LoadResult.failure(source, e);
        }
    }

    /**
     * Reload a snapshot (for hot reload)
     */
    public LoadResult reloadSnapshot(Path path) {
        log.info("Reloading block snapshot: {}", path);
        return loadSnapshot(path);
    }

    private LoadResult replaceStore(String source, List<Block> blocks) {
        blockStore.replaceAll(blocks);
        cache.invalidate();
        log.info("✓ Loaded {} blocks from {}", blocks.size(), source);
        return LoadResult.success(source, blocks.size());
    }
}
