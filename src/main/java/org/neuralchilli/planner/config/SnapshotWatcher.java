package org.neuralchilli.planner.config;

import io.quarkus.arc.profile.IfBuildProfile;
import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.neuralchilli.planner.service.LoadResult;
import org.neuralchilli.planner.service.SnapshotLoaderService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.*;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static java.nio.file.StandardWatchEventKinds.*;

/**
 * Watches the block snapshot file and reloads it when it changes.
 * Only active in dev mode. Several events for the file within one poll
 * trigger a single reload.
 */
@ApplicationScoped
@IfBuildProfile("dev")
public class SnapshotWatcher {

    private static final Logger log = LoggerFactory.getLogger(SnapshotWatcher.class);

    @Inject
    SnapshotLoaderService snapshotLoader;

    @Inject
    PlannerConfig config;

    @ConfigProperty(name = "planner.snapshot.poll-millis", defaultValue = "1000")
    long pollMillis;

    private WatchService watchService;
    private ExecutorService executor;
    private Path snapshotFile;
    private volatile boolean running = false;

    /**
     * Start watching for file changes
     */
    void onStart(@Observes StartupEvent event) {
        if (!config.snapshot().watch()) {
            log.info("Snapshot watching is disabled");
            return;
        }

        Optional<Path> path = snapshotLoader.snapshotPath();
        if (path.isEmpty()) {
            log.info("No block snapshot configured, nothing to watch");
            return;
        }

        try {
            startWatching(path.get().toAbsolutePath());
        } catch (IOException e) {
            log.error("Failed to start snapshot watcher", e);
        }
    }

    /**
     * Stop watching on shutdown
     */
    void onStop(@Observes ShutdownEvent event) {
        stopWatching();
    }

    private void startWatching(Path file) throws IOException {
        Path directory = file.getParent();
        if (directory == null || !Files.isDirectory(directory)) {
            log.warn("Snapshot directory does not exist: {}", directory);
            return;
        }

        snapshotFile = file;
        watchService = FileSystems.getDefault().newWatchService();
        directory.register(watchService, ENTRY_CREATE, ENTRY_MODIFY, ENTRY_DELETE);
        log.info("Watching block snapshot: {}", file);

        running = true;
        executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "snapshot-watcher");
            t.setDaemon(true);
            return t;
        });

        executor.submit(this::watchLoop);
    }

    private void watchLoop() {
        log.debug("Watch loop started");

        while (running) {
            try {
                WatchKey key = watchService.poll(pollMillis, TimeUnit.MILLISECONDS);

                if (key == null) {
                    continue;
                }

                boolean changed = false;
                boolean deleted = false;
                for (WatchEvent<?> event : key.pollEvents()) {
                    WatchEvent.Kind<?> kind = event.kind();

                    if (kind == OVERFLOW) {
                        log.warn("Watch event overflow, reloading snapshot to be safe");
                        changed = true;
                        continue;
                    }

                    @SuppressWarnings("unchecked")
                    WatchEvent<Path> pathEvent = (WatchEvent<Path>) event;
                    if (!pathEvent.context().equals(snapshotFile.getFileName())) {
                        continue;
                    }

                    if (kind == ENTRY_DELETE) {
                        deleted = true;
                    } else {
                        changed = true;
                    }
                }

                if (changed) {
                    handleChange();
                } else if (deleted) {
                    log.info("Snapshot deleted: {} (keeping loaded blocks)", snapshotFile);
                }

                if (!key.reset()) {
                    log.warn("Watch key no longer valid, stopping watcher");
                    break;
                }

            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.info("Snapshot watcher interrupted");
                break;
            } catch (RuntimeException e) {
                log.error("Error in watch loop", e);
            }
        }

        log.debug("Watch loop stopped");
    }

    private void handleChange() {
        LoadResult result = snapshotLoader.reloadSnapshot(snapshotFile);
        if (result.isSuccess()) {
            log.info("✓ Successfully reloaded {} blocks from {}", result.blockCount(), result.source());
        } else {
            log.error("✗ Failed to reload {}: {}",
                    result.source(), result.error().orElse("unknown error"));
        }
    }

    private void stopWatching() {
        if (watchService == null) {
            return;
        }

        log.info("Stopping snapshot watcher");
        running = false;

        if (executor != null) {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }

        try {
            watchService.close();
        } catch (IOException e) {
            log.error("Error closing watch service", e);
        }

        log.info("Snapshot watcher stopped");
    }
}
