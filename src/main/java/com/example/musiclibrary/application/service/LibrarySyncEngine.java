package com.example.musiclibrary.application.service;

import com.example.musiclibrary.common.config.AppDrProperties;
import com.example.musiclibrary.common.config.AppLibraryProperties;
import com.example.musiclibrary.common.exception.DebounceChannelClosedException;
import com.example.musiclibrary.common.exception.WatchException;
import com.example.musiclibrary.common.util.EventChannel;
import com.example.musiclibrary.domain.model.ChangeEvent;
import com.example.musiclibrary.domain.model.DebouncedEvent;
import com.example.musiclibrary.infrastructure.persistence.schema.SchemaStore;
import com.example.musiclibrary.infrastructure.watcher.ChangeWatcher;
import com.example.musiclibrary.infrastructure.watcher.Debouncer;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import javax.annotation.PostConstruct;
import javax.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Owns the watcher &rarr; debouncer &rarr; synchronizer pipeline and the set of library roots.
 *
 * <p>Stopping closes every watch and the raw channel. The debouncer drains, flushes and terminates, after
 * which the debounced channel is closed and the synchronizer loop ends. Channel closure is the only shutdown
 * signal between stages.
 */
@Service
public class LibrarySyncEngine {

    private static final Logger log = LoggerFactory.getLogger(LibrarySyncEngine.class);

    private final AppLibraryProperties libraryProperties;
    private final AppDrProperties drProperties;
    private final IncrementalSynchronizer synchronizer;
    private final SchemaStore schemaStore;
    private final ExecutorService pipelineExecutor;
    private final MeterRegistry meterRegistry;

    private final Set<Path> roots = new LinkedHashSet<>();

    private EventChannel<ChangeEvent> rawChannel;
    private EventChannel<DebouncedEvent> debouncedChannel;
    private ChangeWatcher changeWatcher;
    private Debouncer debouncer;

    private volatile boolean running;
    private volatile boolean stopping;
    private volatile boolean debouncerAlive;

    public LibrarySyncEngine(AppLibraryProperties libraryProperties,
                             AppDrProperties drProperties,
                             IncrementalSynchronizer synchronizer,
                             SchemaStore schemaStore,
                             @Qualifier("pipelineExecutor") ExecutorService pipelineExecutor,
                             ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this.libraryProperties = libraryProperties;
        this.drProperties = drProperties;
        this.synchronizer = synchronizer;
        this.schemaStore = schemaStore;
        this.pipelineExecutor = pipelineExecutor;
        this.meterRegistry = meterRegistryProvider.getIfAvailable();
    }

    @PostConstruct
    public void start() {
        log.info("LIBRARY_ENGINE_STARTING schemaVersion={} roots={} watchEnabled={}",
                schemaStore.readStoredVersion(), libraryProperties.getRoots(), libraryProperties.isWatchEnabled());
        if (libraryProperties.isWatchEnabled()) {
            startPipeline();
        }
        for (String root : libraryProperties.getRoots()) {
            if (!StringUtils.hasText(root)) {
                continue;
            }
            try {
                addDirectory(root.trim());
            } catch (WatchException e) {
                log.warn("LIBRARY_ROOT_SKIPPED root={} reason={}", root, e.getMessage());
            }
        }
    }

    private synchronized void startPipeline() {
        rawChannel = new EventChannel<>("raw-changes", libraryProperties.getRawChannelCapacity());
        debouncedChannel = new EventChannel<>("debounced-changes", libraryProperties.getDebouncedChannelCapacity());
        changeWatcher = new ChangeWatcher(rawChannel,
                libraryProperties.normalizedAudioExtensions(),
                drProperties.normalizedSidecarExtensions(),
                libraryProperties.isTrackSidecarChanges(),
                meterRegistry);
        debouncer = new Debouncer(rawChannel, debouncedChannel,
                libraryProperties.getDebounceDelayMs(), libraryProperties.getDebounceMaxWaitMs());
        try {
            debouncerAlive = true;
            pipelineExecutor.submit(this::runDebouncer);
            pipelineExecutor.submit(() -> synchronizer.consume(debouncedChannel));
        } catch (RejectedExecutionException e) {
            debouncerAlive = false;
            throw new IllegalStateException("Library pipeline threads could not be started", e);
        }
        running = true;
        log.info("LIBRARY_PIPELINE_STARTED rawCapacity={} debouncedCapacity={}",
                libraryProperties.getRawChannelCapacity(), libraryProperties.getDebouncedChannelCapacity());
    }

    private void runDebouncer() {
        try {
            debouncer.run();
        } catch (DebounceChannelClosedException e) {
            if (stopping) {
                log.info("DEBOUNCER_STOPPED reason={}", e.getMessage());
            } else {
                log.error("DEBOUNCER_TERMINATED reason={} action=restart-engine", e.getMessage(), e);
            }
        } catch (RuntimeException e) {
            log.error("DEBOUNCER_TERMINATED reason=unexpected", e);
        } finally {
            debouncerAlive = false;
            running = false;
            debouncedChannel.close();
        }
    }

    @PreDestroy
    public synchronized void stop() {
        stopping = true;
        if (changeWatcher != null) {
            changeWatcher.close();
        }
        if (rawChannel != null) {
            rawChannel.close();
        }
        running = false;
        log.info("LIBRARY_ENGINE_STOPPED roots={}", roots.size());
    }

    /**
     * Registers a library root and, when watching is enabled, subscribes to its changes.
     *
     * @throws WatchException when the path is not an accessible directory or cannot be watched
     */
    public synchronized void addDirectory(String directory) {
        Path root = toRoot(directory);
        if (!Files.isDirectory(root)) {
            throw new WatchException("Not a directory: " + root);
        }
        if (changeWatcher != null && !stopping) {
            changeWatcher.watch(root);
        }
        if (roots.add(root)) {
            log.info("LIBRARY_ROOT_ADDED root={}", root);
        }
    }

    /**
     * Unregisters a library root. Catalog rows under it are left in place until the next rescan or removal.
     *
     * @throws WatchException when the subscription cannot be released
     */
    public synchronized void removeDirectory(String directory) {
        Path root = toRoot(directory);
        if (changeWatcher != null) {
            changeWatcher.unwatch(root);
        }
        if (roots.remove(root)) {
            log.info("LIBRARY_ROOT_REMOVED root={}", root);
        }
    }

    public synchronized List<Path> getWatchedDirectories() {
        return Collections.unmodifiableList(new ArrayList<>(roots));
    }

    public boolean isRunning() {
        return running && debouncerAlive;
    }

    public long getDroppedEventCount() {
        return changeWatcher == null ? 0L : changeWatcher.getDroppedEventCount();
    }

    private Path toRoot(String directory) {
        if (!StringUtils.hasText(directory)) {
            throw new WatchException("Directory path is empty");
        }
        try {
            return Paths.get(directory.trim()).toAbsolutePath().normalize();
        } catch (InvalidPathException e) {
            throw new WatchException("Invalid directory path: " + directory, e);
        }
    }
}
