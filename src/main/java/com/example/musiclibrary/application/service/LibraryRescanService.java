package com.example.musiclibrary.application.service;

import com.example.musiclibrary.common.exception.LibraryException;
import com.example.musiclibrary.domain.model.LibraryChangedEvent;
import com.example.musiclibrary.domain.model.RescanStatus;
import com.example.musiclibrary.domain.model.SyncResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Full reconciliation of every library root against the catalog. Picks up events the watcher or debouncer
 * dropped and tracks whose files vanished while nothing was watching.
 */
@Service
public class LibraryRescanService {

    private static final Logger log = LoggerFactory.getLogger(LibraryRescanService.class);

    private final LibrarySyncEngine librarySyncEngine;
    private final IncrementalSynchronizer synchronizer;
    private final CatalogService catalogService;
    private final ApplicationEventPublisher eventPublisher;
    private final ExecutorService rescanExecutor;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final RescanStatus status = new RescanStatus();

    public LibraryRescanService(LibrarySyncEngine librarySyncEngine,
                                IncrementalSynchronizer synchronizer,
                                CatalogService catalogService,
                                ApplicationEventPublisher eventPublisher,
                                @Qualifier("rescanExecutor") ExecutorService rescanExecutor) {
        this.librarySyncEngine = librarySyncEngine;
        this.synchronizer = synchronizer;
        this.catalogService = catalogService;
        this.eventPublisher = eventPublisher;
        this.rescanExecutor = rescanExecutor;
    }

    /**
     * Starts a rescan in the background.
     *
     * @throws LibraryException {@code 40901} when a rescan is already running
     */
    public void trigger() {
        if (!running.compareAndSet(false, true)) {
            throw new LibraryException(LibraryException.CONFLICT, "A library rescan is already running",
                    "Wait for the current rescan to finish");
        }
        try {
            rescanExecutor.submit(this::runClaimed);
        } catch (RejectedExecutionException e) {
            running.set(false);
            throw new LibraryException(LibraryException.CONFLICT, "Rescan queue is full", null, e);
        }
        log.info("RESCAN_SUBMITTED");
    }

    /**
     * Runs a rescan on the calling thread.
     *
     * @throws LibraryException {@code 40901} when a rescan is already running
     */
    public SyncResult rescan() {
        if (!running.compareAndSet(false, true)) {
            throw new LibraryException(LibraryException.CONFLICT, "A library rescan is already running",
                    "Wait for the current rescan to finish");
        }
        return runClaimed();
    }

    public synchronized RescanStatus getStatus() {
        RescanStatus copy = new RescanStatus();
        copy.setRunning(running.get());
        copy.setLastStartedAtMs(status.getLastStartedAtMs());
        copy.setLastFinishedAtMs(status.getLastFinishedAtMs());
        copy.setLastResult(status.getLastResult());
        copy.setLastError(status.getLastError());
        return copy;
    }

    private SyncResult runClaimed() {
        long start = System.currentTimeMillis();
        synchronized (this) {
            status.setLastStartedAtMs(start);
            status.setLastError(null);
        }
        log.info("RESCAN_STARTED roots={}", librarySyncEngine.getWatchedDirectories().size());
        try {
            SyncResult result = synchronizer.withLock(this::reconcileAllRoots);
            synchronized (this) {
                status.setLastResult(result);
            }
            if (result.hasChanges()) {
                eventPublisher.publishEvent(new LibraryChangedEvent(this, null, result));
            }
            log.info("RESCAN_FINISHED upserted={} removed={} failed={} albumsPruned={} artistsPruned={} costMs={}",
                    result.getTracksUpserted(), result.getTracksRemoved(), result.getFilesFailed(),
                    result.getAlbumsPruned(), result.getArtistsPruned(), System.currentTimeMillis() - start);
            return result;
        } catch (RuntimeException e) {
            synchronized (this) {
                status.setLastError(e.getMessage());
            }
            log.error("RESCAN_FAILED costMs={}", System.currentTimeMillis() - start, e);
            throw e;
        } finally {
            synchronized (this) {
                status.setLastFinishedAtMs(System.currentTimeMillis());
            }
            running.set(false);
        }
    }

    private SyncResult reconcileAllRoots() {
        SyncResult total = new SyncResult();
        for (Path root : librarySyncEngine.getWatchedDirectories()) {
            if (!Files.isDirectory(root)) {
                // An unmounted root must not wipe its catalog rows.
                log.warn("RESCAN_ROOT_UNAVAILABLE root={}", root);
                continue;
            }
            List<Path> files = synchronizer.listAudioFiles(root, Integer.MAX_VALUE);
            if (!files.isEmpty()) {
                total.merge(synchronizer.handleChanged(files));
            }
            List<Path> missing = catalogService.listTrackPathsUnder(root).stream()
                    .map(Paths::get)
                    .filter(path -> !Files.exists(path))
                    .collect(Collectors.toList());
            if (!missing.isEmpty()) {
                log.info("RESCAN_MISSING_FILES root={} count={}", root, missing.size());
                total.merge(synchronizer.handleRemoved(missing));
            }
        }
        return total;
    }
}
