package com.example.musiclibrary.infrastructure.watcher;

import com.example.musiclibrary.common.exception.WatchException;
import com.example.musiclibrary.common.util.EventChannel;
import com.example.musiclibrary.domain.model.ChangeEvent;
import io.methvin.watcher.DirectoryChangeEvent;
import io.methvin.watcher.DirectoryWatcher;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recursive watcher over a dynamic set of library roots. The OS callback only classifies and hands events
 * to the outbound channel without blocking.
 *
 * <p>When the channel is full the event is dropped and counted. Dropped events are reconciled by the next
 * full rescan.
 */
public class ChangeWatcher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ChangeWatcher.class);

    private final EventChannel<ChangeEvent> outbound;
    private final Set<String> audioExtensions;
    private final Set<String> sidecarExtensions;
    private final boolean trackSidecarChanges;
    private final MeterRegistry meterRegistry;

    private final Map<Path, WatchHandle> watches = new LinkedHashMap<>();
    private final AtomicLong droppedEvents = new AtomicLong();

    public ChangeWatcher(EventChannel<ChangeEvent> outbound,
                         Set<String> audioExtensions,
                         Set<String> sidecarExtensions,
                         boolean trackSidecarChanges,
                         MeterRegistry meterRegistry) {
        this.outbound = outbound;
        this.audioExtensions = audioExtensions;
        this.sidecarExtensions = sidecarExtensions;
        this.trackSidecarChanges = trackSidecarChanges;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Starts watching a root recursively. Watching an already watched root is a no-op.
     *
     * @throws WatchException when the path is not a readable directory or the subscription fails
     */
    public synchronized void watch(Path root) {
        Path key = normalize(root);
        if (watches.containsKey(key)) {
            return;
        }
        if (!Files.isDirectory(key)) {
            throw new WatchException("Not a directory: " + key);
        }
        if (!Files.isReadable(key)) {
            throw new WatchException("Directory is not readable: " + key);
        }
        DirectoryWatcher watcher;
        try {
            watcher = DirectoryWatcher.builder()
                    .path(key)
                    .listener(event -> handle(event.eventType(), event.path(), event.isDirectory()))
                    .fileHashing(false)
                    .build();
        } catch (IOException e) {
            throw new WatchException("Cannot watch " + key + ": " + e.getMessage(), e);
        }
        CompletableFuture<Void> future = watcher.watchAsync();
        watches.put(key, new WatchHandle(watcher, future));
        log.info("WATCH_STARTED root={}", key);
    }

    /**
     * Stops watching a root. Unwatching an unknown root is a no-op.
     *
     * @throws WatchException when the subscription cannot be released cleanly
     */
    public synchronized void unwatch(Path root) {
        Path key = normalize(root);
        WatchHandle handle = watches.remove(key);
        if (handle == null) {
            return;
        }
        try {
            handle.close();
        } catch (IOException e) {
            throw new WatchException("Cannot stop watching " + key + ": " + e.getMessage(), e);
        }
        log.info("WATCH_STOPPED root={}", key);
    }

    public synchronized List<Path> getWatchedRoots() {
        return Collections.unmodifiableList(new ArrayList<>(watches.keySet()));
    }

    public synchronized boolean isWatching(Path root) {
        return watches.containsKey(normalize(root));
    }

    public long getDroppedEventCount() {
        return droppedEvents.get();
    }

    /**
     * Classifies one raw notification and forwards it. Runs on the watcher's thread.
     */
    void handle(DirectoryChangeEvent.EventType type, Path path, boolean directory) {
        if (type == null) {
            return;
        }
        if (type == DirectoryChangeEvent.EventType.OVERFLOW) {
            log.warn("WATCH_OVERFLOW path={} action=defer-to-rescan", path);
            return;
        }
        if (path == null) {
            return;
        }
        ChangeEvent event = classify(type, path, directory);
        if (event == null) {
            return;
        }
        if (!outbound.trySend(event)) {
            long dropped = droppedEvents.incrementAndGet();
            incrementCounter("library.watch.event.dropped");
            log.warn("WATCH_EVENT_DROPPED type={} path={} channelClosed={} droppedTotal={}",
                    event.getType(), path, outbound.isClosed(), dropped);
        }
    }

    private ChangeEvent classify(DirectoryChangeEvent.EventType type, Path path, boolean directory) {
        if (directory) {
            // New or vanished folders are expanded or prefix-deleted downstream.
            switch (type) {
                case CREATE:
                    return ChangeEvent.changed(path, true);
                case DELETE:
                    return ChangeEvent.removed(path);
                default:
                    return null;
            }
        }
        String extension = extensionOf(path);
        boolean relevant = audioExtensions.contains(extension)
                || (trackSidecarChanges && sidecarExtensions.contains(extension));
        if (!relevant) {
            return null;
        }
        switch (type) {
            case CREATE:
                return ChangeEvent.changed(path, true);
            case MODIFY:
                return ChangeEvent.changed(path, false);
            case DELETE:
                return ChangeEvent.removed(path);
            default:
                log.debug("WATCH_EVENT_DEFERRED type={} path={}", type, path);
                return null;
        }
    }

    @Override
    public synchronized void close() {
        for (Map.Entry<Path, WatchHandle> entry : watches.entrySet()) {
            try {
                entry.getValue().close();
            } catch (IOException e) {
                log.warn("WATCH_CLOSE_FAILED root={} reason={}", entry.getKey(), e.getMessage());
            }
        }
        watches.clear();
    }

    private String extensionOf(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return "";
        }
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            return "";
        }
        return name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    private Path normalize(Path root) {
        return root.toAbsolutePath().normalize();
    }

    private void incrementCounter(String name) {
        if (meterRegistry == null) {
            return;
        }
        try {
            meterRegistry.counter(name).increment();
        } catch (Exception e) {
            log.debug("Metric counter update failed, name={}", name, e);
        }
    }

    private static final class WatchHandle {

        private final DirectoryWatcher watcher;
        private final CompletableFuture<Void> future;

        private WatchHandle(DirectoryWatcher watcher, CompletableFuture<Void> future) {
            this.watcher = watcher;
            this.future = future;
        }

        private void close() throws IOException {
            watcher.close();
            if (!future.isDone()) {
                future.cancel(true);
            }
        }
    }
}
