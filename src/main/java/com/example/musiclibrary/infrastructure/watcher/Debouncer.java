package com.example.musiclibrary.infrastructure.watcher;

import com.example.musiclibrary.common.exception.DebounceChannelClosedException;
import com.example.musiclibrary.common.util.EventChannel;
import com.example.musiclibrary.domain.model.ChangeEvent;
import com.example.musiclibrary.domain.model.DebouncedEvent;
import com.example.musiclibrary.domain.model.RenamedPath;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Coalesces raw change events into settled batches. One shared quiet period covers the whole batch: every
 * accepted event restarts it, and the batch is flushed once no event arrived for {@code delayMs}, or once
 * {@code maxWaitMs} passed since the first event of the batch.
 *
 * <p>Within a batch the first classification of a path wins; later events for the same path are dropped.
 */
public class Debouncer implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(Debouncer.class);

    public enum State {
        IDLE,
        ACCUMULATING,
        QUIESCING,
        FLUSHED
    }

    private final EventChannel<ChangeEvent> inbound;
    private final EventChannel<DebouncedEvent> outbound;
    private final long delayNanos;
    private final long maxWaitNanos;

    private final Set<Path> pending = new HashSet<>();
    private final List<Path> changed = new ArrayList<>();
    private final List<Path> removed = new ArrayList<>();
    private final List<RenamedPath> renamed = new ArrayList<>();

    private volatile State state = State.IDLE;
    private long batchStartedAt;
    private long lastEventAt;
    private long droppedBatches;

    public Debouncer(EventChannel<ChangeEvent> inbound,
                     EventChannel<DebouncedEvent> outbound,
                     long delayMs,
                     long maxWaitMs) {
        this.inbound = inbound;
        this.outbound = outbound;
        this.delayNanos = TimeUnit.MILLISECONDS.toNanos(Math.max(0L, delayMs));
        this.maxWaitNanos = maxWaitMs <= 0 ? 0L : TimeUnit.MILLISECONDS.toNanos(Math.max(maxWaitMs, delayMs));
    }

    /**
     * Processes the inbound channel until it is closed.
     *
     * @throws DebounceChannelClosedException always, after flushing what was pending, once the inbound
     *                                        channel is closed
     */
    @Override
    public void run() {
        log.info("DEBOUNCER_STARTED delayMs={} maxWaitMs={}",
                TimeUnit.NANOSECONDS.toMillis(delayNanos), TimeUnit.NANOSECONDS.toMillis(maxWaitNanos));
        try {
            while (true) {
                ChangeEvent event;
                if (pending.isEmpty()) {
                    state = State.IDLE;
                    event = inbound.receive();
                } else {
                    long waitNanos = nanosUntilFlush(System.nanoTime());
                    if (waitNanos <= 0) {
                        flush();
                        continue;
                    }
                    state = State.QUIESCING;
                    event = inbound.receive(Math.max(1L, TimeUnit.NANOSECONDS.toMillis(waitNanos)));
                    if (event == null) {
                        continue;
                    }
                }
                accept(event, System.nanoTime());
            }
        } catch (EventChannel.ChannelClosedException e) {
            flush();
            state = State.IDLE;
            throw new DebounceChannelClosedException("Raw change channel closed, debouncer stopping", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            flush();
            throw new DebounceChannelClosedException("Debouncer interrupted", e);
        }
    }

    /**
     * Adds one raw event to the current batch.
     *
     * @return false when the event was coalesced into an earlier one
     */
    boolean accept(ChangeEvent event, long nowNanos) {
        boolean firstInBatch = pending.isEmpty();
        boolean added;
        switch (event.getType()) {
            case FILE_CHANGED:
                added = pending.add(event.getPath());
                if (added) {
                    changed.add(event.getPath());
                }
                break;
            case FILE_REMOVED:
                added = pending.add(event.getPath());
                if (added) {
                    removed.add(event.getPath());
                }
                break;
            case FILE_RENAMED:
                added = !pending.contains(event.getFrom()) && !pending.contains(event.getPath());
                if (added) {
                    pending.add(event.getFrom());
                    pending.add(event.getPath());
                    renamed.add(new RenamedPath(event.getFrom(), event.getPath()));
                }
                break;
            default:
                added = false;
        }
        if (!added) {
            log.trace("DEBOUNCE_COALESCED type={} path={}", event.getType(), event.getPath());
            return false;
        }
        if (firstInBatch) {
            batchStartedAt = nowNanos;
        }
        lastEventAt = nowNanos;
        state = State.ACCUMULATING;
        return true;
    }

    /**
     * Emits the accumulated buckets in changed, removed, renamed order and resets the batch.
     */
    void flush() {
        if (pending.isEmpty()) {
            return;
        }
        send(changed.isEmpty() ? null : DebouncedEvent.filesChanged(changed));
        send(removed.isEmpty() ? null : DebouncedEvent.filesRemoved(removed));
        send(renamed.isEmpty() ? null : DebouncedEvent.filesRenamed(renamed));
        log.debug("DEBOUNCE_FLUSHED changed={} removed={} renamed={}", changed.size(), removed.size(), renamed.size());
        pending.clear();
        changed.clear();
        removed.clear();
        renamed.clear();
        state = State.FLUSHED;
    }

    long nanosUntilFlush(long nowNanos) {
        long deadline = lastEventAt + delayNanos;
        if (maxWaitNanos > 0) {
            deadline = Math.min(deadline, batchStartedAt + maxWaitNanos);
        }
        return deadline - nowNanos;
    }

    public State getState() {
        return state;
    }

    public int getPendingCount() {
        return pending.size();
    }

    public long getDroppedBatches() {
        return droppedBatches;
    }

    private void send(DebouncedEvent event) {
        if (event == null) {
            return;
        }
        if (!outbound.trySend(event)) {
            droppedBatches++;
            log.warn("DEBOUNCE_BATCH_DROPPED type={} size={} channelClosed={} action=defer-to-rescan",
                    event.getType(), event.size(), outbound.isClosed());
        }
    }
}
