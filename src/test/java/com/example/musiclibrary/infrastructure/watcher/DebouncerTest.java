package com.example.musiclibrary.infrastructure.watcher;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.musiclibrary.common.exception.DebounceChannelClosedException;
import com.example.musiclibrary.common.util.EventChannel;
import com.example.musiclibrary.domain.model.ChangeEvent;
import com.example.musiclibrary.domain.model.DebouncedEvent;
import com.example.musiclibrary.domain.model.RenamedPath;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DebouncerTest {

    private static final Path A = Paths.get("/music/Album/01.flac");
    private static final Path B = Paths.get("/music/Album/02.flac");
    private static final Path C = Paths.get("/music/Album/03.flac");

    private EventChannel<ChangeEvent> inbound;
    private EventChannel<DebouncedEvent> outbound;
    private Debouncer debouncer;

    @BeforeEach
    void setUp() {
        inbound = new EventChannel<>("raw", 100);
        outbound = new EventChannel<>("debounced", 10);
        debouncer = new Debouncer(inbound, outbound, 500, 5000);
    }

    @Test
    void repeatedEventsForOnePathShouldCollapse() throws InterruptedException {
        assertTrue(debouncer.accept(ChangeEvent.changed(A, true), 0L));
        for (int i = 1; i < 10; i++) {
            assertFalse(debouncer.accept(ChangeEvent.changed(A, false), i));
        }
        debouncer.flush();

        DebouncedEvent batch = outbound.receive(10);
        assertEquals(DebouncedEvent.Type.FILES_CHANGED, batch.getType());
        assertEquals(Collections.singletonList(A), batch.getPaths());
        assertNull(outbound.receive(10));
    }

    @Test
    void firstClassificationShouldWin() throws InterruptedException {
        debouncer.accept(ChangeEvent.changed(A, true), 0L);
        debouncer.accept(ChangeEvent.removed(A), 1L);
        debouncer.accept(ChangeEvent.removed(B), 2L);
        debouncer.accept(ChangeEvent.changed(B, false), 3L);
        debouncer.flush();

        DebouncedEvent changed = outbound.receive(10);
        DebouncedEvent removed = outbound.receive(10);
        assertEquals(DebouncedEvent.Type.FILES_CHANGED, changed.getType());
        assertEquals(Collections.singletonList(A), changed.getPaths());
        assertEquals(DebouncedEvent.Type.FILES_REMOVED, removed.getType());
        assertEquals(Collections.singletonList(B), removed.getPaths());
    }

    @Test
    void flushShouldEmitChangedThenRemovedThenRenamed() throws InterruptedException {
        Path renamedTo = Paths.get("/music/Album/04.flac");
        debouncer.accept(ChangeEvent.renamed(C, renamedTo), 0L);
        debouncer.accept(ChangeEvent.removed(B), 1L);
        debouncer.accept(ChangeEvent.changed(A, true), 2L);
        debouncer.flush();

        assertEquals(DebouncedEvent.Type.FILES_CHANGED, outbound.receive(10).getType());
        assertEquals(DebouncedEvent.Type.FILES_REMOVED, outbound.receive(10).getType());
        DebouncedEvent renamed = outbound.receive(10);
        assertEquals(DebouncedEvent.Type.FILES_RENAMED, renamed.getType());
        assertEquals(Collections.singletonList(new RenamedPath(C, renamedTo)), renamed.getRenames());
        assertEquals(Debouncer.State.FLUSHED, debouncer.getState());
        assertEquals(0, debouncer.getPendingCount());
    }

    @Test
    void renameShouldBeDroppedWhenEitherEndIsPending() {
        debouncer.accept(ChangeEvent.changed(A, false), 0L);

        assertFalse(debouncer.accept(ChangeEvent.renamed(A, B), 1L));
        assertFalse(debouncer.accept(ChangeEvent.renamed(C, A), 2L));
        assertEquals(1, debouncer.getPendingCount());
    }

    @Test
    void quietPeriodShouldRestartOnEachEventButStayCapped() {
        Debouncer capped = new Debouncer(inbound, outbound, 100, 300);
        long ms = TimeUnit.MILLISECONDS.toNanos(1);

        capped.accept(ChangeEvent.changed(A, true), 0L);
        assertEquals(100 * ms, capped.nanosUntilFlush(0L));

        capped.accept(ChangeEvent.changed(B, true), 80 * ms);
        assertEquals(100 * ms, capped.nanosUntilFlush(80 * ms));

        capped.accept(ChangeEvent.changed(C, true), 250 * ms);
        assertEquals(50 * ms, capped.nanosUntilFlush(250 * ms));
    }

    @Test
    void fullOutboundChannelShouldCountDroppedBatches() {
        EventChannel<DebouncedEvent> tiny = new EventChannel<>("tiny", 1);
        Debouncer constrained = new Debouncer(inbound, tiny, 10, 100);
        constrained.accept(ChangeEvent.changed(A, true), 0L);
        constrained.accept(ChangeEvent.removed(B), 1L);

        constrained.flush();

        assertEquals(1, tiny.size());
        assertEquals(1L, constrained.getDroppedBatches());
    }

    @Test
    void runShouldFlushAfterQuietPeriod() throws Exception {
        Debouncer fast = new Debouncer(inbound, outbound, 50, 1000);
        inbound.trySend(ChangeEvent.changed(A, true));
        inbound.trySend(ChangeEvent.changed(A, false));
        inbound.trySend(ChangeEvent.changed(B, true));
        CompletableFuture<Void> loop = CompletableFuture.runAsync(fast);
        try {
            DebouncedEvent batch = outbound.receive(3000);
            assertNotNull(batch);
            assertEquals(Arrays.asList(A, B), batch.getPaths());
        } finally {
            inbound.close();
        }
        ExecutionException e = assertThrows(ExecutionException.class, () -> loop.get(3, TimeUnit.SECONDS));
        assertTrue(e.getCause() instanceof DebounceChannelClosedException);
    }

    @Test
    void closingInboundShouldFlushPendingBeforeFailing() throws Exception {
        Debouncer slow = new Debouncer(inbound, outbound, 60_000, 0);
        inbound.trySend(ChangeEvent.removed(C));
        inbound.close();

        assertThrows(DebounceChannelClosedException.class, slow::run);

        DebouncedEvent batch = outbound.receive(10);
        assertEquals(DebouncedEvent.Type.FILES_REMOVED, batch.getType());
        assertEquals(Collections.singletonList(C), batch.getPaths());
    }
}
