package com.example.musiclibrary.common.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class EventChannelTest {

    @Test
    void trySendShouldRejectWhenFull() {
        EventChannel<String> channel = new EventChannel<>("test", 2);

        assertTrue(channel.trySend("a"));
        assertTrue(channel.trySend("b"));
        assertFalse(channel.trySend("c"));
        assertEquals(2, channel.size());
    }

    @Test
    void receiveShouldPreserveOrder() throws InterruptedException {
        EventChannel<String> channel = new EventChannel<>("test", 4);
        channel.trySend("a");
        channel.trySend("b");

        assertEquals("a", channel.receive());
        assertEquals("b", channel.receive(10));
    }

    @Test
    void receiveWithTimeoutShouldReturnNullWhenIdle() throws InterruptedException {
        EventChannel<String> channel = new EventChannel<>("test", 4);

        assertNull(channel.receive(20));
    }

    @Test
    void closedChannelShouldDrainBeforeSignallingClosure() throws InterruptedException {
        EventChannel<String> channel = new EventChannel<>("test", 4);
        channel.trySend("a");
        channel.close();

        assertFalse(channel.trySend("b"));
        assertTrue(channel.isClosed());
        assertEquals("a", channel.receive(10));
        assertThrows(EventChannel.ChannelClosedException.class, () -> channel.receive(10));
        assertThrows(EventChannel.ChannelClosedException.class, channel::receive);
    }

    @Test
    void blockedReceiverShouldWakeOnClose() throws Exception {
        EventChannel<String> channel = new EventChannel<>("test", 4);
        CompletableFuture<Throwable> outcome = CompletableFuture.supplyAsync(() -> {
            try {
                channel.receive();
                return null;
            } catch (Throwable e) {
                return e;
            }
        });

        channel.close();

        assertTrue(outcome.get(2, TimeUnit.SECONDS) instanceof EventChannel.ChannelClosedException);
    }
}
