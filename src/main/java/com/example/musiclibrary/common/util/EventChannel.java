package com.example.musiclibrary.common.util;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Bounded single-consumer handoff between pipeline stages. Producers never block: a full or closed channel
 * rejects the element. Consumers drain what is queued before observing closure.
 *
 * @param <T> element type
 */
public class EventChannel<T> {

    private static final long POLL_TICK_MS = 50L;

    private final String name;
    private final BlockingQueue<T> queue;
    private volatile boolean closed;

    public EventChannel(String name, int capacity) {
        this.name = name;
        this.queue = new ArrayBlockingQueue<>(Math.max(1, capacity));
    }

    /**
     * @return false when the channel is full or closed
     */
    public boolean trySend(T element) {
        if (closed) {
            return false;
        }
        return queue.offer(element);
    }

    /**
     * Blocks until an element is available.
     *
     * @throws ChannelClosedException once the channel is closed and drained
     */
    public T receive() throws InterruptedException {
        while (true) {
            T element = queue.poll(POLL_TICK_MS, TimeUnit.MILLISECONDS);
            if (element != null) {
                return element;
            }
            if (closed && queue.isEmpty()) {
                throw new ChannelClosedException(name);
            }
        }
    }

    /**
     * @return the next element, or null when none arrived within the timeout
     * @throws ChannelClosedException once the channel is closed and drained
     */
    public T receive(long timeoutMs) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(Math.max(0L, timeoutMs));
        while (true) {
            long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            T element = queue.poll(Math.max(0L, Math.min(POLL_TICK_MS, remainingMs)), TimeUnit.MILLISECONDS);
            if (element != null) {
                return element;
            }
            if (closed && queue.isEmpty()) {
                throw new ChannelClosedException(name);
            }
            if (remainingMs <= 0) {
                return null;
            }
        }
    }

    public void close() {
        closed = true;
    }

    public boolean isClosed() {
        return closed;
    }

    public int size() {
        return queue.size();
    }

    public String getName() {
        return name;
    }

    public static class ChannelClosedException extends RuntimeException {

        public ChannelClosedException(String channelName) {
            super("Channel closed: " + channelName);
        }
    }
}
