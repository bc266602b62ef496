package com.example.musiclibrary.application.service;

import com.example.musiclibrary.common.config.AppDrProperties;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Memo of resolved DR values keyed by album directory. Entries expire after a TTL; expired entries are
 * pruned whenever the cache is written. Never authoritative: the album row holds the real value.
 */
@Component
public class DrCache {

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    /** Insertion order doubles as age order for eviction. */
    private final Map<Path, Entry> entries = new LinkedHashMap<>();
    private final long ttlMs;
    private final int maxEntries;
    private final Clock clock;

    @Autowired
    public DrCache(AppDrProperties appDrProperties) {
        this(appDrProperties, Clock.systemUTC());
    }

    DrCache(AppDrProperties appDrProperties, Clock clock) {
        this.ttlMs = Math.max(1L, appDrProperties.getCacheTtlMs());
        this.maxEntries = Math.max(1, appDrProperties.getCacheMaxEntries());
        this.clock = clock;
    }

    public String get(Path albumDir) {
        Path key = normalize(albumDir);
        lock.readLock().lock();
        try {
            Entry entry = entries.get(key);
            if (entry == null || isExpired(entry, clock.millis())) {
                return null;
            }
            return entry.drValue;
        } finally {
            lock.readLock().unlock();
        }
    }

    public void put(Path albumDir, String drValue) {
        Path key = normalize(albumDir);
        lock.writeLock().lock();
        try {
            long now = clock.millis();
            entries.remove(key);
            entries.put(key, new Entry(drValue, now));
            pruneLocked(now);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void invalidate(Path albumDir) {
        Path key = normalize(albumDir);
        lock.writeLock().lock();
        try {
            entries.remove(key);
            pruneLocked(clock.millis());
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            entries.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Stored entries, expired ones included until the next write. */
    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private void pruneLocked(long now) {
        Iterator<Map.Entry<Path, Entry>> iterator = entries.entrySet().iterator();
        while (iterator.hasNext()) {
            Entry entry = iterator.next().getValue();
            if (isExpired(entry, now) || entries.size() > maxEntries) {
                iterator.remove();
            }
        }
    }

    private boolean isExpired(Entry entry, long now) {
        return now - entry.insertedAtMs >= ttlMs;
    }

    private Path normalize(Path albumDir) {
        return albumDir.toAbsolutePath().normalize();
    }

    private static final class Entry {

        private final String drValue;
        private final long insertedAtMs;

        private Entry(String drValue, long insertedAtMs) {
            this.drValue = drValue;
            this.insertedAtMs = insertedAtMs;
        }
    }
}
