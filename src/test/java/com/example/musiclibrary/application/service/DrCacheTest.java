package com.example.musiclibrary.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import com.example.musiclibrary.common.config.AppDrProperties;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DrCacheTest {

    private MutableClock clock;
    private DrCache drCache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T00:00:00Z"));
        AppDrProperties properties = new AppDrProperties();
        properties.setCacheTtlMs(60_000L);
        properties.setCacheMaxEntries(3);
        drCache = new DrCache(properties, clock);
    }

    @Test
    void entriesShouldExpireAfterTtl() {
        Path album = Paths.get("/music/Artist/Album");
        drCache.put(album, "DR12");

        clock.plusMillis(59_999L);
        assertEquals("DR12", drCache.get(album));

        clock.plusMillis(1L);
        assertNull(drCache.get(album));
    }

    @Test
    void keysShouldBeNormalized() {
        drCache.put(Paths.get("/music/Artist/./Album"), "DR9");

        assertEquals("DR9", drCache.get(Paths.get("/music/Artist/Album")));
        assertEquals("DR9", drCache.get(Paths.get("/music/Other/../Artist/Album")));
    }

    @Test
    void oldestEntriesShouldBeEvictedBeyondCapacity() {
        drCache.put(Paths.get("/music/a"), "DR1");
        drCache.put(Paths.get("/music/b"), "DR2");
        drCache.put(Paths.get("/music/c"), "DR3");
        drCache.put(Paths.get("/music/d"), "DR4");

        assertEquals(3, drCache.size());
        assertNull(drCache.get(Paths.get("/music/a")));
        assertEquals("DR4", drCache.get(Paths.get("/music/d")));
    }

    @Test
    void rewritingAnEntryShouldRefreshItsAge() {
        drCache.put(Paths.get("/music/a"), "DR1");
        drCache.put(Paths.get("/music/b"), "DR2");
        drCache.put(Paths.get("/music/c"), "DR3");
        drCache.put(Paths.get("/music/a"), "DR10");
        drCache.put(Paths.get("/music/d"), "DR4");

        assertEquals("DR10", drCache.get(Paths.get("/music/a")));
        assertNull(drCache.get(Paths.get("/music/b")));
    }

    @Test
    void writesShouldPruneExpiredEntries() {
        drCache.put(Paths.get("/music/a"), "DR1");
        clock.plusMillis(60_000L);
        drCache.put(Paths.get("/music/b"), "DR2");

        assertEquals(1, drCache.size());
    }

    @Test
    void invalidateAndClearShouldDropEntries() {
        drCache.put(Paths.get("/music/a"), "DR1");
        drCache.put(Paths.get("/music/b"), "DR2");

        drCache.invalidate(Paths.get("/music/a"));
        assertNull(drCache.get(Paths.get("/music/a")));
        assertEquals("DR2", drCache.get(Paths.get("/music/b")));

        drCache.clear();
        assertEquals(0, drCache.size());
    }

    private static final class MutableClock extends Clock {
        private Instant instant;

        private MutableClock(Instant instant) {
            this.instant = instant;
        }

        @Override
        public ZoneOffset getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(java.time.ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return instant;
        }

        private void plusMillis(long millis) {
            this.instant = this.instant.plusMillis(millis);
        }
    }
}
