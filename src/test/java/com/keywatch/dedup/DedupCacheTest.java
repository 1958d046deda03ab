package com.keywatch.dedup;

import com.keywatch.shared.config.MonitorConfig.DedupSettings;
import com.keywatch.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class DedupCacheTest {

    private static final DedupSettings ON = new DedupSettings(true, 24, true);

    private final MutableClock clock = MutableClock.utc("2024-03-01T00:00:00Z");
    private final DedupCache cache = new DedupCache(clock);

    @Test
    void secondSightingWithinWindowIsDuplicate() {
        assertFalse(cache.checkAndRecord("abc", ON));
        clock.advance(Duration.ofHours(23));
        assertTrue(cache.checkAndRecord("abc", ON));
    }

    @Test
    void expiredEntryCountsAsFirstSighting() {
        assertFalse(cache.checkAndRecord("abc", ON));
        clock.advance(Duration.ofHours(24));
        assertFalse(cache.checkAndRecord("abc", ON));
        clock.advance(Duration.ofHours(1));
        assertTrue(cache.checkAndRecord("abc", ON));
    }

    @Test
    void duplicateDoesNotRefreshTimestamp() {
        cache.checkAndRecord("abc", ON);
        clock.advance(Duration.ofHours(20));
        assertTrue(cache.checkAndRecord("abc", ON));
        clock.advance(Duration.ofHours(5));
        assertFalse(cache.checkAndRecord("abc", ON));
    }

    @Test
    void shorterExpiryAppliesToExistingEntries() {
        cache.checkAndRecord("abc", ON);
        clock.advance(Duration.ofHours(3));
        assertFalse(cache.checkAndRecord("abc", ON.withExpiryHours(2)));
    }

    @Test
    void disabledSettingsBypassTheCache() {
        var off = ON.withEnabled(false);
        assertFalse(cache.checkAndRecord("abc", off));
        assertFalse(cache.checkAndRecord("abc", off));
        assertEquals(0, cache.size());
    }

    @Test
    void sweepDropsOnlyExpiredEntries() {
        cache.checkAndRecord("old", ON);
        clock.advance(Duration.ofHours(30));
        cache.checkAndRecord("new", ON);

        assertEquals(1, cache.sweep(ON));
        assertEquals(1, cache.size());
        assertTrue(cache.checkAndRecord("new", ON));
    }

    @Test
    void growingPastThresholdTriggersSweep() {
        for (int i = 0; i < DedupCache.SWEEP_THRESHOLD; i++) {
            cache.checkAndRecord("stale-" + i, ON);
        }
        clock.advance(Duration.ofHours(25));
        cache.checkAndRecord("fresh-1", ON);
        assertEquals(1, cache.size());
    }

    @Test
    void statsSeparateLiveFromExpired() {
        cache.checkAndRecord("a", ON);
        clock.advance(Duration.ofHours(30));
        cache.checkAndRecord("b", ON);

        var stats = cache.stats(ON);
        assertEquals(2, stats.entries());
        assertEquals(1, stats.liveEntries());
        assertTrue(stats.enabled());
        assertEquals(24, stats.expiryHours());
    }

    @Test
    void concurrentCallersSeeExactlyOneFirstSighting() throws Exception {
        int threads = 16;
        var pool = Executors.newFixedThreadPool(threads);
        var start = new CountDownLatch(1);
        var firstSightings = new AtomicInteger();
        try {
            for (int i = 0; i < threads; i++) {
                pool.execute(() -> {
                    try {
                        start.await();
                        if (!cache.checkAndRecord("same-digest", ON)) {
                            firstSightings.incrementAndGet();
                        }
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                });
            }
            start.countDown();
        } finally {
            pool.shutdown();
            assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));
        }
        assertEquals(1, firstSightings.get());
    }
}
