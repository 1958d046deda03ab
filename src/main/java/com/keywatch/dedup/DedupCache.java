package com.keywatch.dedup;

import com.keywatch.shared.config.MonitorConfig.DedupSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Time-windowed record of already-notified content digests.
 * <p>
 * The expiry window is read from the settings passed to each call, so a changed
 * {@code expiry_hours} applies to existing entries immediately.
 */
public class DedupCache {

    private static final Logger log = LoggerFactory.getLogger(DedupCache.class);
    static final int SWEEP_THRESHOLD = 1000;

    private final ConcurrentHashMap<String, Instant> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public DedupCache(Clock clock) {
        this.clock = clock;
    }

    /**
     * Records the digest if it is not already live.
     *
     * @return true when the digest was seen within the expiry window and the message must be dropped
     */
    public boolean checkAndRecord(String digest, DedupSettings settings) {
        if (!settings.enabled()) return false;

        var now = clock.instant();
        var ttl = Duration.ofHours(settings.expiryHours());
        var duplicate = new AtomicBoolean();
        entries.compute(digest, (key, seenAt) -> {
            if (seenAt != null && isLive(seenAt, now, ttl)) {
                duplicate.set(true);
                return seenAt;
            }
            return now;
        });

        if (!duplicate.get() && entries.size() > SWEEP_THRESHOLD) {
            sweep(settings);
        }
        return duplicate.get();
    }

    /** Removes expired entries and returns how many were dropped. */
    public int sweep(DedupSettings settings) {
        var now = clock.instant();
        var ttl = Duration.ofHours(settings.expiryHours());
        var removed = new AtomicInteger();
        entries.entrySet().removeIf(entry -> {
            boolean expired = !isLive(entry.getValue(), now, ttl);
            if (expired) removed.incrementAndGet();
            return expired;
        });
        if (removed.get() > 0) {
            log.info("Cleaned up {} expired message hashes", removed.get());
        }
        return removed.get();
    }

    public DedupStats stats(DedupSettings settings) {
        var now = clock.instant();
        var ttl = Duration.ofHours(settings.expiryHours());
        int live = (int) entries.values().stream().filter(seenAt -> isLive(seenAt, now, ttl)).count();
        return new DedupStats(entries.size(), live, settings.enabled(), settings.expiryHours());
    }

    public int size() {
        return entries.size();
    }

    private static boolean isLive(Instant seenAt, Instant now, Duration ttl) {
        return now.isBefore(seenAt.plus(ttl));
    }
}
