package com.keywatch.observability;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-lifetime pipeline counters reported by /status.
 */
public class MonitorStats {

    private final Clock clock;
    private final Instant startedAt;
    private final AtomicLong received = new AtomicLong();
    private final AtomicLong matched = new AtomicLong();
    private final AtomicLong duplicates = new AtomicLong();
    private final AtomicLong sent = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    public MonitorStats(Clock clock) {
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    public void received() {
        received.incrementAndGet();
    }

    public void matched() {
        matched.incrementAndGet();
    }

    public void duplicate() {
        duplicates.incrementAndGet();
    }

    public void sent() {
        sent.incrementAndGet();
    }

    public void failed() {
        failed.incrementAndGet();
    }

    public Duration uptime() {
        return Duration.between(startedAt, clock.instant());
    }

    public Snapshot snapshot() {
        return new Snapshot(received.get(), matched.get(), duplicates.get(), sent.get(), failed.get());
    }

    public record Snapshot(long received, long matched, long duplicates, long sent, long failed) {}

    public static String formatUptime(Duration uptime) {
        long days = uptime.toDays();
        var sb = new StringBuilder();
        if (days > 0) sb.append(days).append("d ");
        sb.append(String.format("%02d:%02d:%02d", uptime.toHoursPart(), uptime.toMinutesPart(), uptime.toSecondsPart()));
        return sb.toString();
    }
}
