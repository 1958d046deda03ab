package com.keywatch.observability;

import com.keywatch.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class MonitorStatsTest {

    @Test
    void countersAndUptime() {
        var clock = MutableClock.utc("2024-03-01T00:00:00Z");
        var stats = new MonitorStats(clock);
        stats.received();
        stats.received();
        stats.matched();
        stats.sent();
        clock.advance(Duration.ofMinutes(90));

        assertEquals(new MonitorStats.Snapshot(2, 1, 0, 1, 0), stats.snapshot());
        assertEquals(Duration.ofMinutes(90), stats.uptime());
    }

    @Test
    void uptimeFormatting() {
        assertEquals("00:00:05", MonitorStats.formatUptime(Duration.ofSeconds(5)));
        assertEquals("2d 03:04:05", MonitorStats.formatUptime(Duration.ofDays(2).plusHours(3).plusMinutes(4).plusSeconds(5)));
    }
}
