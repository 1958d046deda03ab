package com.keywatch.dedup;

public record DedupStats(int entries, int liveEntries, boolean enabled, int expiryHours) {}
