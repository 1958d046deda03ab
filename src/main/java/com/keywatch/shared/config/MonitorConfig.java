package com.keywatch.shared.config;

import com.keywatch.shared.model.GroupRule;
import com.keywatch.shared.model.Keyword;
import com.keywatch.shared.model.NotificationTarget;

import java.util.List;

/**
 * Immutable snapshot of everything the pipeline reads. Mutations build a new value.
 */
public record MonitorConfig(
    List<Keyword> keywords,
    GroupRule groups,
    Settings settings,
    DedupSettings duplicates,
    NotificationTarget target
) {
    public MonitorConfig {
        keywords = List.copyOf(keywords);
    }

    public record Settings(boolean caseSensitive, boolean sendFullMessage, int maxMessageLength) {
        public static Settings defaults() {
            return new Settings(false, true, 500);
        }
    }

    public record DedupSettings(boolean enabled, int expiryHours, boolean includeSender) {
        public static final int MIN_EXPIRY_HOURS = 1;
        public static final int MAX_EXPIRY_HOURS = 168;

        public static DedupSettings defaults() {
            return new DedupSettings(true, 24, true);
        }

        public DedupSettings withEnabled(boolean value) {
            return new DedupSettings(value, expiryHours, includeSender);
        }

        public DedupSettings withExpiryHours(int value) {
            return new DedupSettings(enabled, value, includeSender);
        }

        public DedupSettings withIncludeSender(boolean value) {
            return new DedupSettings(enabled, expiryHours, value);
        }
    }

    public static MonitorConfig defaults() {
        return new MonitorConfig(List.of(), GroupRule.empty(), Settings.defaults(),
                DedupSettings.defaults(), NotificationTarget.self());
    }

    public MonitorConfig withKeywords(List<Keyword> value) {
        return new MonitorConfig(value, groups, settings, duplicates, target);
    }

    public MonitorConfig withGroups(GroupRule value) {
        return new MonitorConfig(keywords, value, settings, duplicates, target);
    }

    public MonitorConfig withDuplicates(DedupSettings value) {
        return new MonitorConfig(keywords, groups, settings, value, target);
    }

    public MonitorConfig withTarget(NotificationTarget value) {
        return new MonitorConfig(keywords, groups, settings, duplicates, value);
    }
}
