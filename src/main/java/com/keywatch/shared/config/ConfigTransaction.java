package com.keywatch.shared.config;

/**
 * A unit of change applied against the current config. Returning {@link Outcome#unchanged}
 * leaves the store untouched and skips persistence.
 */
@FunctionalInterface
public interface ConfigTransaction<R> {

    Outcome<R> apply(MonitorConfig current);

    record Outcome<R>(MonitorConfig next, R result) {

        public static <R> Outcome<R> commit(MonitorConfig next, R result) {
            if (next == null) throw new IllegalArgumentException("Committed config must not be null");
            return new Outcome<>(next, result);
        }

        public static <R> Outcome<R> unchanged(R result) {
            return new Outcome<>(null, result);
        }

        public boolean committed() {
            return next != null;
        }
    }
}
