package com.keywatch.shared.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Holder of the live {@link MonitorConfig}. Reads are lock-free snapshots; writers are serialized,
 * build a new immutable value and publish it in one step, then persist it in the background.
 */
public class ConfigStore implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConfigStore.class);
    private static final long CLOSE_TIMEOUT_SECONDS = 5;

    private final AtomicReference<MonitorConfig> current;
    private final ReentrantLock writeLock = new ReentrantLock();
    private final ConfigPersister persister;
    private final ExecutorService persistExecutor;
    private final AtomicLong version = new AtomicLong();

    public ConfigStore(MonitorConfig initial, ConfigPersister persister) {
        if (initial == null) throw new IllegalArgumentException("Initial config must not be null");
        this.current = new AtomicReference<>(initial);
        this.persister = persister;
        this.persistExecutor = Executors.newSingleThreadExecutor(r -> {
            var t = new Thread(r, "config-persist");
            t.setDaemon(true);
            return t;
        });
    }

    public MonitorConfig snapshot() {
        return current.get();
    }

    /** Number of committed mutations since startup. */
    long version() {
        return version.get();
    }

    public <R> R mutate(ConfigTransaction<R> transaction) {
        writeLock.lock();
        try {
            var outcome = transaction.apply(current.get());
            if (outcome.committed()) {
                current.set(outcome.next());
                version.incrementAndGet();
                schedulePersist();
            }
            return outcome.result();
        } finally {
            writeLock.unlock();
        }
    }

    private void schedulePersist() {
        try {
            persistExecutor.execute(this::persistLatest);
        } catch (RejectedExecutionException e) {
            log.warn("Config store closed, change kept in memory only");
        }
    }

    private void persistLatest() {
        var config = current.get();
        try {
            persister.persist(config);
            log.debug("Persisted config with {} keywords", config.keywords().size());
        } catch (Exception e) {
            log.error("Failed to persist config, in-memory state remains authoritative", e);
        }
    }

    @Override
    public void close() {
        persistExecutor.shutdown();
        try {
            if (!persistExecutor.awaitTermination(CLOSE_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Config persistence did not finish within {}s", CLOSE_TIMEOUT_SECONDS);
                persistExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            persistExecutor.shutdownNow();
        }
    }
}
