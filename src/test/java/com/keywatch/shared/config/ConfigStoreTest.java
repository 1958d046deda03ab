package com.keywatch.shared.config;

import com.keywatch.shared.config.ConfigTransaction.Outcome;
import com.keywatch.shared.model.GroupRule.ListKind;
import com.keywatch.shared.model.Keyword;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ConfigStoreTest {

    private static Outcome<Integer> append(MonitorConfig current, String pattern) {
        var next = new ArrayList<>(current.keywords());
        next.add(new Keyword(pattern));
        return Outcome.commit(current.withKeywords(next), next.size());
    }

    @Test
    void committedChangeIsVisibleAndPersisted() throws Exception {
        var persisted = new CopyOnWriteArrayList<MonitorConfig>();
        var latch = new CountDownLatch(1);
        try (var store = new ConfigStore(MonitorConfig.defaults(), c -> {
            persisted.add(c);
            latch.countDown();
        })) {
            int size = store.mutate(current -> append(current, "python"));
            assertEquals(1, size);
            assertEquals(1, store.snapshot().keywords().size());
            assertEquals(1, store.version());
            assertTrue(latch.await(2, TimeUnit.SECONDS));
        }
        assertEquals("python", persisted.get(persisted.size() - 1).keywords().get(0).pattern());
    }

    @Test
    void unchangedOutcomeSkipsPersistence() {
        var calls = new AtomicInteger();
        try (var store = new ConfigStore(MonitorConfig.defaults(), c -> calls.incrementAndGet())) {
            var before = store.snapshot();
            assertEquals("nothing", store.mutate(current -> Outcome.unchanged("nothing")));
            assertSame(before, store.snapshot());
            assertEquals(0, store.version());
        }
        assertEquals(0, calls.get());
    }

    @Test
    void persistFailureKeepsInMemoryState() {
        try (var store = new ConfigStore(MonitorConfig.defaults(), c -> {
            throw new ConfigException("disk full");
        })) {
            store.mutate(current -> append(current, "python"));
            store.mutate(current -> append(current, "golang"));
            assertEquals(2, store.snapshot().keywords().size());
        }
    }

    @Test
    void exceptionInsideTransactionLeavesConfigUntouched() {
        try (var store = new ConfigStore(MonitorConfig.defaults(), ConfigPersister.NONE)) {
            assertThrows(IllegalStateException.class, () -> store.mutate(current -> {
                throw new IllegalStateException("boom");
            }));
            assertTrue(store.snapshot().keywords().isEmpty());
            store.mutate(current -> append(current, "still-works"));
            assertEquals(1, store.version());
        }
    }

    @Test
    void concurrentWritersNeverLoseUpdates() throws Exception {
        int writers = 8;
        int perWriter = 50;
        try (var store = new ConfigStore(MonitorConfig.defaults(), ConfigPersister.NONE)) {
            var pool = Executors.newFixedThreadPool(writers);
            for (int w = 0; w < writers; w++) {
                int id = w;
                pool.execute(() -> {
                    for (int i = 0; i < perWriter; i++) {
                        var pattern = "kw-" + id + "-" + i;
                        store.mutate(current -> append(current, pattern));
                    }
                });
            }
            pool.shutdown();
            assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
            assertEquals(writers * perWriter, store.snapshot().keywords().size());
            assertEquals(writers * perWriter, store.version());
        }
    }

    @Test
    void readersNeverSeeTornConfig() throws Exception {
        // keywords and whitelist always grow together; a torn read would show them out of step
        try (var store = new ConfigStore(MonitorConfig.defaults(), ConfigPersister.NONE)) {
            var stop = new AtomicBoolean();
            var torn = new AtomicInteger();
            var reader = new Thread(() -> {
                while (!stop.get()) {
                    var snapshot = store.snapshot();
                    if (snapshot.keywords().size() != snapshot.groups().whitelist().size()) {
                        torn.incrementAndGet();
                    }
                }
            });
            reader.start();
            for (int i = 0; i < 500; i++) {
                var label = "g" + i;
                store.mutate(current -> {
                    var keywords = new ArrayList<>(current.keywords());
                    keywords.add(new Keyword(label));
                    var whitelist = new ArrayList<>(current.groups().whitelist());
                    whitelist.add(label);
                    return Outcome.commit(current.withKeywords(keywords)
                            .withGroups(current.groups().withList(
                                    ListKind.WHITELIST, whitelist)), null);
                });
            }
            stop.set(true);
            reader.join(2000);
            assertEquals(0, torn.get());
            assertEquals(500, store.snapshot().groups().whitelist().size());
        }
    }
}
