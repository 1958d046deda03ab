package com.keywatch.pipeline;

import com.keywatch.commands.CommandProcessor;
import com.keywatch.dedup.DedupCache;
import com.keywatch.filter.KeywordMatcher;
import com.keywatch.notify.NotificationDispatcher;
import com.keywatch.observability.MonitorStats;
import com.keywatch.shared.config.ConfigPersister;
import com.keywatch.shared.config.ConfigStore;
import com.keywatch.shared.config.ConfigTransaction.Outcome;
import com.keywatch.shared.config.MonitorConfig;
import com.keywatch.shared.model.GroupRule;
import com.keywatch.shared.model.Keyword;
import com.keywatch.support.FakeTransport;
import com.keywatch.support.Messages;
import com.keywatch.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class MonitorPipelineTest {

    private final MutableClock clock = MutableClock.utc("2024-03-01T12:00:00Z");
    private final FakeTransport transport = new FakeTransport();
    private final MonitorStats stats = new MonitorStats(clock);
    private final DedupCache dedupCache = new DedupCache(clock);
    private final ConfigStore store = new ConfigStore(
            MonitorConfig.defaults().withKeywords(List.of(new Keyword("python"))), ConfigPersister.NONE);
    private final NotificationDispatcher dispatcher = new NotificationDispatcher(transport, store, stats, clock);

    private MonitorPipeline pipeline(NotificationDispatcher dispatcher) {
        var commands = new CommandProcessor(store, dedupCache, dispatcher, stats);
        return new MonitorPipeline(store, new KeywordMatcher(), dedupCache, dispatcher, commands, transport,
                stats, MonitorPipeline.workerPool(2), Duration.ofSeconds(5));
    }

    @AfterEach
    void closeStore() {
        store.close();
    }

    @Test
    void nonMatchingMessageLeavesNoTrace() {
        var mockDispatcher = mock(NotificationDispatcher.class);
        try (var pipeline = pipeline(mockDispatcher)) {
            assertFalse(pipeline.process(Messages.inGroup("Jobs", "Looking for a Rust developer")));
        }
        verify(mockDispatcher, never()).dispatch(any(), any());
        assertEquals(0, dedupCache.size());
        assertEquals(1, stats.snapshot().received());
        assertEquals(0, stats.snapshot().matched());
    }

    @Test
    void repeatWithinWindowIsSuppressed() {
        try (var pipeline = pipeline(dispatcher)) {
            assertTrue(pipeline.process(Messages.inGroup("Jobs", "I love Python!")));
            clock.advance(Duration.ofMinutes(1));
            assertFalse(pipeline.process(Messages.inGroup("Jobs", "I love Python!")));
        }
        assertEquals(1, transport.sent.size());
        assertTrue(transport.sent.get(0).text().startsWith("Keywords: python\n"));
        assertEquals(FakeTransport.OWNER_ID, transport.sent.get(0).target().chatId());
        assertEquals(1, stats.snapshot().duplicates());
    }

    @Test
    void repeatAfterExpiryNotifiesAgain() {
        try (var pipeline = pipeline(dispatcher)) {
            assertTrue(pipeline.process(Messages.inGroup("Jobs", "python")));
            clock.advance(Duration.ofHours(25));
            assertTrue(pipeline.process(Messages.inGroup("Jobs", "python")));
        }
        assertEquals(2, transport.sent.size());
    }

    @Test
    void disabledDedupNotifiesEveryTime() {
        store.mutate(c -> Outcome.commit(
                c.withDuplicates(c.duplicates().withEnabled(false)), null));
        try (var pipeline = pipeline(dispatcher)) {
            pipeline.process(Messages.inGroup("Jobs", "python"));
            pipeline.process(Messages.inGroup("Jobs", "python"));
        }
        assertEquals(2, transport.sent.size());
        assertEquals(0, dedupCache.size());
    }

    @Test
    void blacklistedChatIsSkipped() {
        store.mutate(c -> Outcome.commit(
                c.withGroups(new GroupRule(List.of("Jobs"), List.of("Jobs"))), null));
        try (var pipeline = pipeline(dispatcher)) {
            assertFalse(pipeline.process(Messages.inGroup("Jobs", "python")));
        }
        assertTrue(transport.sent.isEmpty());
    }

    @Test
    void controlChatRunsCommandsAndReplies() {
        try (var pipeline = pipeline(dispatcher)) {
            pipeline.handle(Messages.text(FakeTransport.OWNER_ID, "Saved alerts", FakeTransport.OWNER_ID, "/add golang"));
        }
        assertEquals(2, store.snapshot().keywords().size());
        assertEquals(List.of("Keyword 'golang' added.\n\nTotal keywords: 2"), transport.texts());
    }

    @Test
    void controlChatTextIsNeverMatched() {
        try (var pipeline = pipeline(dispatcher)) {
            pipeline.handle(Messages.text(FakeTransport.OWNER_ID, "Saved alerts", FakeTransport.OWNER_ID,
                    "note to self: python meetup"));
        }
        assertTrue(transport.sent.isEmpty());
        assertEquals(0, stats.snapshot().received());
    }

    @Test
    void controlCommandsRunInArrivalOrder() {
        store.mutate(c -> Outcome.commit(c.withKeywords(List.of()), null));
        var pipeline = pipeline(dispatcher);
        for (int i = 0; i < 200; i++) {
            pipeline.accept(Messages.text(FakeTransport.OWNER_ID, "Saved alerts", FakeTransport.OWNER_ID, "/add k" + i));
        }
        pipeline.accept(Messages.text(FakeTransport.OWNER_ID, "Saved alerts", FakeTransport.OWNER_ID, "/remove 1"));
        pipeline.close();

        var patterns = store.snapshot().keywords().stream().map(Keyword::pattern).toList();
        assertEquals(IntStream.range(1, 200).mapToObj(i -> "k" + i).toList(), patterns);
        assertEquals("Keyword 'k0' removed.\n\nRemaining keywords: 199", transport.texts().get(200));
    }

    @Test
    void closeDrainsAcceptedMessagesThenDropsNewOnes() {
        var pipeline = pipeline(dispatcher);
        for (int i = 0; i < 5; i++) {
            pipeline.accept(Messages.inGroup("Jobs", "python post " + i));
        }
        pipeline.close();
        assertEquals(5, transport.sent.size());

        pipeline.accept(Messages.inGroup("Jobs", "python late"));
        assertEquals(5, stats.snapshot().received());
    }
}
