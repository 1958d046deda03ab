package com.keywatch.pipeline;

import com.keywatch.channels.MessageSink;
import com.keywatch.channels.MessageTransport;
import com.keywatch.channels.TransportException;
import com.keywatch.commands.CommandParser;
import com.keywatch.commands.CommandProcessor;
import com.keywatch.dedup.DedupCache;
import com.keywatch.dedup.MessageFingerprint;
import com.keywatch.filter.GroupFilter;
import com.keywatch.filter.KeywordMatcher;
import com.keywatch.notify.NotificationDispatcher;
import com.keywatch.observability.MonitorStats;
import com.keywatch.shared.config.ConfigStore;
import com.keywatch.shared.model.IncomingMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Consumes inbound messages, one task per message.
 * <p>
 * Messages from the owner's private chat form the control channel: recognized commands go to the
 * {@link CommandProcessor} on a single thread, in arrival order, and anything else there is ignored
 * and never keyword-matched. All other messages run group filter, keyword match, dedup and dispatch
 * in that order on the worker pool, with no ordering between messages.
 */
public class MonitorPipeline implements MessageSink, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MonitorPipeline.class);

    private final ConfigStore configStore;
    private final GroupFilter groupFilter;
    private final KeywordMatcher keywordMatcher;
    private final DedupCache dedupCache;
    private final NotificationDispatcher dispatcher;
    private final CommandParser commandParser;
    private final CommandProcessor commandProcessor;
    private final MessageTransport transport;
    private final MonitorStats stats;
    private final ExecutorService workers;
    private final ExecutorService control;
    private final Duration shutdownGrace;
    private final AtomicBoolean accepting = new AtomicBoolean(true);

    public MonitorPipeline(ConfigStore configStore, KeywordMatcher keywordMatcher, DedupCache dedupCache,
                           NotificationDispatcher dispatcher, CommandProcessor commandProcessor,
                           MessageTransport transport, MonitorStats stats,
                           ExecutorService workers, Duration shutdownGrace) {
        this.configStore = configStore;
        this.groupFilter = new GroupFilter();
        this.keywordMatcher = keywordMatcher;
        this.dedupCache = dedupCache;
        this.dispatcher = dispatcher;
        this.commandParser = new CommandParser();
        this.commandProcessor = commandProcessor;
        this.transport = transport;
        this.stats = stats;
        this.workers = workers;
        this.control = Executors.newSingleThreadExecutor(r -> {
            var t = new Thread(r, "pipeline-control");
            t.setDaemon(true);
            return t;
        });
        this.shutdownGrace = shutdownGrace;
    }

    public static ExecutorService workerPool(int size) {
        var counter = new AtomicInteger();
        return Executors.newFixedThreadPool(size, r -> {
            var t = new Thread(r, "pipeline-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public void accept(IncomingMessage message) {
        if (!accepting.get()) {
            log.debug("Pipeline stopped, dropping message {} from {}", message.messageId(), message.chatName());
            return;
        }
        var executor = message.chatId() == transport.self().chatId() ? control : workers;
        try {
            executor.execute(() -> handle(message));
        } catch (RejectedExecutionException e) {
            log.debug("Pipeline stopped, dropping message {} from {}", message.messageId(), message.chatName());
        }
    }

    void handle(IncomingMessage message) {
        try {
            if (message.chatId() == transport.self().chatId()) {
                handleControl(message);
            } else {
                process(message);
            }
        } catch (Exception e) {
            log.error("Error handling message {} from {}", message.messageId(), message.chatName(), e);
        }
    }

    /** Runs the matching stages for one message; returns true when a notification went out. */
    boolean process(IncomingMessage message) {
        stats.received();
        if (!message.hasText()) return false;

        var snapshot = configStore.snapshot();
        if (!groupFilter.allow(snapshot.groups(), message.chatId(), message.chatName())) {
            log.debug("Chat {} ({}) filtered out by group rules", message.chatName(), message.chatId());
            return false;
        }

        var match = keywordMatcher.match(snapshot, message.text());
        if (match.isEmpty()) return false;
        stats.matched();

        var dedup = snapshot.duplicates();
        if (dedup.enabled()) {
            var digest = MessageFingerprint.of(message, dedup.includeSender());
            if (dedupCache.checkAndRecord(digest, dedup)) {
                stats.duplicate();
                log.info("Duplicate message in {} suppressed (keywords: {})", message.chatName(), match.joined());
                return false;
            }
        }

        return dispatcher.dispatch(match, message);
    }

    private void handleControl(IncomingMessage message) {
        var command = commandParser.parse(message.text());
        if (command.isEmpty()) {
            log.debug("Ignoring non-command text in control chat");
            return;
        }
        var reply = commandProcessor.execute(command.get());
        try {
            transport.sendMessage(transport.self(), reply);
        } catch (TransportException e) {
            log.error("Failed to send command reply", e);
        }
    }

    /**
     * Stops intake, lets in-flight tasks finish within the grace period, then abandons the rest.
     */
    @Override
    public void close() {
        if (!accepting.compareAndSet(true, false)) return;
        workers.shutdown();
        control.shutdown();
        var deadline = System.nanoTime() + shutdownGrace.toNanos();
        awaitOrAbandon(workers, "queued messages", deadline);
        awaitOrAbandon(control, "queued commands", deadline);
        log.info("Monitor pipeline stopped");
    }

    private void awaitOrAbandon(ExecutorService executor, String what, long deadline) {
        try {
            if (!executor.awaitTermination(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS)) {
                var abandoned = executor.shutdownNow();
                log.warn("Shutdown grace period of {}s elapsed, abandoned {} {}",
                        shutdownGrace.toSeconds(), abandoned.size(), what);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }
}
