package com.keywatch.notify;

import com.keywatch.channels.MessageTransport;
import com.keywatch.channels.TransportException;
import com.keywatch.filter.MatchResult;
import com.keywatch.observability.MonitorStats;
import com.keywatch.shared.config.ConfigStore;
import com.keywatch.shared.model.ChatRef;
import com.keywatch.shared.model.IncomingMessage;
import com.keywatch.shared.model.NotificationTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Formats matches and delivers them to the configured target.
 * <p>
 * Everything needed for a send is read from one config snapshot up front; no store lock is held
 * while the transport blocks. Resolved handles and joined invite links are cached per target value,
 * so changing the target never reuses a stale destination.
 */
public class NotificationDispatcher {

    private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

    private final MessageTransport transport;
    private final ConfigStore configStore;
    private final NotificationFormatter formatter;
    private final MonitorStats stats;
    private final Clock clock;
    private final ConcurrentMap<NotificationTarget, CompletableFuture<ChatRef>> resolved = new ConcurrentHashMap<>();

    public NotificationDispatcher(MessageTransport transport, ConfigStore configStore,
                                  MonitorStats stats, Clock clock) {
        this.transport = transport;
        this.configStore = configStore;
        this.formatter = new NotificationFormatter(clock.getZone());
        this.stats = stats;
        this.clock = clock;
    }

    public void send(MatchResult match, IncomingMessage message) throws DispatchException {
        var snapshot = configStore.snapshot();
        var payload = formatter.format(match, message, snapshot.settings());
        deliver(snapshot.target(), payload, message);
    }

    /**
     * Pipeline entry point. Failures are logged and dropped; a broken target must not build a backlog.
     */
    public boolean dispatch(MatchResult match, IncomingMessage message) {
        try {
            send(match, message);
            stats.sent();
            log.info("Notification sent for keywords [{}] in {}", match.joined(), message.chatName());
            return true;
        } catch (DispatchException e) {
            stats.failed();
            log.warn("Notification dispatch failed for keywords [{}] in {}: {}",
                    match.joined(), message.chatName(), e.getMessage());
            return false;
        }
    }

    /** Sends a synthetic notification to the current target. */
    public ChatRef sendTest() throws DispatchException {
        var snapshot = configStore.snapshot();
        var message = new IncomingMessage(0, "KeyWatch", 0, "KeyWatch",
                "Test notification. If you can read this, alerts reach " + snapshot.target().describe() + ".",
                clock.instant(), null, 0);
        var payload = formatter.format(new MatchResult(List.of("test")), message, snapshot.settings());
        return deliver(snapshot.target(), payload, message);
    }

    /** Resolves a candidate target and checks post permission without sending or persisting anything. */
    public ChatRef probe(NotificationTarget target) throws DispatchException {
        var ref = resolve(target);
        try {
            transport.checkCanPost(ref);
            return ref;
        } catch (TransportException e) {
            throw new DispatchException("No permission to post to " + target.describe() + ": " + e.getMessage(), e);
        }
    }

    private ChatRef deliver(NotificationTarget target, String payload, IncomingMessage source) throws DispatchException {
        var ref = resolve(target);
        try {
            if (source.hasMedia()) {
                transport.forwardMessage(ref, source);
            }
            transport.sendMessage(ref, payload);
            return ref;
        } catch (TransportException e) {
            resolved.remove(target);
            throw new DispatchException("Failed to send to " + target.describe() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Concurrent first sends to one target share a single lookup or join; a failed attempt is
     * forgotten so the next send tries again.
     */
    ChatRef resolve(NotificationTarget target) throws DispatchException {
        if (target instanceof NotificationTarget.SelfChannel) {
            return transport.self();
        }
        if (target instanceof NotificationTarget.ChatId chatId) {
            return ChatRef.of(chatId.id());
        }
        var fresh = new CompletableFuture<ChatRef>();
        var pending = resolved.putIfAbsent(target, fresh);
        if (pending != null) {
            return await(pending);
        }
        try {
            var ref = lookup(target);
            fresh.complete(ref);
            return ref;
        } catch (DispatchException | RuntimeException e) {
            resolved.remove(target, fresh);
            fresh.completeExceptionally(e);
            throw e;
        }
    }

    private ChatRef lookup(NotificationTarget target) throws DispatchException {
        if (target instanceof NotificationTarget.PublicChannel channel) {
            try {
                return transport.resolveTarget(channel.handle());
            } catch (TransportException e) {
                throw new DispatchException("Cannot resolve " + channel.handle() + ": " + e.getMessage(), e);
            }
        }
        if (target instanceof NotificationTarget.InviteLink invite) {
            try {
                var ref = transport.joinChannel(invite.link());
                log.info("Joined notification channel {} via invite link", ref.title());
                return ref;
            } catch (TransportException e) {
                throw new DispatchException("Failed to join " + invite.link() + ": " + e.getMessage(), e);
            }
        }
        throw new DispatchException("Unsupported notification target: " + target);
    }

    private static ChatRef await(CompletableFuture<ChatRef> pending) throws DispatchException {
        try {
            return pending.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof DispatchException cause) {
                throw new DispatchException(cause.getMessage(), cause);
            }
            throw e;
        }
    }
}
