package com.keywatch.channels;

import com.keywatch.shared.model.ChatRef;
import com.keywatch.shared.model.IncomingMessage;
import com.keywatch.shared.model.MediaAttachment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.telegram.telegrambots.client.okhttp.OkHttpTelegramClient;
import org.telegram.telegrambots.longpolling.TelegramBotsLongPollingApplication;
import org.telegram.telegrambots.longpolling.util.LongPollingSingleThreadUpdateConsumer;
import org.telegram.telegrambots.meta.api.methods.ForwardMessage;
import org.telegram.telegrambots.meta.api.methods.GetMe;
import org.telegram.telegrambots.meta.api.methods.groupadministration.GetChat;
import org.telegram.telegrambots.meta.api.methods.groupadministration.GetChatMember;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.message.Message;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.generics.TelegramClient;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Bot API transport. The bot must be a member of every monitored group (with privacy mode off)
 * and the owner talks to it in a private chat, which doubles as the "self" target.
 */
public class TelegramAdapter implements ChannelAdapter, MessageTransport, LongPollingSingleThreadUpdateConsumer {

    private static final Logger log = LoggerFactory.getLogger(TelegramAdapter.class);
    static final int MAX_MESSAGE_LENGTH = 4096;
    private static final Set<String> POSTING_STATUSES = Set.of("creator", "administrator", "member");

    private final String botToken;
    private final ChatRef self;
    private final TelegramClient telegramClient;
    private TelegramBotsLongPollingApplication bot;
    private MessageSink sink;
    private volatile Long botUserId;

    public TelegramAdapter(String botToken, long ownerId) {
        this.botToken = botToken;
        this.self = new ChatRef(ownerId, "Saved alerts");
        this.telegramClient = new OkHttpTelegramClient(botToken);
    }

    @Override
    public String id() {
        return "telegram";
    }

    @Override
    public void start(MessageSink sink) {
        this.sink = sink;
        try {
            bot = new TelegramBotsLongPollingApplication();
            bot.registerBot(botToken, this);
            var me = telegramClient.execute(new GetMe());
            botUserId = me.getId();
            log.info("Telegram bot started as @{}", me.getUserName());
        } catch (Exception e) {
            throw new RuntimeException("Failed to start Telegram bot", e);
        }
    }

    @Override
    public void consume(Update update) {
        Message msg = null;
        if (update.hasMessage()) {
            msg = update.getMessage();
        } else if (update.hasChannelPost()) {
            msg = update.getChannelPost();
        }
        if (msg == null || sink == null) return;
        var text = msg.hasText() ? msg.getText() : msg.getCaption();
        if (text == null || text.isBlank()) return;
        sink.accept(toIncoming(msg, text));
    }

    static IncomingMessage toIncoming(Message msg, String text) {
        var chat = msg.getChat();
        String chatName;
        if (chat.getTitle() != null) {
            chatName = chat.getTitle();
        } else if (chat.getFirstName() != null) {
            chatName = join(chat.getFirstName(), chat.getLastName());
        } else {
            chatName = "Unknown Chat";
        }

        long senderId = 0;
        String senderName = "Unknown Sender";
        var from = msg.getFrom();
        if (from != null) {
            senderId = from.getId();
            senderName = join(from.getFirstName(), from.getLastName());
            if (from.getUserName() != null && !from.getUserName().isBlank()) {
                senderName += " (@" + from.getUserName() + ")";
            }
        } else if (msg.getSenderChat() != null) {
            senderId = msg.getSenderChat().getId();
            senderName = msg.getSenderChat().getTitle();
        }

        var timestamp = msg.getDate() != null ? Instant.ofEpochSecond(msg.getDate()) : Instant.now();
        return new IncomingMessage(msg.getChatId(), chatName, senderId, senderName, text,
                timestamp, media(msg), msg.getMessageId());
    }

    private static MediaAttachment media(Message msg) {
        var kinds = new ArrayList<String>();
        if (msg.hasPhoto()) kinds.add("Photo");
        if (msg.hasVideo()) kinds.add("Video");
        if (msg.hasDocument()) kinds.add("Document");
        if (msg.hasSticker()) kinds.add("Sticker");
        if (msg.hasVoice()) kinds.add("Voice");
        if (msg.hasVideoNote()) kinds.add("Video Note");
        if (msg.hasAudio()) kinds.add("Audio");
        return kinds.isEmpty() ? null : new MediaAttachment(kinds);
    }

    private static String join(String first, String last) {
        return (first + " " + (last == null ? "" : last)).strip();
    }

    @Override
    public ChatRef self() {
        return self;
    }

    @Override
    public void sendMessage(ChatRef target, String text) throws TransportException {
        var chatId = String.valueOf(target.chatId());
        for (var chunk : chunks(text)) {
            try {
                telegramClient.execute(new SendMessage(chatId, chunk));
            } catch (TelegramApiException e) {
                throw new TransportException("sendMessage to " + chatId + " failed: " + e.getMessage(), e);
            }
        }
    }

    /** Bot API rejects messages over 4096 characters; pieces never split a surrogate pair. */
    static List<String> chunks(String text) {
        var pieces = new ArrayList<String>();
        int start = 0;
        while (start < text.length()) {
            int end = Math.min(start + MAX_MESSAGE_LENGTH, text.length());
            if (end < text.length() && Character.isHighSurrogate(text.charAt(end - 1))) end--;
            pieces.add(text.substring(start, end));
            start = end;
        }
        return pieces;
    }

    @Override
    public void forwardMessage(ChatRef target, IncomingMessage source) throws TransportException {
        var forward = ForwardMessage.builder()
                .chatId(String.valueOf(target.chatId()))
                .fromChatId(String.valueOf(source.chatId()))
                .messageId(source.messageId())
                .build();
        try {
            telegramClient.execute(forward);
        } catch (TelegramApiException e) {
            throw new TransportException("forwardMessage to " + target.chatId() + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public ChatRef resolveTarget(String handle) throws TransportException {
        var chatId = handle.startsWith("@") ? handle : "@" + handle;
        try {
            var chat = telegramClient.execute(GetChat.builder().chatId(chatId).build());
            var title = chat.getTitle() != null ? chat.getTitle() : chatId;
            return new ChatRef(chat.getId(), title);
        } catch (TelegramApiException e) {
            throw new TransportException("Chat " + chatId + " not found: " + e.getMessage(), e);
        }
    }

    @Override
    public ChatRef joinChannel(String inviteLink) throws TransportException {
        // The Bot API has no equivalent of importChatInvite
        throw new TransportException("Bots cannot join chats from invite links. Add the bot to the channel "
                + "as an administrator and use its numeric chat id or @handle instead.");
    }

    @Override
    public void checkCanPost(ChatRef target) throws TransportException {
        if (target.chatId() == self.chatId()) return;
        try {
            if (botUserId == null) {
                botUserId = telegramClient.execute(new GetMe()).getId();
            }
            var member = telegramClient.execute(GetChatMember.builder()
                    .chatId(String.valueOf(target.chatId()))
                    .userId(botUserId)
                    .build());
            if (!POSTING_STATUSES.contains(member.getStatus())) {
                throw new TransportException("Bot status in " + target.chatId() + " is '" + member.getStatus() + "'");
            }
        } catch (TelegramApiException e) {
            throw new TransportException("Cannot check membership in " + target.chatId() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void stop() {
        if (bot != null) {
            try {
                bot.close();
            } catch (Exception e) {
                log.error("Failed to stop Telegram bot", e);
            }
        }
    }
}
