package com.keywatch.notify;

import com.keywatch.filter.MatchResult;
import com.keywatch.shared.config.MonitorConfig;
import com.keywatch.shared.model.IncomingMessage;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

public class NotificationFormatter {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    static final String ELLIPSIS = "...";

    private final ZoneId zone;

    public NotificationFormatter(ZoneId zone) {
        this.zone = zone;
    }

    public String format(MatchResult match, IncomingMessage message, MonitorConfig.Settings settings) {
        var sb = new StringBuilder();
        sb.append("Keywords: ").append(match.joined()).append('\n');
        sb.append("Group: ").append(orUnknown(message.chatName(), "Unknown Chat")).append('\n');
        sb.append("Sender: ").append(orUnknown(message.senderName(), "Unknown Sender")).append('\n');
        sb.append("Time: ").append(TIME_FORMAT.format(message.timestamp().atZone(zone))).append('\n');
        if (message.hasMedia()) {
            sb.append("Media: ").append(String.join(", ", message.media().kinds())).append('\n');
        }
        sb.append("Message: ").append(truncate(message.text(), settings));
        if (message.messageId() > 0) {
            sb.append('\n').append("Link: ").append(deepLink(message.chatId(), message.messageId()));
        }
        return sb.toString();
    }

    static String truncate(String text, MonitorConfig.Settings settings) {
        var value = text == null ? "" : text;
        if (settings.sendFullMessage() || value.length() <= settings.maxMessageLength()) {
            return value;
        }
        return value.substring(0, cutPoint(value, settings.maxMessageLength())) + ELLIPSIS;
    }

    /** Backs off one char when {@code end} would split a surrogate pair. */
    private static int cutPoint(String text, int end) {
        if (end > 0 && end < text.length() && Character.isHighSurrogate(text.charAt(end - 1))) {
            return end - 1;
        }
        return end;
    }

    /** Supergroup and channel ids carry a -100 prefix that t.me/c links omit. */
    public static String deepLink(long chatId, int messageId) {
        var id = String.valueOf(chatId);
        if (id.startsWith("-100")) {
            id = id.substring(4);
        } else if (chatId < 0) {
            id = String.valueOf(Math.abs(chatId));
        }
        return "https://t.me/c/" + id + "/" + messageId;
    }

    private static String orUnknown(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
