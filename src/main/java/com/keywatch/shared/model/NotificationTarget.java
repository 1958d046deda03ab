package com.keywatch.shared.model;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Where alerts go. Exactly one target is active at a time.
 */
public interface NotificationTarget {

    Pattern CHAT_ID = Pattern.compile("-?\\d+");
    Pattern USERNAME = Pattern.compile("[A-Za-z][A-Za-z0-9_]{3,31}");
    Pattern INVITE_LINK = Pattern.compile("(?:https?://)?(?:t\\.me|telegram\\.me)/(?:\\+|joinchat/)([A-Za-z0-9_-]+)/?");
    Pattern PUBLIC_LINK = Pattern.compile("(?:https?://)?(?:t\\.me|telegram\\.me)/([A-Za-z][A-Za-z0-9_]{3,31})/?");

    /** Canonical form written back to the config document. */
    String configValue();

    String describe();

    record SelfChannel() implements NotificationTarget {
        @Override
        public String configValue() {
            return "me";
        }

        @Override
        public String describe() {
            return "self (owner chat)";
        }
    }

    record PublicChannel(String handle) implements NotificationTarget {
        @Override
        public String configValue() {
            return handle;
        }

        @Override
        public String describe() {
            return "public channel " + handle;
        }
    }

    record ChatId(long id) implements NotificationTarget {
        @Override
        public String configValue() {
            return String.valueOf(id);
        }

        @Override
        public String describe() {
            return "chat id " + id;
        }
    }

    record InviteLink(String hash) implements NotificationTarget {
        public String link() {
            return "https://t.me/+" + hash;
        }

        @Override
        public String configValue() {
            return link();
        }

        @Override
        public String describe() {
            return "invite link " + link();
        }
    }

    static NotificationTarget self() {
        return new SelfChannel();
    }

    static NotificationTarget parse(String raw) {
        var value = raw == null ? "" : raw.strip();
        var lowered = value.toLowerCase(Locale.ROOT);
        if (value.isEmpty() || lowered.equals("me") || lowered.equals("self")) {
            return new SelfChannel();
        }
        if (CHAT_ID.matcher(value).matches()) {
            try {
                return new ChatId(Long.parseLong(value));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Chat id out of range: " + value, e);
            }
        }
        var invite = INVITE_LINK.matcher(value);
        if (invite.matches()) {
            return new InviteLink(invite.group(1));
        }
        if (value.startsWith("+") && value.length() > 1) {
            return new InviteLink(value.substring(1));
        }
        var link = PUBLIC_LINK.matcher(value);
        if (link.matches()) {
            return new PublicChannel("@" + link.group(1));
        }
        var handle = value.startsWith("@") ? value.substring(1) : value;
        if (USERNAME.matcher(handle).matches()) {
            return new PublicChannel("@" + handle);
        }
        throw new IllegalArgumentException("Unrecognized notification target: " + value);
    }
}
