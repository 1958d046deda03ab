package com.keywatch.shared.model;

import java.time.Instant;

public record IncomingMessage(
    long chatId,
    String chatName,
    long senderId,
    String senderName,
    String text,
    Instant timestamp,
    MediaAttachment media,
    int messageId
) {
    public boolean hasMedia() {
        return media != null && !media.kinds().isEmpty();
    }

    public boolean hasText() {
        return text != null && !text.isBlank();
    }
}
