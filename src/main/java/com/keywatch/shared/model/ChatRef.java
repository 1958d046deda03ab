package com.keywatch.shared.model;

public record ChatRef(long chatId, String title) {

    public static ChatRef of(long chatId) {
        return new ChatRef(chatId, String.valueOf(chatId));
    }
}
