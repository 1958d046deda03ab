package com.keywatch.dedup;

import com.keywatch.shared.model.IncomingMessage;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Content digest used as the dedup key. Text is trimmed, lower-cased and whitespace-collapsed so
 * cross-posts that differ only in spacing or case collapse to one entry.
 */
public final class MessageFingerprint {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private MessageFingerprint() {
    }

    public static String of(IncomingMessage message, boolean includeSender) {
        var input = normalize(message.text());
        if (includeSender && message.senderId() != 0) {
            input += "_sender_" + message.senderId();
        }
        return sha256(input);
    }

    static String normalize(String text) {
        if (text == null) return "";
        return WHITESPACE.matcher(text.strip().toLowerCase(Locale.ROOT)).replaceAll(" ");
    }

    private static String sha256(String input) {
        try {
            var digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
