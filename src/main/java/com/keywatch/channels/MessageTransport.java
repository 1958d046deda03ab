package com.keywatch.channels;

import com.keywatch.shared.model.ChatRef;
import com.keywatch.shared.model.IncomingMessage;

/**
 * Outbound half of the chat transport. Every call may block on network I/O.
 */
public interface MessageTransport {

    /** The owner's private chat: control channel and the "self" notification target. */
    ChatRef self();

    void sendMessage(ChatRef target, String text) throws TransportException;

    void forwardMessage(ChatRef target, IncomingMessage source) throws TransportException;

    /** Looks up a public handle such as {@code @channel}. */
    ChatRef resolveTarget(String handle) throws TransportException;

    ChatRef joinChannel(String inviteLink) throws TransportException;

    /** Fails when the account may not post to {@code target}. */
    void checkCanPost(ChatRef target) throws TransportException;
}
