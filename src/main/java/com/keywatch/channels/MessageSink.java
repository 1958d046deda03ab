package com.keywatch.channels;

import com.keywatch.shared.model.IncomingMessage;

/** Receives inbound messages on the transport's polling thread; implementations must not block. */
@FunctionalInterface
public interface MessageSink {
    void accept(IncomingMessage message);
}
