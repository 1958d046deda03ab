package com.keywatch.channels;

/**
 * Inbound half of a chat transport. {@link #start} begins delivering every message the account can
 * see to the sink; {@link #stop} releases the connection.
 */
public interface ChannelAdapter {
    String id();
    void start(MessageSink sink);
    void stop();
}
