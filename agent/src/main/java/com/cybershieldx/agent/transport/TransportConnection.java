package com.cybershieldx.agent.transport;

import java.util.concurrent.CompletableFuture;

/**
 * One duplex text connection. Writes are delivered in call order.
 */
public interface TransportConnection {

    /**
     * Queue a text frame; the future fails when the write fails
     */
    CompletableFuture<Void> send(String text);

    void close();
}
